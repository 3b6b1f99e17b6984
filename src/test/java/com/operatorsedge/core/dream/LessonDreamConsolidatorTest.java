package com.operatorsedge.core.dream;

import com.operatorsedge.core.plan.PlanContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LessonDreamConsolidatorTest {

    private final LessonDreamConsolidator consolidator = new LessonDreamConsolidator();

    private static PlanContext notes(List<String> risks, List<String> lessons) {
        return new PlanContext(null, 0, List.of(), List.of(), risks, lessons);
    }

    @Test
    @DisplayName("Risks are proposed before lessons")
    void risksFirst() {
        List<DreamProposal> proposals = consolidator.propose(
                notes(List.of("Token expiry"), List.of("Pin tool versions")));

        assertEquals(2, proposals.size());
        assertEquals(new DreamProposal("Mitigate risk: Token expiry", "risk"), proposals.get(0));
        assertEquals(new DreamProposal("Apply lesson across the codebase: Pin tool versions", "lesson"),
                proposals.get(1));
    }

    @Test
    @DisplayName("Duplicates are dropped and the list is bounded")
    void dedupedAndBounded() {
        List<DreamProposal> proposals = consolidator.propose(notes(
                List.of("a", "a", "b", "c", "d"), List.of("e", "f")));

        assertEquals(LessonDreamConsolidator.MAX_PROPOSALS, proposals.size());
        assertEquals(proposals.size(), proposals.stream().distinct().count());
    }

    @Test
    @DisplayName("No notes, no proposals")
    void empty() {
        assertTrue(consolidator.propose(PlanContext.empty()).isEmpty());
    }
}
