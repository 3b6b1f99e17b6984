package com.operatorsedge.core.dream;

import com.operatorsedge.core.plan.PlanContext;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Turns recorded risks and lessons into candidate objectives. Risks come first since
 * an unmitigated risk is the more urgent follow-up.
 */
@Service
public class LessonDreamConsolidator implements DreamConsolidator {

    static final int MAX_PROPOSALS = 5;

    @Override
    public List<DreamProposal> propose(PlanContext plan) {
        var seen = new LinkedHashSet<String>();
        var proposals = new ArrayList<DreamProposal>();
        for (String risk : plan.risks()) {
            add(proposals, seen, "Mitigate risk: " + risk, "risk");
        }
        for (String lesson : plan.lessons()) {
            add(proposals, seen, "Apply lesson across the codebase: " + lesson, "lesson");
        }
        return proposals;
    }

    private static void add(List<DreamProposal> proposals, LinkedHashSet<String> seen, String objective, String basis) {
        if (proposals.size() < MAX_PROPOSALS && seen.add(objective)) {
            proposals.add(new DreamProposal(objective, basis));
        }
    }
}
