package com.operatorsedge.core.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoopStateTest {

    @Test
    @DisplayName("Fingerprint lists are bounded and keep the newest")
    void fingerprintsBounded() {
        LoopState state = LoopState.initial();
        for (int i = 0; i < LoopState.FINGERPRINT_CAP + 3; i++) {
            state = state.withSkipped("fp" + i);
        }

        assertEquals(LoopState.FINGERPRINT_CAP, state.skippedFingerprints().size());
        assertFalse(state.skippedFingerprints().contains("fp0"));
        assertTrue(state.skippedFingerprints().contains("fp12"));
    }

    @Test
    @DisplayName("Re-adding a fingerprint moves it to the end without duplicating")
    void noDuplicates() {
        LoopState state = LoopState.initial().withApproved("a").withApproved("b").withApproved("a");

        assertEquals(List.of("b", "a"), state.approvedFingerprints());
    }

    @Test
    @DisplayName("An approval is consumed once")
    void consumeApproval() {
        LoopState state = LoopState.initial().withApproved("a").consumeApproval("a");

        assertTrue(state.approvedFingerprints().isEmpty());
        assertEquals(state, state.consumeApproval("a"));
    }

    @Test
    @DisplayName("Resetting counters keeps approvals and skips")
    void resetKeepsFingerprints() {
        LoopState state = LoopState.initial()
                .withProgress(12, 2, "step:1:1")
                .withApproved("a")
                .withSkipped("s")
                .resetCounters(true, "stop");

        assertEquals(0, state.sessionIterations());
        assertEquals(0, state.stuckCount());
        assertNull(state.lastProgressMarker());
        assertTrue(state.stopped());
        assertEquals("stop", state.lastDecision());
        assertEquals(List.of("a"), state.approvedFingerprints());
        assertEquals(List.of("s"), state.skippedFingerprints());
    }
}
