package com.operatorsedge.core.dispatch;

import java.util.ArrayList;
import java.util.List;

/**
 * Session counters of the dispatch loop, persisted in {@code loop_state.json}.
 *
 * @param sessionIterations    gear steps taken since the session started or was reset
 * @param stuckCount           consecutive turns on the same step without progress
 * @param lastProgressMarker   marker of the step worked on last turn, null outside ACTIVE
 * @param stopped              true after a {@code stop}, until {@code start}
 * @param approvedFingerprints junctions approved once; the next identical one proceeds
 * @param skippedFingerprints  junctions skipped for the rest of the session
 * @param lastDecision         last human decision word applied
 */
public record LoopState(
    int sessionIterations,
    int stuckCount,
    String lastProgressMarker,
    boolean stopped,
    List<String> approvedFingerprints,
    List<String> skippedFingerprints,
    String lastDecision
) {

    public static final int FINGERPRINT_CAP = 10;

    public LoopState {
        sessionIterations = Math.max(0, sessionIterations);
        stuckCount = Math.max(0, stuckCount);
        approvedFingerprints = approvedFingerprints == null ? List.of() : List.copyOf(approvedFingerprints);
        skippedFingerprints = skippedFingerprints == null ? List.of() : List.copyOf(skippedFingerprints);
    }

    public static LoopState initial() {
        return new LoopState(0, 0, null, false, List.of(), List.of(), null);
    }

    /**
     * Clears the counters; approvals and skips are kept.
     */
    public LoopState resetCounters(boolean stopped, String decision) {
        return new LoopState(0, 0, null, stopped, approvedFingerprints, skippedFingerprints, decision);
    }

    public LoopState withDecision(String decision) {
        return new LoopState(sessionIterations, stuckCount, lastProgressMarker, stopped,
                approvedFingerprints, skippedFingerprints, decision);
    }

    public LoopState withApproved(String fingerprint) {
        return new LoopState(sessionIterations, stuckCount, lastProgressMarker, stopped,
                appendBounded(approvedFingerprints, fingerprint), skippedFingerprints, lastDecision);
    }

    public LoopState withSkipped(String fingerprint) {
        return new LoopState(sessionIterations, stuckCount, lastProgressMarker, stopped,
                approvedFingerprints, appendBounded(skippedFingerprints, fingerprint), lastDecision);
    }

    public LoopState consumeApproval(String fingerprint) {
        var remaining = new ArrayList<>(approvedFingerprints);
        remaining.remove(fingerprint);
        return new LoopState(sessionIterations, stuckCount, lastProgressMarker, stopped,
                remaining, skippedFingerprints, lastDecision);
    }

    public LoopState withProgress(int iterations, int stuck, String marker) {
        return new LoopState(iterations, stuck, marker, stopped,
                approvedFingerprints, skippedFingerprints, lastDecision);
    }

    public LoopState withStopped(boolean value) {
        return new LoopState(sessionIterations, stuckCount, lastProgressMarker, value,
                approvedFingerprints, skippedFingerprints, lastDecision);
    }

    private static List<String> appendBounded(List<String> list, String value) {
        var updated = new ArrayList<>(list);
        updated.remove(value);
        updated.add(value);
        while (updated.size() > FINGERPRINT_CAP) {
            updated.remove(0);
        }
        return updated;
    }
}
