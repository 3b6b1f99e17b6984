package com.operatorsedge.core.step;

import com.operatorsedge.core.model.JunctionType;

/**
 * Result of executing (or preparing) the next plan step.
 *
 * @param stepsCompleted     number of completed steps in the plan
 * @param junctionType       pause requested by the step itself, {@link JunctionType#NONE} otherwise
 * @param junctionReason     why the step asked to pause, null when it did not
 * @param objectiveCompleted true when no unfinished step is left
 * @param proposedAction     action to classify before it may run, may be null
 * @param instruction        what the agent should do next
 * @param error              failure message, null on success
 */
public record StepOutcome(
    int stepsCompleted,
    JunctionType junctionType,
    String junctionReason,
    boolean objectiveCompleted,
    ProposedAction proposedAction,
    String instruction,
    String error
) {

    public StepOutcome {
        junctionType = junctionType == null ? JunctionType.NONE : junctionType;
    }

    public static StepOutcome proceed(int stepsCompleted, String instruction, ProposedAction action) {
        return new StepOutcome(stepsCompleted, JunctionType.NONE, null, false, action, instruction, null);
    }

    public static StepOutcome paused(int stepsCompleted, JunctionType type, String reason, String instruction) {
        return new StepOutcome(stepsCompleted, type, reason, false, null, instruction, null);
    }

    public static StepOutcome completed(int stepsCompleted) {
        return new StepOutcome(stepsCompleted, JunctionType.NONE, null, true, null,
                "All plan steps are completed", null);
    }

    public static StepOutcome failed(int stepsCompleted, String error) {
        return new StepOutcome(stepsCompleted, JunctionType.NONE, null, false, null, null, error);
    }

    public boolean junctionHit() {
        return junctionType.isPausing();
    }

    public boolean isError() {
        return error != null;
    }
}
