package com.operatorsedge.core.gear;

import com.operatorsedge.core.model.GearMode;
import com.operatorsedge.core.model.GearState;
import com.operatorsedge.core.model.GearTransition;
import com.operatorsedge.core.step.ProposedAction;

import java.util.List;

/**
 * What one gear step did.
 *
 * @param state          gear state to persist
 * @param modeExecuted   mode whose behavior ran this turn
 * @param transition     edge taken this turn, null when the mode did not change
 * @param junction       pause requested by the mode behavior, may be null
 * @param proposedAction action to classify before it may run, may be null
 * @param instruction    what the agent should do next, may be null
 * @param message        summary for the human
 * @param idle           true when there is nothing to do until a human or agent adds work
 * @param progressMarker identifies the step being worked on, null outside ACTIVE
 * @param warnings       non-fatal problems, such as a collaborator failure
 */
public record GearStepResult(
    GearState state,
    GearMode modeExecuted,
    GearTransition transition,
    JunctionRequest junction,
    ProposedAction proposedAction,
    String instruction,
    String message,
    boolean idle,
    String progressMarker,
    List<String> warnings
) {

    public GearStepResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean transitioned() {
        return transition != null;
    }
}
