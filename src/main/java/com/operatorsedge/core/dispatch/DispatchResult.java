package com.operatorsedge.core.dispatch;

import com.operatorsedge.core.junction.PendingJunction;
import com.operatorsedge.core.model.GearMode;
import com.operatorsedge.core.model.JunctionType;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured result of one dispatch turn, printed as JSON for the host.
 *
 * @param status         outcome class
 * @param mode           mode that executed, or the current mode when no step ran
 * @param transitioned   whether the mode changed this turn
 * @param transitionTo   new mode when {@code transitioned}, otherwise null
 * @param junctionHit    whether a junction is pending after this turn
 * @param junctionId     pending junction id
 * @param junctionType   pending junction type
 * @param junctionReason why the junction was raised
 * @param options        decisions the human can answer with
 * @param continueLoop   whether the host should invoke the next turn automatically
 * @param instruction    what the agent should do next
 * @param message        human-readable status line
 * @param warnings       non-fatal problems encountered this turn
 */
public record DispatchResult(
    TurnStatus status,
    GearMode mode,
    boolean transitioned,
    GearMode transitionTo,
    boolean junctionHit,
    String junctionId,
    JunctionType junctionType,
    String junctionReason,
    List<String> options,
    boolean continueLoop,
    String instruction,
    String message,
    List<String> warnings
) {

    public static final List<String> JUNCTION_OPTIONS = List.of("approve", "skip", "dismiss [minutes]", "stop");

    public static final String INTERNAL_ERROR_MESSAGE = "internal error - state unchanged, safe to retry";

    public DispatchResult {
        options = options == null ? List.of() : List.copyOf(options);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static Builder builder(TurnStatus status) {
        return new Builder(status);
    }

    public static final class Builder {
        private final TurnStatus status;
        private GearMode mode;
        private GearMode transitionTo;
        private PendingJunction junction;
        private boolean continueLoop;
        private String instruction;
        private String message;
        private final List<String> warnings = new ArrayList<>();

        private Builder(TurnStatus status) {
            this.status = status;
        }

        public Builder mode(GearMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder transitionTo(GearMode transitionTo) {
            this.transitionTo = transitionTo;
            return this;
        }

        public Builder junction(PendingJunction junction) {
            this.junction = junction;
            return this;
        }

        public Builder continueLoop(boolean continueLoop) {
            this.continueLoop = continueLoop;
            return this;
        }

        public Builder instruction(String instruction) {
            this.instruction = instruction;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings.addAll(warnings);
            return this;
        }

        public DispatchResult build() {
            boolean hit = junction != null;
            return new DispatchResult(
                    status,
                    mode,
                    transitionTo != null,
                    transitionTo,
                    hit,
                    hit ? junction.id() : null,
                    hit ? junction.type() : null,
                    hit ? junction.reason() : null,
                    hit ? JUNCTION_OPTIONS : List.of(),
                    continueLoop,
                    instruction,
                    message,
                    warnings);
        }
    }
}
