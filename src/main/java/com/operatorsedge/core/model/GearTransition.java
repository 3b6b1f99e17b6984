package com.operatorsedge.core.model;

import java.util.Optional;

/**
 * The five legal mode-to-mode edges. Any other pair is not a transition.
 */
public enum GearTransition {
    ACTIVE_TO_PATROL(GearMode.ACTIVE, GearMode.PATROL),
    PATROL_TO_ACTIVE(GearMode.PATROL, GearMode.ACTIVE),
    PATROL_TO_DREAM(GearMode.PATROL, GearMode.DREAM),
    ACTIVE_TO_DREAM(GearMode.ACTIVE, GearMode.DREAM),
    DREAM_TO_ACTIVE(GearMode.DREAM, GearMode.ACTIVE);

    private final GearMode from;
    private final GearMode to;

    GearTransition(GearMode from, GearMode to) {
        this.from = from;
        this.to = to;
    }

    public GearMode from() {
        return from;
    }

    public GearMode to() {
        return to;
    }

    /**
     * Looks up the edge for a {@code (from, to)} pair.
     *
     * @return the matching transition, or empty when the pair is not one of the legal edges
     */
    public static Optional<GearTransition> find(GearMode from, GearMode to) {
        for (GearTransition transition : values()) {
            if (transition.from == from && transition.to == to) {
                return Optional.of(transition);
            }
        }
        return Optional.empty();
    }
}
