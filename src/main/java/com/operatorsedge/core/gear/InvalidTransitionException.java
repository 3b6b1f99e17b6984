package com.operatorsedge.core.gear;

import com.operatorsedge.core.model.GearMode;

/**
 * Thrown for a {@code (from, to)} pair that is not one of the legal gear edges.
 * Raised before any state is changed.
 */
public class InvalidTransitionException extends RuntimeException {

    private final GearMode from;
    private final GearMode to;

    public InvalidTransitionException(GearMode from, GearMode to) {
        super("No gear transition from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public GearMode getFrom() {
        return from;
    }

    public GearMode getTo() {
        return to;
    }
}
