package com.operatorsedge.core.model;

/**
 * Verdict on whether an action may run unattended.
 * {@link #NONE} means safe to auto-execute; every other value pauses for a human decision.
 */
public enum JunctionType {
    NONE,
    IRREVERSIBLE,
    EXTERNAL,
    AMBIGUOUS,
    BLOCKED;

    public boolean isPausing() {
        return this != NONE;
    }
}
