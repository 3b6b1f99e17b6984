package com.operatorsedge.core.dispatch;

/**
 * Outcome class of one dispatch turn.
 */
public enum TurnStatus {
    /** Work proceeds; invoke again. */
    CONTINUE,
    /** Paused for a human decision. */
    JUNCTION,
    /** Nothing to do until new work appears. */
    IDLE,
    /** Autonomous looping halted by {@code stop}. */
    STOPPED,
    /** Session iteration limit reached; looping halted. */
    MAX_ITERATIONS,
    /** A state file was locked by another invocation; nothing changed, retry. */
    BUSY,
    /** Internal error; state unchanged, safe to retry. */
    ERROR
}
