package com.operatorsedge.core.junction;

/**
 * How a human resolved a junction.
 */
public enum JunctionDecision {
    APPROVE,
    SKIP,
    DISMISS,
    STOP
}
