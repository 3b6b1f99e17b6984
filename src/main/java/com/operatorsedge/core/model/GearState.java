package com.operatorsedge.core.model;

import java.time.Instant;

/**
 * Persisted operating-mode record, one per session.
 *
 * @param mode                 current mode
 * @param enteredAt            when the current mode was entered
 * @param iterations           loop passes since mode entry, reset on every transition
 * @param lastTransition       edge that produced the current mode, null at start
 * @param patrolFindingsCount  cumulative, survives transitions
 * @param dreamProposalsCount  cumulative, survives transitions
 * @param emptyPatrolPasses    consecutive patrol passes without findings, reset on transition
 * @param qualityGateOverride  explicit approval to bypass quality checks, or null
 */
public record GearState(
    GearMode mode,
    Instant enteredAt,
    int iterations,
    GearTransition lastTransition,
    int patrolFindingsCount,
    int dreamProposalsCount,
    int emptyPatrolPasses,
    QualityGateOverride qualityGateOverride
) {

    public GearState {
        mode = mode == null ? GearMode.ACTIVE : mode;
        iterations = Math.max(0, iterations);
        emptyPatrolPasses = Math.max(0, emptyPatrolPasses);
    }

    public static GearState initial(Instant now) {
        return new GearState(GearMode.ACTIVE, now, 0, null, 0, 0, 0, null);
    }

    public GearState withIterations(int value) {
        return new GearState(mode, enteredAt, value, lastTransition, patrolFindingsCount,
                dreamProposalsCount, emptyPatrolPasses, qualityGateOverride);
    }

    public GearState withCounters(int findings, int proposals, int emptyPasses) {
        return new GearState(mode, enteredAt, iterations, lastTransition, findings,
                proposals, emptyPasses, qualityGateOverride);
    }

    public GearState withQualityGateOverride(QualityGateOverride override) {
        return new GearState(mode, enteredAt, iterations, lastTransition, patrolFindingsCount,
                dreamProposalsCount, emptyPatrolPasses, override);
    }
}
