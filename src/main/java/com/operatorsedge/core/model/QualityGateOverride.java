package com.operatorsedge.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Explicit human approval to bypass specific quality checks for one objective.
 *
 * @param objective  the objective text the approval is scoped to
 * @param checks     names of the checks that may fail without pausing
 * @param approvedAt when the approval was recorded
 */
public record QualityGateOverride(
    String objective,
    List<String> checks,
    Instant approvedAt
) {

    public QualityGateOverride {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    /**
     * True when this approval was given for {@code currentObjective} and covers every failed check.
     */
    public boolean covers(String currentObjective, List<String> failedChecks) {
        if (objective == null || !objective.equals(currentObjective)) {
            return false;
        }
        return checks.containsAll(failedChecks);
    }
}
