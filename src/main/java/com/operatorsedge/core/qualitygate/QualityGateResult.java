package com.operatorsedge.core.qualitygate;

import java.util.List;

/**
 * Outcome of running the quality gate at objective completion.
 */
public record QualityGateResult(boolean passed, List<QualityCheckFailure> failures) {

    public QualityGateResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static QualityGateResult pass() {
        return new QualityGateResult(true, List.of());
    }

    public static QualityGateResult fail(List<QualityCheckFailure> failures) {
        return new QualityGateResult(false, failures);
    }

    public List<String> failedChecks() {
        return failures.stream().map(QualityCheckFailure::check).distinct().toList();
    }
}
