package com.operatorsedge.core.qualitygate;

import com.operatorsedge.core.plan.PlanContext;

/**
 * Pass/fail check run when an objective's steps are all finished.
 */
public interface QualityGate {

    QualityGateResult evaluate(PlanContext plan);
}
