package com.operatorsedge.core.scanner;

import com.operatorsedge.core.plan.PlanContext;

import java.util.List;

/**
 * Bounded scan for new issues while no step is unfinished. Must not change gear state.
 */
public interface PatrolScanner {

    List<PatrolFinding> scan(PlanContext plan);
}
