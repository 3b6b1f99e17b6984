package com.operatorsedge.core.dream;

import com.operatorsedge.core.plan.PlanContext;

import java.util.List;

/**
 * Consolidates what the session learned and proposes new objectives. Must not change gear state.
 */
public interface DreamConsolidator {

    List<DreamProposal> propose(PlanContext plan);
}
