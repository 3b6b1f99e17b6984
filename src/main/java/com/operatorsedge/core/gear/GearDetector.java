package com.operatorsedge.core.gear;

import com.operatorsedge.core.model.GearMode;
import com.operatorsedge.core.plan.PlanContext;

/**
 * Derives the mode the plan calls for. Pure: equal input always gives the same mode.
 */
public final class GearDetector {

    private GearDetector() {}

    public static GearMode detect(PlanContext plan) {
        if (!plan.hasObjective()) {
            return GearMode.DREAM;
        }
        return plan.hasUnfinishedSteps() ? GearMode.ACTIVE : GearMode.PATROL;
    }
}
