package com.operatorsedge.core.step;

import com.operatorsedge.core.plan.PlanContext;

/**
 * Executes, or prepares, the next unfinished step of the plan.
 * Implementations report failures through {@link StepOutcome#error()} or by throwing;
 * either way the gear stays where it is.
 */
public interface StepExecutor {

    StepOutcome executeNextStep(PlanContext plan);
}
