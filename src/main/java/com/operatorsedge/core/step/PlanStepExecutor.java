package com.operatorsedge.core.step;

import com.operatorsedge.core.model.JunctionType;
import com.operatorsedge.core.plan.PlanContext;
import com.operatorsedge.core.plan.PlanStep;
import com.operatorsedge.core.plan.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Default step executor. The agent does the actual work; this surfaces the first
 * unfinished step as the next instruction and proposes the step's command, if it
 * declares one, for classification.
 */
@Service
public class PlanStepExecutor implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(PlanStepExecutor.class);

    @Override
    public StepOutcome executeNextStep(PlanContext plan) {
        int completed = plan.completedCount();
        var next = plan.firstUnfinished();
        if (next.isEmpty()) {
            return StepOutcome.completed(completed);
        }

        PlanStep step = next.get();
        String instruction = String.format("Step %d/%d: %s", step.index() + 1, plan.steps().size(),
                step.description());

        if (step.status() == StepStatus.BLOCKED) {
            log.info("Step {} is marked blocked", step.index() + 1);
            return StepOutcome.paused(completed, JunctionType.BLOCKED,
                    "Step " + (step.index() + 1) + " is blocked: " + step.description(), instruction);
        }

        ProposedAction action = null;
        if (step.command() != null) {
            action = ProposedAction.shell(step.command());
        } else if (step.control() != null) {
            action = ProposedAction.control(step.control());
        }
        return StepOutcome.proceed(completed, instruction, action);
    }
}
