package com.operatorsedge.core.qualitygate;

import com.operatorsedge.core.plan.PlanContext;
import com.operatorsedge.core.plan.PlanStep;
import com.operatorsedge.core.plan.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates a finished objective against the plan file.
 * <p>
 * Checks:
 * <ul>
 *   <li>{@code all_steps_completed}: the plan is non-empty and every step is completed</li>
 *   <li>{@code completed_steps_have_proof}: every completed step records proof</li>
 *   <li>{@code no_blocked_steps}: no step is left blocked</li>
 * </ul>
 */
@Service
public class PlanQualityGate implements QualityGate {

    private static final Logger log = LoggerFactory.getLogger(PlanQualityGate.class);

    public static final String ALL_STEPS_COMPLETED = "all_steps_completed";
    public static final String COMPLETED_STEPS_HAVE_PROOF = "completed_steps_have_proof";
    public static final String NO_BLOCKED_STEPS = "no_blocked_steps";

    @Override
    public QualityGateResult evaluate(PlanContext plan) {
        var failures = new ArrayList<QualityCheckFailure>();

        if (plan.steps().isEmpty()) {
            failures.add(new QualityCheckFailure(ALL_STEPS_COMPLETED, "The plan has no steps"));
        } else if (plan.hasUnfinishedSteps()) {
            failures.add(new QualityCheckFailure(ALL_STEPS_COMPLETED,
                    plan.unfinishedSteps().size() + " step(s) not completed"));
        }

        List<Integer> withoutProof = plan.steps().stream()
                .filter(s -> s.status() == StepStatus.COMPLETED && !s.hasProof())
                .map(s -> s.index() + 1)
                .toList();
        if (!withoutProof.isEmpty()) {
            failures.add(new QualityCheckFailure(COMPLETED_STEPS_HAVE_PROOF,
                    "Completed step(s) without proof: " + withoutProof));
        }

        List<PlanStep> blocked = plan.steps().stream()
                .filter(s -> s.status() == StepStatus.BLOCKED)
                .toList();
        if (!blocked.isEmpty()) {
            failures.add(new QualityCheckFailure(NO_BLOCKED_STEPS,
                    blocked.size() + " blocked step(s): " + blocked.get(0).description()));
        }

        if (failures.isEmpty()) {
            log.info("Quality gate passed for objective '{}'", plan.objective());
            return QualityGateResult.pass();
        }
        log.info("Quality gate failed for objective '{}': {}", plan.objective(),
                failures.stream().map(QualityCheckFailure::check).toList());
        return QualityGateResult.fail(failures);
    }
}
