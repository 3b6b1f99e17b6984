package com.operatorsedge.core.plan;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the plan file: the objective and its steps plus the notes
 * carried between sessions.
 */
public record PlanContext(
    String objective,
    int currentStep,
    List<PlanStep> steps,
    List<String> constraints,
    List<String> risks,
    List<String> lessons
) {

    public PlanContext {
        steps = steps == null ? List.of() : List.copyOf(steps);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        risks = risks == null ? List.of() : List.copyOf(risks);
        lessons = lessons == null ? List.of() : List.copyOf(lessons);
    }

    public static PlanContext empty() {
        return new PlanContext(null, 0, List.of(), List.of(), List.of(), List.of());
    }

    public boolean hasObjective() {
        return objective != null && !objective.isBlank();
    }

    public List<PlanStep> unfinishedSteps() {
        return steps.stream().filter(s -> !s.status().isFinished()).toList();
    }

    public boolean hasUnfinishedSteps() {
        return steps.stream().anyMatch(s -> !s.status().isFinished());
    }

    public Optional<PlanStep> firstUnfinished() {
        return steps.stream().filter(s -> !s.status().isFinished()).findFirst();
    }

    public int completedCount() {
        return (int) steps.stream().filter(s -> s.status().isFinished()).count();
    }

    /**
     * True when there is an objective and every step of a non-empty plan is completed.
     */
    public boolean isObjectiveComplete() {
        return hasObjective() && !steps.isEmpty() && !hasUnfinishedSteps();
    }
}
