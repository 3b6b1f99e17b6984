package com.operatorsedge.core.plan;

/**
 * One step of the plan.
 *
 * @param index       zero-based position in the plan
 * @param description what the step does
 * @param status      current status
 * @param proof       evidence recorded on completion, may be null
 * @param command     shell command the step wants to run, may be null
 * @param control     control command the step wants to run, may be null
 */
public record PlanStep(
    int index,
    String description,
    StepStatus status,
    String proof,
    String command,
    String control
) {

    public PlanStep {
        description = description == null ? "" : description;
        status = status == null ? StepStatus.PENDING : status;
    }

    public boolean hasProof() {
        return proof != null && !proof.isBlank();
    }
}
