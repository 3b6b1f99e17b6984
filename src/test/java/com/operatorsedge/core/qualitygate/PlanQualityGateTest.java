package com.operatorsedge.core.qualitygate;

import com.operatorsedge.core.plan.PlanContext;
import com.operatorsedge.core.plan.PlanStep;
import com.operatorsedge.core.plan.StepStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanQualityGateTest {

    private final PlanQualityGate gate = new PlanQualityGate();

    private static PlanContext plan(PlanStep... steps) {
        return new PlanContext("Ship", 0, List.of(steps), List.of(), List.of(), List.of());
    }

    @Test
    @DisplayName("Completed steps with proof pass")
    void passes() {
        QualityGateResult result = gate.evaluate(plan(
                new PlanStep(0, "a", StepStatus.COMPLETED, "tests green", null, null),
                new PlanStep(1, "b", StepStatus.COMPLETED, "diff reviewed", null, null)));

        assertTrue(result.passed());
        assertTrue(result.failedChecks().isEmpty());
    }

    @Test
    @DisplayName("Completed step without proof fails completed_steps_have_proof")
    void missingProof() {
        QualityGateResult result = gate.evaluate(plan(
                new PlanStep(0, "a", StepStatus.COMPLETED, "ok", null, null),
                new PlanStep(1, "b", StepStatus.COMPLETED, "  ", null, null)));

        assertFalse(result.passed());
        assertEquals(List.of(PlanQualityGate.COMPLETED_STEPS_HAVE_PROOF), result.failedChecks());
        assertTrue(result.failures().get(0).message().contains("[2]"));
    }

    @Test
    @DisplayName("Empty plan fails all_steps_completed")
    void emptyPlan() {
        assertEquals(List.of(PlanQualityGate.ALL_STEPS_COMPLETED), gate.evaluate(plan()).failedChecks());
    }

    @Test
    @DisplayName("Blocked step fails two checks")
    void blockedStep() {
        QualityGateResult result = gate.evaluate(plan(
                new PlanStep(0, "a", StepStatus.COMPLETED, "ok", null, null),
                new PlanStep(1, "b", StepStatus.BLOCKED, null, null, null)));

        assertEquals(List.of(PlanQualityGate.ALL_STEPS_COMPLETED, PlanQualityGate.NO_BLOCKED_STEPS),
                result.failedChecks());
    }
}
