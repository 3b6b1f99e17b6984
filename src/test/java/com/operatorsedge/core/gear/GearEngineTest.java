package com.operatorsedge.core.gear;

import com.operatorsedge.core.config.EdgeProperties;
import com.operatorsedge.core.dream.DreamConsolidator;
import com.operatorsedge.core.dream.DreamProposal;
import com.operatorsedge.core.model.GearMode;
import com.operatorsedge.core.model.GearState;
import com.operatorsedge.core.model.GearTransition;
import com.operatorsedge.core.model.JunctionType;
import com.operatorsedge.core.model.QualityGateOverride;
import com.operatorsedge.core.plan.PlanContext;
import com.operatorsedge.core.plan.PlanStep;
import com.operatorsedge.core.plan.StepStatus;
import com.operatorsedge.core.qualitygate.QualityCheckFailure;
import com.operatorsedge.core.qualitygate.QualityGate;
import com.operatorsedge.core.qualitygate.QualityGateResult;
import com.operatorsedge.core.scanner.PatrolFinding;
import com.operatorsedge.core.scanner.PatrolScanner;
import com.operatorsedge.core.step.ProposedAction;
import com.operatorsedge.core.step.StepExecutor;
import com.operatorsedge.core.step.StepOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GearEngineTest {

    private static final Instant ENTERED = Instant.parse("2026-03-01T09:00:00Z");
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private StepExecutor executor;
    private QualityGate qualityGate;
    private PatrolScanner scanner;
    private DreamConsolidator consolidator;
    private GearEngine engine;

    @BeforeEach
    void setUp() {
        executor = mock(StepExecutor.class);
        qualityGate = mock(QualityGate.class);
        scanner = mock(PatrolScanner.class);
        consolidator = mock(DreamConsolidator.class);
        engine = new GearEngine(executor, qualityGate, scanner, consolidator, new EdgeProperties());
    }

    private static PlanContext plan(String objective, StepStatus... statuses) {
        var steps = new ArrayList<PlanStep>();
        for (int i = 0; i < statuses.length; i++) {
            steps.add(new PlanStep(i, "step " + (i + 1), statuses[i], "proof", null, null));
        }
        return new PlanContext(objective, 0, steps, List.of(), List.of("risk"), List.of());
    }

    private static GearState stateIn(GearMode mode) {
        return new GearState(mode, ENTERED, 2, null, 0, 0, 0, null);
    }

    @Nested
    @DisplayName("ACTIVE")
    class Active {

        @Test
        @DisplayName("Runs the next step, counts the iteration and forwards the proposed action")
        void runsNextStep() {
            var plan = plan("Ship", StepStatus.COMPLETED, StepStatus.PENDING);
            when(executor.executeNextStep(plan)).thenReturn(
                    StepOutcome.proceed(1, "Step 2/2: step 2", ProposedAction.shell("mvn test")));

            GearStepResult result = engine.step(stateIn(GearMode.ACTIVE), plan, NOW);

            assertEquals(GearMode.ACTIVE, result.modeExecuted());
            assertEquals(GearMode.ACTIVE, result.state().mode());
            assertEquals(3, result.state().iterations());
            assertFalse(result.transitioned());
            assertEquals("Step 2/2: step 2", result.instruction());
            assertEquals("mvn test", result.proposedAction().text());
            assertEquals("step:1:1", result.progressMarker());
            assertNull(result.junction());
            assertFalse(result.idle());
        }

        @Test
        @DisplayName("Executor failure becomes a warning and still counts the iteration")
        void executorFailure() {
            var plan = plan("Ship", StepStatus.PENDING);
            when(executor.executeNextStep(any())).thenThrow(new IllegalStateException("disk full"));

            GearStepResult result = engine.step(stateIn(GearMode.ACTIVE), plan, NOW);

            assertEquals(GearMode.ACTIVE, result.state().mode());
            assertEquals(3, result.state().iterations());
            assertTrue(result.warnings().get(0).contains("disk full"));
            assertNull(result.proposedAction());
        }

        @Test
        @DisplayName("A paused step becomes a step junction request")
        void pausedStep() {
            var plan = plan("Ship", StepStatus.BLOCKED);
            when(executor.executeNextStep(plan)).thenReturn(
                    StepOutcome.paused(0, JunctionType.BLOCKED, "Step 1 is blocked: step 1", "Step 1/1: step 1"));

            GearStepResult result = engine.step(stateIn(GearMode.ACTIVE), plan, NOW);

            assertNotNull(result.junction());
            assertEquals(JunctionType.BLOCKED, result.junction().type());
            assertEquals(GearEngine.STEP_SOURCE, result.junction().source());
            assertEquals("Step 1 is blocked: step 1", result.junction().reason());
        }

        @Test
        @DisplayName("Objective complete and gate passing -> PATROL")
        void completeToPatrol() {
            var plan = plan("Ship", StepStatus.COMPLETED);
            when(qualityGate.evaluate(plan)).thenReturn(QualityGateResult.pass());

            GearStepResult result = engine.step(stateIn(GearMode.ACTIVE), plan, NOW);

            assertEquals(GearTransition.ACTIVE_TO_PATROL, result.transition());
            assertEquals(GearMode.PATROL, result.state().mode());
            assertEquals(0, result.state().iterations());
            assertEquals(NOW, result.state().enteredAt());
            verify(executor, never()).executeNextStep(any());
        }

        @Test
        @DisplayName("Gate failure raises an AMBIGUOUS quality_gate junction and stays ACTIVE")
        void gateFailure() {
            var plan = plan("Ship", StepStatus.COMPLETED);
            when(qualityGate.evaluate(plan)).thenReturn(QualityGateResult.fail(List.of(
                    new QualityCheckFailure("completed_steps_have_proof", "Completed step(s) without proof: [1]"))));

            GearStepResult result = engine.step(stateIn(GearMode.ACTIVE), plan, NOW);

            assertFalse(result.transitioned());
            assertEquals(GearMode.ACTIVE, result.state().mode());
            JunctionRequest junction = result.junction();
            assertEquals(JunctionType.AMBIGUOUS, junction.type());
            assertEquals(GearEngine.QUALITY_GATE_SOURCE, junction.source());
            assertEquals("Ship", junction.payload().get("objective"));
            assertEquals(List.of("completed_steps_have_proof"), junction.payload().get("failed_checks"));
            assertTrue(junction.reason().startsWith("Quality gate failed"));
        }

        @Test
        @DisplayName("An approval covering the failed checks lets the objective complete")
        void overrideBypassesGate() {
            var plan = plan("Ship", StepStatus.COMPLETED);
            when(qualityGate.evaluate(plan)).thenReturn(QualityGateResult.fail(List.of(
                    new QualityCheckFailure("completed_steps_have_proof", "missing"))));
            GearState state = stateIn(GearMode.ACTIVE).withQualityGateOverride(
                    new QualityGateOverride("Ship", List.of("completed_steps_have_proof"), ENTERED));

            GearStepResult result = engine.step(state, plan, NOW);

            assertEquals(GearMode.PATROL, result.state().mode());
            assertNull(result.junction());
            assertEquals(1, result.warnings().size());
        }

        @Test
        @DisplayName("An approval for another objective does not bypass the gate")
        void overrideScopedToObjective() {
            var plan = plan("Ship v2", StepStatus.COMPLETED);
            when(qualityGate.evaluate(plan)).thenReturn(QualityGateResult.fail(List.of(
                    new QualityCheckFailure("completed_steps_have_proof", "missing"))));
            GearState state = stateIn(GearMode.ACTIVE).withQualityGateOverride(
                    new QualityGateOverride("Ship", List.of("completed_steps_have_proof"), ENTERED));

            GearStepResult result = engine.step(state, plan, NOW);

            assertEquals(GearMode.ACTIVE, result.state().mode());
            assertNotNull(result.junction());
        }

        @Test
        @DisplayName("No objective -> DREAM")
        void noObjective() {
            GearStepResult result = engine.step(stateIn(GearMode.ACTIVE), PlanContext.empty(), NOW);

            assertEquals(GearTransition.ACTIVE_TO_DREAM, result.transition());
            assertEquals(GearMode.DREAM, result.state().mode());
        }
    }

    @Nested
    @DisplayName("PATROL")
    class Patrol {

        @Test
        @DisplayName("Empty passes accumulate and the configured count switches to DREAM")
        void emptyPassesToDream() {
            var plan = plan("Ship", StepStatus.COMPLETED);
            when(scanner.scan(plan)).thenReturn(List.of());
            GearState state = stateIn(GearMode.PATROL);

            GearStepResult first = engine.step(state, plan, NOW);
            assertEquals(1, first.state().emptyPatrolPasses());
            assertEquals(GearMode.PATROL, first.state().mode());
            assertFalse(first.idle());

            GearStepResult second = engine.step(first.state(), plan, NOW);
            GearStepResult third = engine.step(second.state(), plan, NOW);

            assertEquals(GearTransition.PATROL_TO_DREAM, third.transition());
            assertEquals(GearMode.DREAM, third.state().mode());
            assertEquals(0, third.state().emptyPatrolPasses());
        }

        @Test
        @DisplayName("Findings are counted and reported; the turn is idle")
        void findings() {
            var plan = plan("Ship", StepStatus.COMPLETED);
            when(scanner.scan(plan)).thenReturn(List.of(
                    new PatrolFinding("src/App.java", 12, "TODO", "handle retries"),
                    new PatrolFinding("README.md", 3, "FIXME", "")));

            GearStepResult result = engine.step(stateIn(GearMode.PATROL), plan, NOW);

            assertTrue(result.idle());
            assertEquals(2, result.state().patrolFindingsCount());
            assertEquals(0, result.state().emptyPatrolPasses());
            assertTrue(result.instruction().contains("src/App.java:12 TODO handle retries"));
            assertNull(result.progressMarker());
        }

        @Test
        @DisplayName("New unfinished steps switch back to ACTIVE and run them")
        void newWorkToActive() {
            var plan = plan("Next", StepStatus.PENDING);
            when(executor.executeNextStep(plan)).thenReturn(StepOutcome.proceed(0, "Step 1/1: step 1", null));

            GearStepResult result = engine.step(stateIn(GearMode.PATROL), plan, NOW);

            assertEquals(GearTransition.PATROL_TO_ACTIVE, result.transition());
            assertEquals(GearMode.ACTIVE, result.modeExecuted());
            assertEquals(1, result.state().iterations());
            verify(scanner, never()).scan(any());
        }

        @Test
        @DisplayName("Objective removed -> DREAM")
        void objectiveRemoved() {
            when(consolidator.propose(any())).thenReturn(List.of());

            GearStepResult result = engine.step(stateIn(GearMode.PATROL), PlanContext.empty(), NOW);

            assertEquals(GearTransition.PATROL_TO_DREAM, result.transition());
            assertEquals(GearMode.DREAM, result.modeExecuted());
        }

        @Test
        @DisplayName("Scanner failure becomes a warning")
        void scannerFailure() {
            var plan = plan("Ship", StepStatus.COMPLETED);
            when(scanner.scan(plan)).thenThrow(new RuntimeException("walk failed"));

            GearStepResult result = engine.step(stateIn(GearMode.PATROL), plan, NOW);

            assertEquals(GearMode.PATROL, result.state().mode());
            assertEquals(3, result.state().iterations());
            assertTrue(result.warnings().get(0).contains("walk failed"));
        }
    }

    @Nested
    @DisplayName("DREAM")
    class Dream {

        @Test
        @DisplayName("Proposals are counted and offered; the turn is idle")
        void proposals() {
            when(consolidator.propose(any())).thenReturn(List.of(
                    new DreamProposal("Mitigate risk: risk", "risk")));

            GearStepResult result = engine.step(stateIn(GearMode.DREAM), PlanContext.empty(), NOW);

            assertTrue(result.idle());
            assertEquals(1, result.state().dreamProposalsCount());
            assertTrue(result.instruction().contains("Mitigate risk: risk"));
        }

        @Test
        @DisplayName("Nothing to propose is still idle")
        void nothingToPropose() {
            when(consolidator.propose(any())).thenReturn(List.of());

            GearStepResult result = engine.step(stateIn(GearMode.DREAM), PlanContext.empty(), NOW);

            assertTrue(result.idle());
            assertNull(result.instruction());
        }

        @Test
        @DisplayName("An accepted objective with steps -> ACTIVE")
        void acceptedObjective() {
            var plan = plan("Mitigate risk", StepStatus.PENDING);
            when(executor.executeNextStep(plan)).thenReturn(StepOutcome.proceed(0, "Step 1/1: step 1", null));

            GearStepResult result = engine.step(stateIn(GearMode.DREAM), plan, NOW);

            assertEquals(GearTransition.DREAM_TO_ACTIVE, result.transition());
            assertEquals(GearMode.ACTIVE, result.state().mode());
        }

        @Test
        @DisplayName("A completed objective does not leave DREAM")
        void completedObjectiveStaysInDream() {
            var plan = plan("Old", StepStatus.COMPLETED);
            when(consolidator.propose(plan)).thenReturn(List.of());

            GearStepResult result = engine.step(stateIn(GearMode.DREAM), plan, NOW);

            assertFalse(result.transitioned());
            assertEquals(GearMode.DREAM, result.state().mode());
        }
    }
}
