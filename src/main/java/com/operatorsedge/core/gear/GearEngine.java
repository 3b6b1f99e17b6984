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
import com.operatorsedge.core.qualitygate.QualityCheckFailure;
import com.operatorsedge.core.qualitygate.QualityGate;
import com.operatorsedge.core.qualitygate.QualityGateResult;
import com.operatorsedge.core.scanner.PatrolFinding;
import com.operatorsedge.core.scanner.PatrolScanner;
import com.operatorsedge.core.step.ProposedAction;
import com.operatorsedge.core.step.StepExecutor;
import com.operatorsedge.core.step.StepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs one step of the operating-mode state machine.
 * <p>
 * {@link #step} takes the full gear state and returns the full updated state inside a
 * {@link GearStepResult}; it never touches the state files. Collaborator failures are
 * reported as warnings and still count an iteration, so stuck detection keeps working.
 */
@Service
public class GearEngine {

    private static final Logger log = LoggerFactory.getLogger(GearEngine.class);

    public static final String QUALITY_GATE_SOURCE = "quality_gate";
    public static final String STEP_SOURCE = "step";

    private static final int LISTED_ITEMS = 5;

    private final StepExecutor stepExecutor;
    private final QualityGate qualityGate;
    private final PatrolScanner patrolScanner;
    private final DreamConsolidator dreamConsolidator;
    private final int idlePassesBeforeDream;

    public GearEngine(StepExecutor stepExecutor, QualityGate qualityGate, PatrolScanner patrolScanner,
                      DreamConsolidator dreamConsolidator, EdgeProperties properties) {
        this.stepExecutor = stepExecutor;
        this.qualityGate = qualityGate;
        this.patrolScanner = patrolScanner;
        this.dreamConsolidator = dreamConsolidator;
        this.idlePassesBeforeDream = Math.max(1, properties.getPatrol().getIdlePassesBeforeDream());
    }

    /**
     * Moves {@code state} along {@code transition}: sets the target mode, resets
     * {@code iterations} and the empty-patrol counter, records the edge and keeps the
     * cumulative counters.
     *
     * @throws InvalidTransitionException if the state is not in the edge's source mode
     */
    public static GearState executeTransition(GearState state, GearTransition transition, Instant now) {
        if (transition == null || state.mode() != transition.from()) {
            throw new InvalidTransitionException(state.mode(), transition == null ? null : transition.to());
        }
        return new GearState(transition.to(), now, 0, transition, state.patrolFindingsCount(),
                state.dreamProposalsCount(), 0, state.qualityGateOverride());
    }

    /**
     * @throws InvalidTransitionException if {@code (state.mode(), to)} is not a legal edge
     */
    public static GearState transitionTo(GearState state, GearMode to, Instant now) {
        GearTransition transition = GearTransition.find(state.mode(), to)
                .orElseThrow(() -> new InvalidTransitionException(state.mode(), to));
        return executeTransition(state, transition, now);
    }

    public GearStepResult step(GearState state, PlanContext plan, Instant now) {
        GearMode detected = GearDetector.detect(plan);
        var turn = new Turn(state);

        if (detected == GearMode.ACTIVE && state.mode() != GearMode.ACTIVE) {
            turn.transition(GearMode.ACTIVE, now);
            log.info("New work in the plan, switching {} -> ACTIVE", state.mode());
        } else if (detected == GearMode.DREAM && state.mode() == GearMode.PATROL) {
            turn.transition(GearMode.DREAM, now);
            log.info("Objective cleared, switching PATROL -> DREAM");
        }

        return switch (turn.state.mode()) {
            case ACTIVE -> active(turn, plan, now);
            case PATROL -> patrol(turn, plan, now);
            case DREAM -> dream(turn, plan);
        };
    }

    private GearStepResult active(Turn turn, PlanContext plan, Instant now) {
        turn.modeExecuted = GearMode.ACTIVE;
        if (!plan.hasObjective()) {
            turn.transition(GearMode.DREAM, now);
            turn.message = "No objective set; switching to DREAM";
            return turn.result();
        }
        if (!plan.hasUnfinishedSteps()) {
            return completeObjective(turn, plan, now);
        }

        turn.progressMarker = progressMarker(plan);
        StepOutcome outcome;
        try {
            outcome = stepExecutor.executeNextStep(plan);
        } catch (RuntimeException e) {
            log.warn("Step execution failed: {}", e.getMessage(), e);
            outcome = StepOutcome.failed(plan.completedCount(), describe(e));
        }
        turn.countIteration();

        if (outcome.isError()) {
            turn.warnings.add("Step execution failed: " + outcome.error());
            turn.message = "Step failed; gear unchanged";
            return turn.result();
        }
        turn.instruction = outcome.instruction();
        turn.proposedAction = outcome.proposedAction();
        turn.message = outcome.stepsCompleted() + "/" + plan.steps().size() + " steps completed";
        if (outcome.junctionHit()) {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("reason", outcome.junctionReason() != null ? outcome.junctionReason() : "Step asked to pause");
            if (outcome.instruction() != null) {
                payload.put("step", outcome.instruction());
            }
            turn.junction = new JunctionRequest(outcome.junctionType(), STEP_SOURCE, payload);
        }
        return turn.result();
    }

    private GearStepResult completeObjective(Turn turn, PlanContext plan, Instant now) {
        QualityGateResult gate;
        try {
            gate = qualityGate.evaluate(plan);
        } catch (RuntimeException e) {
            log.warn("Quality gate failed to run: {}", e.getMessage(), e);
            turn.countIteration();
            turn.warnings.add("Quality gate failed to run: " + describe(e));
            turn.message = "Quality gate could not run; gear unchanged";
            return turn.result();
        }

        if (gate.passed()) {
            turn.transition(GearMode.PATROL, now);
            turn.message = "Objective complete and quality gate passed; switching to PATROL";
            return turn.result();
        }

        List<String> failed = gate.failedChecks();
        QualityGateOverride override = turn.state.qualityGateOverride();
        if (override != null && override.covers(plan.objective(), failed)) {
            log.info("Quality gate failures {} covered by approval from {}", failed, override.approvedAt());
            turn.transition(GearMode.PATROL, now);
            turn.warnings.add("Quality gate checks " + failed + " bypassed by explicit approval");
            turn.message = "Objective complete; quality gate bypassed by approval; switching to PATROL";
            return turn.result();
        }

        turn.countIteration();
        turn.progressMarker = "quality_gate:" + String.join(",", failed);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("reason", "Quality gate failed: " + gate.failures().stream()
                .map(QualityCheckFailure::message)
                .collect(Collectors.joining("; ")));
        payload.put("objective", plan.objective());
        payload.put("failed_checks", failed);
        turn.junction = new JunctionRequest(JunctionType.AMBIGUOUS, QUALITY_GATE_SOURCE, payload);
        turn.message = "Objective steps finished but the quality gate failed";
        return turn.result();
    }

    private GearStepResult patrol(Turn turn, PlanContext plan, Instant now) {
        turn.modeExecuted = GearMode.PATROL;
        List<PatrolFinding> findings;
        try {
            findings = patrolScanner.scan(plan);
        } catch (RuntimeException e) {
            log.warn("Patrol scan failed: {}", e.getMessage(), e);
            turn.countIteration();
            turn.warnings.add("Patrol scan failed: " + describe(e));
            turn.message = "Patrol scan failed; gear unchanged";
            return turn.result();
        }
        turn.countIteration();

        GearState s = turn.state;
        if (findings.isEmpty()) {
            int emptyPasses = s.emptyPatrolPasses() + 1;
            turn.state = s.withCounters(s.patrolFindingsCount(), s.dreamProposalsCount(), emptyPasses);
            if (emptyPasses >= idlePassesBeforeDream) {
                turn.transition(GearMode.DREAM, now);
                turn.message = "Patrol found nothing in " + emptyPasses + " passes; switching to DREAM";
            } else {
                turn.message = "Patrol pass " + emptyPasses + "/" + idlePassesBeforeDream + " found nothing";
            }
            return turn.result();
        }

        turn.state = s.withCounters(s.patrolFindingsCount() + findings.size(), s.dreamProposalsCount(), 0);
        turn.idle = true;
        turn.message = "Patrol found " + findings.size() + " issue(s)";
        turn.instruction = "Set an objective in the plan to address these findings:\n"
                + listed(findings.stream().map(PatrolFinding::describe).toList());
        return turn.result();
    }

    private GearStepResult dream(Turn turn, PlanContext plan) {
        turn.modeExecuted = GearMode.DREAM;
        List<DreamProposal> proposals;
        try {
            proposals = dreamConsolidator.propose(plan);
        } catch (RuntimeException e) {
            log.warn("Dream consolidation failed: {}", e.getMessage(), e);
            turn.countIteration();
            turn.warnings.add("Dream consolidation failed: " + describe(e));
            turn.message = "Dream consolidation failed; gear unchanged";
            turn.idle = true;
            return turn.result();
        }
        turn.countIteration();
        turn.idle = true;

        GearState s = turn.state;
        turn.state = s.withCounters(s.patrolFindingsCount(), s.dreamProposalsCount() + proposals.size(),
                s.emptyPatrolPasses());
        if (proposals.isEmpty()) {
            turn.message = "Nothing to do: no objective and no proposals";
            return turn.result();
        }
        turn.message = proposals.size() + " objective(s) proposed";
        turn.instruction = "Accept one of these by setting it as the objective, with steps, in the plan:\n"
                + listed(proposals.stream().map(p -> p.objective() + " (from " + p.basis() + ")").toList());
        return turn.result();
    }

    /**
     * Identifies the step under way from the plan alone: completed count plus the
     * position of the first unfinished step.
     */
    static String progressMarker(PlanContext plan) {
        int next = plan.firstUnfinished().map(PlanStep::index).orElse(-1);
        return "step:" + plan.completedCount() + ":" + next;
    }

    private static String listed(List<String> items) {
        var lines = new ArrayList<String>();
        for (int i = 0; i < items.size() && i < LISTED_ITEMS; i++) {
            lines.add("- " + items.get(i));
        }
        if (items.size() > LISTED_ITEMS) {
            lines.add("- ... and " + (items.size() - LISTED_ITEMS) + " more");
        }
        return String.join("\n", lines);
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /** Mutable scratch for one step; only {@link #result()} escapes. */
    private static final class Turn {
        private GearState state;
        private GearMode modeExecuted;
        private GearTransition transition;
        private JunctionRequest junction;
        private ProposedAction proposedAction;
        private String instruction;
        private String message;
        private boolean idle;
        private String progressMarker;
        private final List<String> warnings = new ArrayList<>();

        private Turn(GearState state) {
            this.state = state;
            this.modeExecuted = state.mode();
        }

        private void transition(GearMode to, Instant now) {
            GearState next = transitionTo(state, to, now);
            transition = next.lastTransition();
            state = next;
        }

        private void countIteration() {
            state = state.withIterations(state.iterations() + 1);
        }

        private GearStepResult result() {
            return new GearStepResult(state, modeExecuted, transition, junction, proposedAction,
                    instruction, message, idle, progressMarker, warnings);
        }
    }
}
