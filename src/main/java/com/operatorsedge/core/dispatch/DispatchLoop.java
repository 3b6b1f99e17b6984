package com.operatorsedge.core.dispatch;

import com.operatorsedge.core.classifier.JunctionClassifier;
import com.operatorsedge.core.classifier.OutputJunction;
import com.operatorsedge.core.config.EdgeProperties;
import com.operatorsedge.core.gear.GearEngine;
import com.operatorsedge.core.gear.GearStateRepository;
import com.operatorsedge.core.gear.GearStepResult;
import com.operatorsedge.core.gear.JunctionRequest;
import com.operatorsedge.core.junction.JunctionDecision;
import com.operatorsedge.core.junction.JunctionFingerprint;
import com.operatorsedge.core.junction.JunctionManager;
import com.operatorsedge.core.junction.PendingJunction;
import com.operatorsedge.core.logging.MdcContext;
import com.operatorsedge.core.model.GearMode;
import com.operatorsedge.core.model.GearState;
import com.operatorsedge.core.model.JunctionType;
import com.operatorsedge.core.model.QualityGateOverride;
import com.operatorsedge.core.plan.PlanContext;
import com.operatorsedge.core.plan.PlanContextLoader;
import com.operatorsedge.core.step.ProposedAction;
import com.operatorsedge.core.store.StateBusyException;
import com.operatorsedge.core.store.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point invoked once per agent turn.
 * <p>
 * A turn applies the human decision (if any), surfaces a pending junction without
 * advancing, otherwise advances the gear by one step and passes whatever it proposes
 * through the classifier. Iteration and stuck limits are enforced after the step.
 * <p>
 * "Is a decision pending" is always answered by {@link JunctionManager}; nothing else
 * keeps a copy of it. {@link #runTurn} never throws: lock contention becomes
 * {@link TurnStatus#BUSY} and any other failure {@link TurnStatus#ERROR}.
 */
@Service
public class DispatchLoop {

    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    public static final String OUTPUT_SOURCE = "output";
    public static final String SHELL_SOURCE = "shell";
    public static final String CONTROL_SOURCE = "control";
    public static final String STUCK_SOURCE = "stuck";

    private static final int EXCERPT_CHARS = 200;

    private final JunctionManager junctionManager;
    private final JunctionClassifier classifier;
    private final GearEngine gearEngine;
    private final GearStateRepository gearRepository;
    private final LoopStateRepository loopRepository;
    private final PlanContextLoader planLoader;
    private final Clock clock;
    private final int maxIterations;
    private final int stuckThreshold;

    public DispatchLoop(JunctionManager junctionManager,
                        JunctionClassifier classifier,
                        GearEngine gearEngine,
                        GearStateRepository gearRepository,
                        LoopStateRepository loopRepository,
                        PlanContextLoader planLoader,
                        Clock clock,
                        EdgeProperties properties) {
        this.junctionManager = junctionManager;
        this.classifier = classifier;
        this.gearEngine = gearEngine;
        this.gearRepository = gearRepository;
        this.loopRepository = loopRepository;
        this.planLoader = planLoader;
        this.clock = clock;
        this.maxIterations = properties.getLoop().getMaxIterations();
        this.stuckThreshold = Math.max(1, properties.getLoop().getStuckThreshold());
    }

    /**
     * Runs one turn.
     *
     * @param command     human command or decision ({@code approve}, {@code skip},
     *                    {@code dismiss [minutes]}, {@code stop}/{@code off}, {@code start}/{@code on}), may be null
     * @param agentOutput the agent's last output, checked for failure or open-choice language, may be null
     */
    public DispatchResult runTurn(String command, String agentOutput) {
        MdcContext.setTurn(UUID.randomUUID().toString().substring(0, 8));
        try {
            return turn(command, agentOutput);
        } catch (StateBusyException e) {
            log.warn("Turn aborted, {} is busy: {}", e.getFileName(), e.getMessage());
            return DispatchResult.builder(TurnStatus.BUSY)
                    .message("State busy, retry: " + e.getMessage())
                    .build();
        } catch (StateStoreException e) {
            log.error("State file {} failed: {}", e.getFileName(), e.getMessage(), e);
            return DispatchResult.builder(TurnStatus.ERROR)
                    .message(DispatchResult.INTERNAL_ERROR_MESSAGE)
                    .warnings(List.of(e.getMessage()))
                    .build();
        } catch (RuntimeException e) {
            log.error("Unexpected error during dispatch turn", e);
            return DispatchResult.builder(TurnStatus.ERROR)
                    .message(DispatchResult.INTERNAL_ERROR_MESSAGE)
                    .warnings(List.of(describe(e)))
                    .build();
        } finally {
            MdcContext.clear();
        }
    }

    private DispatchResult turn(String command, String agentOutput) {
        var warnings = new ArrayList<String>();

        Optional<HumanDecision> decision = HumanDecision.parse(command);
        if (decision.isEmpty() && command != null && !command.isBlank()) {
            warnings.add("Unrecognised command '" + command.strip() + "' ignored");
        }
        if (decision.isPresent()) {
            Optional<DispatchResult> early = applyDecision(decision.get(), warnings);
            if (early.isPresent()) {
                return early.get();
            }
        }

        GearState gear = gearRepository.snapshot();
        MdcContext.setGear(gear.mode().name());

        if (loopRepository.snapshot().stopped()) {
            return DispatchResult.builder(TurnStatus.STOPPED)
                    .mode(gear.mode())
                    .message("Autonomous loop is stopped; run 'start' to resume")
                    .warnings(warnings)
                    .build();
        }

        Optional<PendingJunction> pending = junctionManager.getPending();
        if (pending.isPresent()) {
            return junctionResult(pending.get(), gear.mode(), null, null, warnings);
        }

        if (agentOutput != null && !agentOutput.isBlank()) {
            OutputJunction verdict = classifier.detectOutputJunction(agentOutput);
            if (verdict.isPausing()) {
                var payload = new LinkedHashMap<String, Object>();
                payload.put("reason", verdict.reason());
                payload.put("excerpt", excerpt(agentOutput));
                Gate gate = raise(new JunctionRequest(verdict.type(), OUTPUT_SOURCE, payload), warnings);
                if (gate.pending() != null) {
                    return junctionResult(gate.pending(), gear.mode(), null, null, warnings);
                }
            }
        }

        return advance(gear, warnings);
    }

    private DispatchResult advance(GearState before, List<String> warnings) {
        PlanContext plan = planLoader.load();
        Instant now = clock.instant();

        GearStepResult step;
        try {
            step = gearRepository.advance(state -> gearEngine.step(state, plan, now), GearStepResult::state);
        } catch (StateStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Gear step failed, state unchanged: {}", e.getMessage(), e);
            warnings.add("Gear step failed: " + describe(e));
            LoopState loop = loopRepository.update(l ->
                    l.withProgress(l.sessionIterations() + 1, l.stuckCount(), l.lastProgressMarker()));
            if (loop.sessionIterations() > maxIterations) {
                return maxIterationsReached(before.mode(), null, warnings);
            }
            return DispatchResult.builder(TurnStatus.CONTINUE)
                    .mode(before.mode())
                    .continueLoop(true)
                    .message("Gear step failed; state unchanged")
                    .warnings(warnings)
                    .build();
        }

        MdcContext.setGear(step.state().mode().name());
        warnings.addAll(step.warnings());
        GearMode transitionTo = step.transitioned() ? step.state().mode() : null;
        String instruction = step.instruction();

        if (step.junction() != null) {
            Gate gate = raise(step.junction(), warnings);
            if (gate.pending() != null) {
                return junctionResult(gate.pending(), step.modeExecuted(), transitionTo, instruction, warnings);
            }
        }

        if (step.proposedAction() != null) {
            Optional<JunctionRequest> request = classify(step.proposedAction());
            if (request.isPresent()) {
                Gate gate = raise(request.get(), warnings);
                if (gate.pending() != null) {
                    return junctionResult(gate.pending(), step.modeExecuted(), transitionTo, instruction, warnings);
                }
                if (gate.skipped()) {
                    instruction = "Do not run '" + step.proposedAction().text()
                            + "' (skipped); find another way to complete: " + instruction;
                }
            }
        }

        String marker = step.modeExecuted() == GearMode.ACTIVE ? step.progressMarker() : null;
        LoopState loop = loopRepository.update(l -> {
            int stuck = marker != null && marker.equals(l.lastProgressMarker()) ? l.stuckCount() + 1 : 0;
            return l.withProgress(l.sessionIterations() + 1, stuck, marker);
        });

        if (loop.sessionIterations() > maxIterations) {
            return maxIterationsReached(step.modeExecuted(), transitionTo, warnings);
        }

        if (marker != null && loop.stuckCount() >= stuckThreshold) {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("reason", "No progress on the same step for " + loop.stuckCount() + " iterations");
            payload.put("progress_marker", marker);
            Gate gate = raise(new JunctionRequest(JunctionType.AMBIGUOUS, STUCK_SOURCE, payload), warnings);
            loopRepository.update(l -> l.withProgress(l.sessionIterations(), 0, l.lastProgressMarker()));
            if (gate.pending() != null) {
                log.info("Stuck on {} for {} iterations", marker, loop.stuckCount());
                return junctionResult(gate.pending(), step.modeExecuted(), transitionTo, instruction, warnings);
            }
        }

        TurnStatus status = step.idle() ? TurnStatus.IDLE : TurnStatus.CONTINUE;
        return DispatchResult.builder(status)
                .mode(step.modeExecuted())
                .transitionTo(transitionTo)
                .continueLoop(!step.idle())
                .instruction(instruction)
                .message(step.message())
                .warnings(warnings)
                .build();
    }

    private Optional<DispatchResult> applyDecision(HumanDecision decision, List<String> warnings) {
        switch (decision.kind()) {
            case START -> {
                loopRepository.update(l -> l.resetCounters(false, decision.word()));
                log.info("Autonomous loop started");
                return Optional.empty();
            }
            case STOP -> {
                Optional<PendingJunction> cleared = junctionManager.clearPending(JunctionDecision.STOP);
                loopRepository.update(l -> l.resetCounters(true, decision.word()));
                GearState gear = gearRepository.update(g -> g.withIterations(0));
                log.info("Autonomous loop stopped");
                return Optional.of(DispatchResult.builder(TurnStatus.STOPPED)
                        .mode(gear.mode())
                        .message("Autonomous loop stopped"
                                + (cleared.isPresent() ? " and the pending junction cleared" : "")
                                + "; run 'start' to resume")
                        .warnings(warnings)
                        .build());
            }
            default -> {
                JunctionDecision resolution = decision.kind().junctionDecision().orElseThrow();
                Optional<PendingJunction> cleared = junctionManager.clearPending(resolution, decision.suppressMinutes());
                if (cleared.isEmpty()) {
                    warnings.add("No junction pending; '" + decision.word() + "' ignored");
                    return Optional.empty();
                }
                PendingJunction junction = cleared.get();
                String fingerprint = JunctionFingerprint.of(junction);
                switch (decision.kind()) {
                    case APPROVE -> {
                        loopRepository.update(l -> l.withApproved(fingerprint).withDecision(decision.word()));
                        if (GearEngine.QUALITY_GATE_SOURCE.equals(junction.source())) {
                            QualityGateOverride override = overrideFor(junction);
                            gearRepository.update(g -> g.withQualityGateOverride(override));
                            log.info("Quality gate checks {} approved for objective '{}'",
                                    override.checks(), override.objective());
                        }
                    }
                    case SKIP -> loopRepository.update(l -> l.withSkipped(fingerprint).withDecision(decision.word()));
                    default -> loopRepository.update(l -> l.withDecision(decision.word()));
                }
                return Optional.empty();
            }
        }
    }

    /**
     * Turns a candidate pause into a pending junction unless an earlier decision covers it:
     * an approval lets one identical junction through, a skip lets none through for the
     * rest of the session, and an active suppression auto-dismisses it.
     */
    private Gate raise(JunctionRequest request, List<String> warnings) {
        String fingerprint = JunctionFingerprint.of(request.type(), request.payload());
        AtomicReference<Cover> cover = new AtomicReference<>(Cover.NONE);
        loopRepository.update(l -> {
            if (l.approvedFingerprints().contains(fingerprint)) {
                cover.set(Cover.APPROVED);
                return l.consumeApproval(fingerprint);
            }
            if (l.skippedFingerprints().contains(fingerprint)) {
                cover.set(Cover.SKIPPED);
            }
            return l;
        });

        switch (cover.get()) {
            case APPROVED -> {
                log.info("{} junction from {} proceeds on earlier approval", request.type(), request.source());
                return Gate.PROCEED;
            }
            case SKIPPED -> {
                warnings.add("Skipped by earlier decision: " + request.reason());
                return Gate.SKIPPED;
            }
            default -> { }
        }

        Optional<PendingJunction> pending =
                junctionManager.setPending(request.type(), request.payload(), request.source());
        if (pending.isEmpty()) {
            warnings.add("Junction suppressed by an earlier dismiss: " + request.reason());
            return Gate.PROCEED;
        }
        return new Gate(pending.get(), false);
    }

    private Optional<JunctionRequest> classify(ProposedAction action) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("command", action.text());
        if (action.kind() == ProposedAction.Kind.CONTROL) {
            JunctionType type = classifier.classifyControlCommand(action.text());
            if (!type.isPausing()) {
                return Optional.empty();
            }
            payload.put("reason", "Control command '" + action.text() + "' is not on the allow-list");
            return Optional.of(new JunctionRequest(type, CONTROL_SOURCE, payload));
        }
        return classifier.matchShellCommand(action.text()).map(match -> {
            payload.put("reason", "Command is " + match.describe());
            payload.put("rule", match.rule().name());
            return new JunctionRequest(match.verdict(), SHELL_SOURCE, payload);
        });
    }

    private DispatchResult maxIterationsReached(GearMode mode, GearMode transitionTo, List<String> warnings) {
        loopRepository.update(l -> l.withStopped(true));
        log.warn("Session reached {} iterations; loop stopped", maxIterations);
        return DispatchResult.builder(TurnStatus.MAX_ITERATIONS)
                .mode(mode)
                .transitionTo(transitionTo)
                .message("Reached the limit of " + maxIterations + " iterations; loop stopped. Run 'start' to resume")
                .warnings(warnings)
                .build();
    }

    private DispatchResult junctionResult(PendingJunction junction, GearMode mode, GearMode transitionTo,
                                          String instruction, List<String> warnings) {
        MdcContext.setJunction(junction.id());
        return DispatchResult.builder(TurnStatus.JUNCTION)
                .mode(mode)
                .transitionTo(transitionTo)
                .junction(junction)
                .instruction(instruction)
                .message("Paused at " + junction.type() + " junction: " + junction.reason()
                        + ". Respond with approve, skip, dismiss [minutes] or stop")
                .warnings(warnings)
                .build();
    }

    private QualityGateOverride overrideFor(PendingJunction junction) {
        Map<String, Object> payload = junction.payload();
        Object objective = payload.get("objective");
        var checks = new ArrayList<String>();
        if (payload.get("failed_checks") instanceof List<?> list) {
            list.forEach(c -> checks.add(String.valueOf(c)));
        }
        return new QualityGateOverride(objective != null ? objective.toString() : null, checks, clock.instant());
    }

    private static String excerpt(String text) {
        String stripped = text.strip();
        return stripped.length() <= EXCERPT_CHARS ? stripped : stripped.substring(0, EXCERPT_CHARS) + "...";
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Outcome of {@link #raise}: a new pending junction, or why none was created.
     */
    private record Gate(PendingJunction pending, boolean skipped) {
        static final Gate PROCEED = new Gate(null, false);
        static final Gate SKIPPED = new Gate(null, true);
    }

    private enum Cover { NONE, APPROVED, SKIPPED }
}
