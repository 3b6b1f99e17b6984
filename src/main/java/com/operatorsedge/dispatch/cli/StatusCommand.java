package com.operatorsedge.dispatch.cli;

import com.operatorsedge.core.dispatch.LoopState;
import com.operatorsedge.core.dispatch.LoopStateRepository;
import com.operatorsedge.core.gear.GearStateRepository;
import com.operatorsedge.core.junction.JunctionManager;
import com.operatorsedge.core.junction.PendingJunction;
import com.operatorsedge.core.model.GearState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: edge status
 * <p>
 * Lock-free, read-only view of the gear, the loop counters and the pending junction.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show gear, loop and junction status")
@Component
public class StatusCommand implements Runnable {

    private final GearStateRepository gearRepository;
    private final LoopStateRepository loopRepository;
    private final JunctionManager junctionManager;

    public StatusCommand(GearStateRepository gearRepository, LoopStateRepository loopRepository,
                         JunctionManager junctionManager) {
        this.gearRepository = gearRepository;
        this.loopRepository = loopRepository;
        this.junctionManager = junctionManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        GearState gear = gearRepository.snapshot();
        ConsoleOutput.gear(gear.mode().name(), gear.iterations());
        if (gear.lastTransition() != null) {
            ConsoleOutput.info("Entered via " + gear.lastTransition() + " at " + gear.enteredAt());
        }
        ConsoleOutput.info("Patrol findings: " + gear.patrolFindingsCount()
                + " | Dream proposals: " + gear.dreamProposalsCount());
        if (gear.qualityGateOverride() != null) {
            ConsoleOutput.warn("Quality gate override for '" + gear.qualityGateOverride().objective()
                    + "': " + gear.qualityGateOverride().checks());
        }

        LoopState loop = loopRepository.snapshot();
        if (loop.stopped()) {
            ConsoleOutput.warn("Loop: STOPPED (run 'edge run start' to resume)");
        } else {
            ConsoleOutput.success("Loop: running");
        }
        ConsoleOutput.info("Session iterations: " + loop.sessionIterations()
                + " | Turns without progress: " + loop.stuckCount());

        PendingJunction pending = junctionManager.snapshot().pending();
        System.out.println();
        if (pending == null) {
            ConsoleOutput.success("No junction pending");
        } else {
            ConsoleOutput.junction(pending);
        }
    }
}
