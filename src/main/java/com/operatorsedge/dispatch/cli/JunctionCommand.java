package com.operatorsedge.dispatch.cli;

import com.operatorsedge.core.junction.JunctionHistoryEntry;
import com.operatorsedge.core.junction.JunctionManager;
import com.operatorsedge.core.junction.JunctionState;
import com.operatorsedge.core.junction.SuppressionEntry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * CLI command: edge junction
 * <p>
 * Shows the pending junction, the recent decisions and the active suppressions.
 */
@Command(name = "junction", mixinStandardHelpOptions = true,
        description = "Show the pending junction, decision history and suppressions")
@Component
public class JunctionCommand implements Runnable {

    private final JunctionManager junctionManager;
    private final Clock clock;

    public JunctionCommand(JunctionManager junctionManager, Clock clock) {
        this.junctionManager = junctionManager;
        this.clock = clock;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        JunctionState state = junctionManager.snapshot();

        if (state.pending() == null) {
            ConsoleOutput.success("No junction pending");
        } else {
            ConsoleOutput.junction(state.pending());
        }

        List<JunctionHistoryEntry> history = state.historyTail();
        System.out.println();
        System.out.println("RECENT DECISIONS (" + history.size() + ")");
        if (!history.isEmpty()) {
            System.out.printf("  %-38s %-13s %-8s %s%n", "ID", "TYPE", "DECISION", "DECIDED");
            System.out.println("  " + "-".repeat(84));
            for (var entry : history) {
                System.out.printf("  %-38s %-13s %-8s %s%n",
                        entry.id(), entry.type(), entry.decision(), entry.decidedAt());
            }
        }

        Instant now = clock.instant();
        List<SuppressionEntry> active = state.suppression().stream().filter(s -> s.isActive(now)).toList();
        System.out.println();
        System.out.println("ACTIVE SUPPRESSIONS (" + active.size() + ")");
        for (var entry : active) {
            String fp = entry.fingerprint();
            System.out.println("  " + (fp.length() > 12 ? fp.substring(0, 12) : fp) + "  until " + entry.expiresAt());
        }
    }
}
