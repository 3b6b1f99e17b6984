package com.operatorsedge.dispatch.cli;

import com.operatorsedge.core.junction.JunctionManager;
import com.operatorsedge.core.junction.MigrationOutcome;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: edge migrate
 * <p>
 * Brings the junction state to the current schema, importing an open legacy junction.
 * Safe to run any number of times.
 */
@Command(name = "migrate", mixinStandardHelpOptions = true,
        description = "Migrate legacy junction state to the current schema")
@Component
public class MigrateCommand implements Runnable {

    private final JunctionManager junctionManager;

    public MigrateCommand(JunctionManager junctionManager) {
        this.junctionManager = junctionManager;
    }

    @Override
    public void run() {
        MigrationOutcome outcome = junctionManager.migrate();
        switch (outcome) {
            case ALREADY_CURRENT -> ConsoleOutput.info("Junction state already current; nothing to do");
            case UPGRADED -> ConsoleOutput.success("Junction state upgraded; no legacy junction to import");
            case IMPORTED_LEGACY -> {
                ConsoleOutput.success("Junction state upgraded; open legacy junction imported");
                junctionManager.getPending().ifPresent(ConsoleOutput::junction);
            }
        }
    }
}
