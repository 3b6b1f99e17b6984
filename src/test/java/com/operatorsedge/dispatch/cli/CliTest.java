package com.operatorsedge.dispatch.cli;

import com.operatorsedge.core.dispatch.DispatchLoop;
import com.operatorsedge.core.dispatch.DispatchResult;
import com.operatorsedge.core.dispatch.LoopState;
import com.operatorsedge.core.dispatch.LoopStateRepository;
import com.operatorsedge.core.dispatch.TurnStatus;
import com.operatorsedge.core.gear.GearStateRepository;
import com.operatorsedge.core.health.HealthCheckService;
import com.operatorsedge.core.health.HealthStatus;
import com.operatorsedge.core.junction.JunctionDecision;
import com.operatorsedge.core.junction.JunctionHistoryEntry;
import com.operatorsedge.core.junction.JunctionManager;
import com.operatorsedge.core.junction.JunctionState;
import com.operatorsedge.core.junction.MigrationOutcome;
import com.operatorsedge.core.junction.PendingJunction;
import com.operatorsedge.core.junction.SuppressionEntry;
import com.operatorsedge.core.model.GearMode;
import com.operatorsedge.core.model.GearState;
import com.operatorsedge.core.model.GearTransition;
import com.operatorsedge.core.model.JunctionType;
import com.operatorsedge.core.store.StateJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the edge CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and execution behavior.
 */
class CliTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private record CliResult(int exitCode, String output) {}

    private DispatchLoop dispatchLoop;
    private GearStateRepository gearRepository;
    private LoopStateRepository loopRepository;
    private JunctionManager junctionManager;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        dispatchLoop = mock(DispatchLoop.class);
        gearRepository = mock(GearStateRepository.class);
        loopRepository = mock(LoopStateRepository.class);
        junctionManager = mock(JunctionManager.class);
        healthCheckService = mock(HealthCheckService.class);

        when(dispatchLoop.runTurn(any(), any())).thenReturn(DispatchResult.builder(TurnStatus.CONTINUE)
                .mode(GearMode.ACTIVE)
                .continueLoop(true)
                .instruction("Step 1/2: Write failing test")
                .message("0/2 steps completed")
                .build());
        when(gearRepository.snapshot()).thenReturn(
                new GearState(GearMode.PATROL, NOW, 2, GearTransition.ACTIVE_TO_PATROL, 3, 0, 1, null));
        when(loopRepository.snapshot()).thenReturn(LoopState.initial());
        when(junctionManager.snapshot()).thenReturn(JunctionState.empty());
        when(junctionManager.getPending()).thenReturn(Optional.empty());
    }

    private static PendingJunction pushJunction() {
        return new PendingJunction("3f0c7c1e-0000-4000-8000-000000000001", JunctionType.IRREVERSIBLE,
                Map.of("command", "git push", "reason", "Command is irreversible (git-push): \"git push\""),
                NOW, "shell");
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(dispatchLoop, StateJson.newMapper());
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(gearRepository, loopRepository, junctionManager);
                }
                if (cls == JunctionCommand.class) {
                    return (K) new JunctionCommand(junctionManager, Clock.fixed(NOW, ZoneOffset.UTC));
                }
                if (cls == MigrateCommand.class) {
                    return (K) new MigrateCommand(junctionManager);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new EdgeCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            for (String sub : List.of("run", "status", "junction", "migrate", "health", "help")) {
                assertTrue(output.contains(sub), "Help should list '" + sub + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Operator's Edge 0.1.0"));
        }

        @Test
        @DisplayName("No subcommand prints banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("OPERATOR'S EDGE"));
            assertTrue(result.output().contains("Usage: edge"));
        }

        @Test
        @DisplayName("Unknown option fails with a usage error")
        void unknownOption() {
            CliResult result = execute("run", "--bogus");
            assertNotEquals(0, result.exitCode());
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("Prints the turn result as snake_case JSON")
        void printsJson() {
            CliResult result = execute("run");

            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("\"status\" : \"CONTINUE\""), output);
            assertTrue(output.contains("\"continue_loop\" : true"), output);
            assertTrue(output.contains("\"junction_hit\" : false"), output);
            assertTrue(output.contains("\"instruction\" : \"Step 1/2: Write failing test\""), output);
            assertFalse(output.contains("OPERATOR'S EDGE"), "run must print nothing but JSON");
            verify(dispatchLoop).runTurn(null, null);
        }

        @Test
        @DisplayName("Decision words are joined into one command")
        void decisionWords() {
            execute("run", "dismiss", "30");
            verify(dispatchLoop).runTurn("dismiss 30", null);
        }

        @Test
        @DisplayName("--output passes the agent output inline")
        void inlineOutput() {
            execute("run", "--output", "BUILD FAILED");
            verify(dispatchLoop).runTurn(null, "BUILD FAILED");
        }

        @Test
        @DisplayName("--output-file reads the agent output from a file")
        void outputFile(@TempDir Path tempDir) throws Exception {
            Path file = tempDir.resolve("last.txt");
            Files.writeString(file, "Which approach would you prefer?");

            execute("run", "approve", "--output-file", file.toString());

            verify(dispatchLoop).runTurn("approve", "Which approach would you prefer?");
        }

        @Test
        @DisplayName("Unreadable --output-file is treated as no output")
        void missingOutputFile(@TempDir Path tempDir) {
            CliResult result = execute("run", "--output-file", tempDir.resolve("missing.txt").toString());

            assertEquals(0, result.exitCode());
            verify(dispatchLoop).runTurn(null, null);
        }
    }

    @Nested
    @DisplayName("Status and junction views")
    class ViewTests {

        @Test
        @DisplayName("status shows gear, loop and junction state")
        void status() {
            CliResult result = execute("status");

            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("PATROL"), output);
            assertTrue(output.contains("2 iterations"), output);
            assertTrue(output.contains("Patrol findings: 3"), output);
            assertTrue(output.contains("Loop: running"), output);
            assertTrue(output.contains("No junction pending"), output);
        }

        @Test
        @DisplayName("status shows a stopped loop and the pending junction")
        void statusStoppedWithJunction() {
            when(loopRepository.snapshot()).thenReturn(LoopState.initial().withStopped(true));
            when(junctionManager.snapshot()).thenReturn(
                    new JunctionState(JunctionState.CURRENT_SCHEMA_VERSION, pushJunction(), List.of(), List.of()));

            String output = execute("status").output();

            assertTrue(output.contains("Loop: STOPPED"), output);
            assertTrue(output.contains("JUNCTION IRREVERSIBLE"), output);
            assertTrue(output.contains("command: git push"), output);
        }

        @Test
        @DisplayName("junction lists history and only active suppressions")
        void junction() {
            when(junctionManager.snapshot()).thenReturn(new JunctionState(JunctionState.CURRENT_SCHEMA_VERSION,
                    null,
                    List.of(new JunctionHistoryEntry("old-1", JunctionType.BLOCKED, JunctionDecision.SKIP, NOW)),
                    List.of(new SuppressionEntry("aaaaaaaaaaaabbbb", NOW.plusSeconds(600)),
                            new SuppressionEntry("cccccccccccc0000", NOW.minusSeconds(1)))));

            CliResult result = execute("junction");

            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("RECENT DECISIONS (1)"), output);
            assertTrue(output.contains("old-1"), output);
            assertTrue(output.contains("ACTIVE SUPPRESSIONS (1)"), output);
            assertTrue(output.contains("aaaaaaaaaaaa"), output);
            assertFalse(output.contains("cccccccccccc"), output);
        }
    }

    @Nested
    @DisplayName("migrate and health")
    class MaintenanceTests {

        @Test
        @DisplayName("migrate reports an imported legacy junction")
        void migrateImported() {
            when(junctionManager.migrate()).thenReturn(MigrationOutcome.IMPORTED_LEGACY);
            when(junctionManager.getPending()).thenReturn(Optional.of(pushJunction()));

            CliResult result = execute("migrate");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("open legacy junction imported"), result.output());
            assertTrue(result.output().contains("git push"), result.output());
        }

        @Test
        @DisplayName("migrate is a no-op when already current")
        void migrateCurrent() {
            when(junctionManager.migrate()).thenReturn(MigrationOutcome.ALREADY_CURRENT);

            assertTrue(execute("migrate").output().contains("already current"));
        }

        @Test
        @DisplayName("health groups checks by area, prints their facts and tolerates DEGRADED")
        void health() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    HealthStatus.up(HealthStatus.Area.INSTALLATION, "platform", "GENERIC at /tmp/p")
                            .withFact("project_dir", "/tmp/p"),
                    HealthStatus.up(HealthStatus.Area.STATE, "junction_state.json", "Valid")
                            .withFact("schema_version", "2"),
                    HealthStatus.degraded(HealthStatus.Area.PLAN, "plan", "not found; no objective")));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("INSTALLATION (1)"), output);
            assertTrue(output.contains("STATE FILES (1)"), output);
            assertTrue(output.contains("PLAN (1)"), output);
            assertTrue(output.indexOf("INSTALLATION") < output.indexOf("STATE FILES"), output);
            assertTrue(output.contains("platform: GENERIC at /tmp/p"), output);
            assertTrue(output.contains("project_dir = /tmp/p"), output);
            assertTrue(output.contains("schema_version = 2"), output);
            assertTrue(output.contains("Usable: 2 up, 1 degraded, 0 down"), output);
        }

        @Test
        @DisplayName("health exits 1 when a check is DOWN")
        void healthDown() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    HealthStatus.down(HealthStatus.Area.STATE, "loop_state.json", "Corrupt (bad json)")));

            CliResult result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Unhealthy: 0 up, 0 degraded, 1 down"), result.output());
        }

        @Test
        @DisplayName("health reports healthy when every check is UP")
        void healthy() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    HealthStatus.up(HealthStatus.Area.INSTALLATION, "platform", "ok")));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Healthy: 1 up, 0 degraded, 0 down"), result.output());
        }
    }
}
