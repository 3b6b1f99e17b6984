package com.operatorsedge.dispatch.cli;

import com.operatorsedge.core.health.HealthCheckService;
import com.operatorsedge.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: edge health
 * <p>
 * Prints the installation, state file and plan checks grouped by area. Exits 1 when
 * any check is DOWN, so a host hook can refuse to start the loop on a broken install.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check installation and state health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<HealthStatus> checks = healthCheckService.checkAll();
        Map<HealthStatus.Area, List<HealthStatus>> byArea = checks.stream()
                .collect(Collectors.groupingBy(HealthStatus::area,
                        () -> new EnumMap<>(HealthStatus.Area.class), Collectors.toList()));

        byArea.forEach((area, results) -> {
            System.out.println();
            System.out.println(area.title().toUpperCase(Locale.ROOT) + " (" + results.size() + ")");
            results.forEach(HealthCommand::print);
        });

        Map<HealthStatus.Status, Long> counts = checks.stream()
                .collect(Collectors.groupingBy(HealthStatus::status,
                        () -> new EnumMap<>(HealthStatus.Status.class), Collectors.counting()));
        long down = counts.getOrDefault(HealthStatus.Status.DOWN, 0L);
        long degraded = counts.getOrDefault(HealthStatus.Status.DEGRADED, 0L);

        System.out.println("──────────────────────────────────");
        String summary = counts.getOrDefault(HealthStatus.Status.UP, 0L) + " up, "
                + degraded + " degraded, " + down + " down";
        if (down > 0) {
            ConsoleOutput.error("Unhealthy: " + summary);
            return 1;
        }
        if (degraded > 0) {
            ConsoleOutput.warn("Usable: " + summary);
        } else {
            ConsoleOutput.success("Healthy: " + summary);
        }
        return 0;
    }

    private static void print(HealthStatus check) {
        String label = check.component() + ": " + check.detail();
        switch (check.status()) {
            case UP -> ConsoleOutput.success(label);
            case DEGRADED -> ConsoleOutput.warn(label);
            case DOWN -> ConsoleOutput.error(label);
        }
        new TreeMap<>(check.facts()).forEach((key, value) -> System.out.println("    " + key + " = " + value));
    }
}
