package com.operatorsedge.core.health;

import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of one health check.
 *
 * @param area      which part of the installation the check belongs to
 * @param component state file name or check name
 * @param status    verdict
 * @param detail    one-line explanation
 * @param facts     extra key/value details (paths, schema version), possibly empty
 */
public record HealthStatus(
    Area area,
    String component,
    Status status,
    String detail,
    Map<String, String> facts
) {

    public enum Status { UP, DEGRADED, DOWN }

    public enum Area {
        INSTALLATION("Installation"),
        STATE("State files"),
        PLAN("Plan");

        private final String title;

        Area(String title) {
            this.title = title;
        }

        public String title() {
            return title;
        }
    }

    public HealthStatus {
        facts = facts == null ? Map.of() : Map.copyOf(facts);
    }

    public static HealthStatus up(Area area, String component, String detail) {
        return new HealthStatus(area, component, Status.UP, detail, Map.of());
    }

    public static HealthStatus degraded(Area area, String component, String detail) {
        return new HealthStatus(area, component, Status.DEGRADED, detail, Map.of());
    }

    public static HealthStatus down(Area area, String component, String detail) {
        return new HealthStatus(area, component, Status.DOWN, detail, Map.of());
    }

    public HealthStatus withFact(String key, String value) {
        var merged = new TreeMap<>(facts);
        merged.put(key, value);
        return new HealthStatus(area, component, status, detail, merged);
    }
}
