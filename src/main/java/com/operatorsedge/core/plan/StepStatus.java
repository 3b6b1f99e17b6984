package com.operatorsedge.core.plan;

import java.util.Locale;

/**
 * Status of one plan step as written in the plan file.
 */
public enum StepStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    BLOCKED;

    /**
     * Lenient parse of the plan-file spelling ({@code in_progress}, {@code in-progress},
     * {@code done}). Anything unrecognised counts as pending.
     */
    public static StepStatus parse(String value) {
        if (value == null) {
            return PENDING;
        }
        return switch (value.strip().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "in_progress", "active", "started" -> IN_PROGRESS;
            case "completed", "complete", "done" -> COMPLETED;
            case "blocked" -> BLOCKED;
            default -> PENDING;
        };
    }

    public boolean isFinished() {
        return this == COMPLETED;
    }
}
