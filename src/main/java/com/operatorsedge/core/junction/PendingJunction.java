package com.operatorsedge.core.junction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.operatorsedge.core.model.JunctionType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single decision currently waiting for a human.
 *
 * @param id        unique identifier
 * @param type      pausing verdict that raised the junction
 * @param payload   what was about to happen (command, reason, step, ...)
 * @param createdAt when the junction was raised
 * @param source    component that raised it, e.g. {@code shell}, {@code quality_gate}, {@code stuck}
 */
public record PendingJunction(
    String id,
    JunctionType type,
    Map<String, Object> payload,
    Instant createdAt,
    String source
) {

    public PendingJunction {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    @JsonIgnore
    public String reason() {
        Object reason = payload.get("reason");
        return reason != null ? reason.toString() : null;
    }
}
