package com.operatorsedge.core.gear;

import com.operatorsedge.core.model.JunctionType;

import java.util.Map;

/**
 * A pause the gear step asks for. The dispatch loop decides whether it becomes pending.
 *
 * @param type    pausing junction type
 * @param source  what raised it, e.g. {@code quality_gate} or {@code step}
 * @param payload junction payload; always carries {@code reason}
 */
public record JunctionRequest(JunctionType type, String source, Map<String, Object> payload) {

    public JunctionRequest {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public String reason() {
        Object reason = payload.get("reason");
        return reason != null ? reason.toString() : null;
    }
}
