package com.operatorsedge.core.junction;

import com.operatorsedge.core.model.JunctionType;

import java.time.Instant;

/**
 * Trimmed record of a resolved junction.
 */
public record JunctionHistoryEntry(
    String id,
    JunctionType type,
    JunctionDecision decision,
    Instant decidedAt
) {}
