package com.operatorsedge.core.junction;

import java.time.Instant;

/**
 * Auto-dismiss rule for junctions with a matching content fingerprint.
 */
public record SuppressionEntry(
    String fingerprint,
    Instant expiresAt
) {

    public boolean isActive(Instant now) {
        return expiresAt != null && expiresAt.isAfter(now);
    }
}
