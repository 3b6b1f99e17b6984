package com.operatorsedge.core.junction;

/**
 * What {@link JunctionManager#migrate()} did.
 */
public enum MigrationOutcome {
    /** Schema marker already current; nothing changed. */
    ALREADY_CURRENT,
    /** Schema marker raised; no legacy junction needed importing. */
    UPGRADED,
    /** Schema marker raised and an open legacy junction imported as the pending record. */
    IMPORTED_LEGACY
}
