package com.operatorsedge.core.junction;

import java.util.List;

/**
 * Persisted junction document: the only place that answers "is a decision pending".
 *
 * @param schemaVersion format version; below {@link #CURRENT_SCHEMA_VERSION} means legacy data may need importing
 * @param pending       the open junction, or null
 * @param historyTail   resolved junctions, oldest first, bounded
 * @param suppression   active auto-dismiss rules
 */
public record JunctionState(
    int schemaVersion,
    PendingJunction pending,
    List<JunctionHistoryEntry> historyTail,
    List<SuppressionEntry> suppression
) {

    public static final int CURRENT_SCHEMA_VERSION = 2;

    public JunctionState {
        historyTail = historyTail == null ? List.of() : List.copyOf(historyTail);
        suppression = suppression == null ? List.of() : List.copyOf(suppression);
    }

    public static JunctionState empty() {
        return new JunctionState(CURRENT_SCHEMA_VERSION, null, List.of(), List.of());
    }

    /**
     * Shape used when the on-disk document is missing or unreadable and the caller
     * needs to know that no migration has happened yet.
     */
    public static JunctionState unversioned() {
        return new JunctionState(0, null, List.of(), List.of());
    }
}
