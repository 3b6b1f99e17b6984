package com.operatorsedge.core.junction;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Pure state transitions over {@link JunctionState}. Each function takes the full
 * state and returns the full updated state; persistence is the caller's concern.
 */
public final class JunctionLedger {

    private JunctionLedger() {}

    /**
     * Result of clearing the pending junction.
     *
     * @param state   updated state
     * @param cleared the junction that was pending, or null when nothing was
     */
    public record Cleared(JunctionState state, PendingJunction cleared) {}

    /**
     * Installs {@code junction} as the pending record, replacing any previous one.
     */
    public static JunctionState withPending(JunctionState state, PendingJunction junction) {
        return new JunctionState(state.schemaVersion(), junction, state.historyTail(), state.suppression());
    }

    /**
     * Moves the pending junction into the history tail. A {@link JunctionDecision#DISMISS}
     * also adds a suppression entry for the junction's fingerprint. When nothing is
     * pending the state is returned untouched.
     */
    public static Cleared clear(JunctionState state, JunctionDecision decision, Instant now,
                                Duration suppressFor, int historyCap) {
        PendingJunction pending = state.pending();
        if (pending == null) {
            return new Cleared(state, null);
        }

        var entry = new JunctionHistoryEntry(pending.id(), pending.type(), decision, now);
        List<JunctionHistoryEntry> history = appendBounded(state.historyTail(), entry, historyCap);

        List<SuppressionEntry> suppression = state.suppression();
        if (decision == JunctionDecision.DISMISS) {
            var updated = new ArrayList<>(pruneExpired(suppression, now));
            String fingerprint = JunctionFingerprint.of(pending);
            updated.removeIf(s -> s.fingerprint().equals(fingerprint));
            updated.add(new SuppressionEntry(fingerprint, now.plus(suppressFor)));
            suppression = updated;
        }

        return new Cleared(new JunctionState(state.schemaVersion(), null, history, suppression), pending);
    }

    public static boolean isSuppressed(JunctionState state, String fingerprint, Instant now) {
        for (SuppressionEntry entry : state.suppression()) {
            if (entry.fingerprint().equals(fingerprint) && entry.isActive(now)) {
                return true;
            }
        }
        return false;
    }

    public static JunctionState withoutExpiredSuppression(JunctionState state, Instant now) {
        List<SuppressionEntry> active = pruneExpired(state.suppression(), now);
        if (active.size() == state.suppression().size()) {
            return state;
        }
        return new JunctionState(state.schemaVersion(), state.pending(), state.historyTail(), active);
    }

    /**
     * Appends {@code entry} and drops the oldest entries beyond {@code cap}.
     */
    public static List<JunctionHistoryEntry> appendBounded(List<JunctionHistoryEntry> history,
                                                           JunctionHistoryEntry entry, int cap) {
        var updated = new ArrayList<>(history);
        updated.add(entry);
        int overflow = updated.size() - Math.max(1, cap);
        if (overflow > 0) {
            updated.subList(0, overflow).clear();
        }
        return updated;
    }

    private static List<SuppressionEntry> pruneExpired(List<SuppressionEntry> entries, Instant now) {
        return entries.stream().filter(e -> e.isActive(now)).toList();
    }
}
