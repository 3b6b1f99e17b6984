package com.operatorsedge.core.junction;

import com.operatorsedge.core.config.EdgeProperties;
import com.operatorsedge.core.logging.MdcContext;
import com.operatorsedge.core.model.JunctionType;
import com.operatorsedge.core.store.LoadedState;
import com.operatorsedge.core.store.StateFiles;
import com.operatorsedge.core.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the pending-decision record, its suppression list and the bounded decision history.
 * <p>
 * Every call loads {@code junction_state.json} fresh; mutations are lock-protected
 * read-modify-write cycles through {@link StateStore#update}. A new pending junction
 * always replaces the previous one (last writer wins).
 */
@Service
public class JunctionManager {

    private static final Logger log = LoggerFactory.getLogger(JunctionManager.class);

    private final StateStore store;
    private final LegacyJunctionReader legacyReader;
    private final Clock clock;
    private final int historyCap;
    private final int defaultSuppressMinutes;

    public JunctionManager(StateStore store, LegacyJunctionReader legacyReader, Clock clock,
                           EdgeProperties properties) {
        this.store = store;
        this.legacyReader = legacyReader;
        this.clock = clock;
        this.historyCap = properties.getJunction().getHistoryCap();
        this.defaultSuppressMinutes = properties.getJunction().getDefaultSuppressMinutes();
    }

    /**
     * Raises a junction. When an active suppression entry matches the junction's
     * fingerprint, the junction is auto-dismissed and nothing becomes pending.
     *
     * @return the new pending record, or empty when it was suppressed
     * @throws IllegalArgumentException if {@code type} is {@link JunctionType#NONE}
     */
    public Optional<PendingJunction> setPending(JunctionType type, Map<String, Object> payload, String source) {
        if (!type.isPausing()) {
            throw new IllegalArgumentException("Only pausing junction types can be pending, got " + type);
        }
        migrateIfNeeded();
        Instant now = clock.instant();
        var candidate = new PendingJunction(UUID.randomUUID().toString(), type, payload, now, source);
        String fingerprint = JunctionFingerprint.of(candidate);

        AtomicReference<PendingJunction> installed = new AtomicReference<>();
        AtomicReference<PendingJunction> replaced = new AtomicReference<>();
        store.update(StateFiles.JUNCTION, JunctionState.class, JunctionState::empty, state -> {
            JunctionState pruned = JunctionLedger.withoutExpiredSuppression(state, now);
            if (JunctionLedger.isSuppressed(pruned, fingerprint, now)) {
                return pruned;
            }
            installed.set(candidate);
            replaced.set(pruned.pending());
            return JunctionLedger.withPending(pruned, candidate);
        });

        PendingJunction result = installed.get();
        if (result == null) {
            log.info("Junction {} from {} auto-dismissed by active suppression", type, source);
            return Optional.empty();
        }
        if (replaced.get() != null) {
            log.warn("Junction {} replaced by {} without a decision", replaced.get().id(), result.id());
        }
        MdcContext.setJunction(result.id());
        log.info("Junction {} raised by {}: {}", type, source, result.reason());
        return Optional.of(result);
    }

    /**
     * Returns the pending junction, if any. Does not write, except for the one-time
     * import of an open legacy junction when the document has not been migrated yet.
     */
    public Optional<PendingJunction> getPending() {
        LoadedState<JunctionState> loaded = migrateIfNeeded();
        return Optional.ofNullable(loaded.value().pending());
    }

    public Optional<PendingJunction> clearPending(JunctionDecision decision) {
        return clearPending(decision, null);
    }

    /**
     * Resolves the pending junction. {@link JunctionDecision#DISMISS} also suppresses
     * identical junctions for {@code suppressMinutes} (default from configuration).
     * Nothing is written when no junction is pending.
     *
     * @return the cleared record, or empty when nothing was pending
     */
    public Optional<PendingJunction> clearPending(JunctionDecision decision, Integer suppressMinutes) {
        migrateIfNeeded();
        Instant now = clock.instant();
        int minutes = suppressMinutes != null && suppressMinutes > 0 ? suppressMinutes : defaultSuppressMinutes;

        AtomicReference<PendingJunction> cleared = new AtomicReference<>();
        store.update(StateFiles.JUNCTION, JunctionState.class, JunctionState::empty, state -> {
            JunctionLedger.Cleared result =
                    JunctionLedger.clear(state, decision, now, Duration.ofMinutes(minutes), historyCap);
            cleared.set(result.cleared());
            return result.state();
        });

        PendingJunction junction = cleared.get();
        if (junction == null) {
            log.debug("clearPending({}) with nothing pending", decision);
            return Optional.empty();
        }
        if (decision == JunctionDecision.DISMISS) {
            log.info("Junction {} dismissed; identical junctions suppressed for {} minutes", junction.id(), minutes);
        } else {
            log.info("Junction {} resolved: {}", junction.id(), decision);
        }
        return Optional.of(junction);
    }

    /**
     * Brings {@code junction_state.json} to the current schema, importing an open legacy
     * junction when there is no current pending record. Idempotent: once the schema
     * marker is current, further calls change nothing.
     */
    public MigrationOutcome migrate() {
        Optional<PendingJunction> legacy = legacyReader.readOpenJunction();
        AtomicReference<MigrationOutcome> outcome = new AtomicReference<>(MigrationOutcome.ALREADY_CURRENT);

        store.update(StateFiles.JUNCTION, JunctionState.class, JunctionState::unversioned, state -> {
            if (state.schemaVersion() >= JunctionState.CURRENT_SCHEMA_VERSION) {
                return state;
            }
            PendingJunction pending = state.pending();
            if (pending == null && legacy.isPresent()) {
                pending = legacy.get();
                outcome.set(MigrationOutcome.IMPORTED_LEGACY);
            } else {
                outcome.set(MigrationOutcome.UPGRADED);
            }
            return new JunctionState(JunctionState.CURRENT_SCHEMA_VERSION, pending,
                    state.historyTail(), state.suppression());
        });

        if (outcome.get() != MigrationOutcome.ALREADY_CURRENT) {
            log.info("Junction state migrated to schema {}: {}", JunctionState.CURRENT_SCHEMA_VERSION, outcome.get());
        }
        return outcome.get();
    }

    /**
     * Lock-free view of the whole document for status displays.
     */
    public JunctionState snapshot() {
        return store.read(StateFiles.JUNCTION, JunctionState.class, JunctionState::empty);
    }

    /**
     * Runs {@link #migrate()} when the document predates the current schema, so a legacy
     * junction is visible to reads and to the first decision alike.
     *
     * @return the document as it stands after any migration
     */
    private LoadedState<JunctionState> migrateIfNeeded() {
        LoadedState<JunctionState> loaded =
                store.inspect(StateFiles.JUNCTION, JunctionState.class, JunctionState::unversioned);
        if (!needsMigration(loaded)) {
            return loaded;
        }
        migrate();
        return store.inspect(StateFiles.JUNCTION, JunctionState.class, JunctionState::unversioned);
    }

    private boolean needsMigration(LoadedState<JunctionState> loaded) {
        if (loaded.value().schemaVersion() >= JunctionState.CURRENT_SCHEMA_VERSION) {
            return false;
        }
        // A valid old-schema document is always upgraded; a missing or corrupt one only
        // when there is legacy data that could otherwise never surface.
        return loaded.isValid() || legacyReader.hasLegacyFile();
    }
}
