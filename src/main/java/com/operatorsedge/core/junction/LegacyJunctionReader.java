package com.operatorsedge.core.junction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.operatorsedge.core.model.JunctionType;
import com.operatorsedge.core.store.StateFiles;
import com.operatorsedge.core.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads the open-junction marker from the pre-v2 {@code dispatch_state.json}.
 * <p>
 * A legacy junction is open when the document has {@code "state": "junction"} or a
 * non-null {@code "junction"} object. The reader never writes the legacy file, and it
 * derives the record id from the junction content so repeated imports produce the same record.
 */
public class LegacyJunctionReader {

    private static final Logger log = LoggerFactory.getLogger(LegacyJunctionReader.class);

    private final StateStore store;

    public LegacyJunctionReader(StateStore store) {
        this.store = store;
    }

    public boolean hasLegacyFile() {
        return store.exists(StateFiles.LEGACY_DISPATCH);
    }

    public Optional<PendingJunction> readOpenJunction() {
        if (!hasLegacyFile()) {
            return Optional.empty();
        }
        JsonNode root = store.read(StateFiles.LEGACY_DISPATCH, JsonNode.class, MissingNode::getInstance);
        if (!root.isObject()) {
            return Optional.empty();
        }

        JsonNode junction = root.path("junction");
        boolean markedOpen = "junction".equalsIgnoreCase(root.path("state").asText(""));
        boolean hasRecord = junction.isObject();
        if (!markedOpen && !hasRecord) {
            return Optional.empty();
        }

        String legacyType = hasRecord ? junction.path("type").asText("") : "";
        JunctionType type = mapType(legacyType);

        var payload = new LinkedHashMap<String, Object>();
        if (hasRecord && junction.path("payload").isObject()) {
            junction.path("payload").fields()
                    .forEachRemaining(e -> payload.put(e.getKey(), toPlain(e.getValue())));
        }
        String reason = hasRecord ? junction.path("reason").asText("") : "";
        payload.put("reason", reason.isBlank() ? "Junction carried over from an earlier session" : reason);
        if (!legacyType.isBlank()) {
            payload.put("legacy_type", legacyType);
        }

        String fingerprint = JunctionFingerprint.of(type, payload);
        Instant createdAt = parseCreatedAt(hasRecord ? junction.path("created_at") : MissingNode.getInstance());

        log.info("Found open legacy junction of type {} in {}", legacyType.isBlank() ? "unknown" : legacyType,
                StateFiles.LEGACY_DISPATCH);
        return Optional.of(new PendingJunction(
                "legacy-" + fingerprint.substring(0, 12),
                type,
                payload,
                createdAt,
                "legacy"));
    }

    static JunctionType mapType(String legacyType) {
        return switch (legacyType.toLowerCase(Locale.ROOT)) {
            case "irreversible" -> JunctionType.IRREVERSIBLE;
            case "external" -> JunctionType.EXTERNAL;
            case "blocked" -> JunctionType.BLOCKED;
            // quality_gate, stuck, ambiguous and anything unrecognised pause as AMBIGUOUS
            default -> JunctionType.AMBIGUOUS;
        };
    }

    private Instant parseCreatedAt(JsonNode node) {
        if (node.isNumber()) {
            return Instant.ofEpochSecond(node.asLong());
        }
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText());
            } catch (DateTimeParseException e) {
                log.debug("Unparseable legacy created_at '{}'", node.asText());
            }
        }
        try {
            return Files.getLastModifiedTime(store.resolve(StateFiles.LEGACY_DISPATCH)).toInstant();
        } catch (IOException e) {
            return Instant.EPOCH;
        }
    }

    private static Object toPlain(JsonNode node) {
        if (node.isTextual()) return node.asText();
        if (node.isInt()) return node.asInt();
        if (node.isIntegralNumber()) return node.asLong();
        if (node.isNumber()) return node.asDouble();
        if (node.isBoolean()) return node.asBoolean();
        if (node.isNull()) return null;
        return node.toString();
    }
}
