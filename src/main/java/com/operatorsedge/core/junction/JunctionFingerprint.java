package com.operatorsedge.core.junction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.operatorsedge.core.model.JunctionType;
import com.operatorsedge.core.store.StateJson;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Stable content hash of a junction's {@code (type, payload)}.
 * Payload keys are serialized in sorted order so equal maps hash equally.
 */
public final class JunctionFingerprint {

    private static final ObjectWriter CANONICAL = StateJson.newMapper()
            .writer()
            .without(SerializationFeature.INDENT_OUTPUT);

    private JunctionFingerprint() {}

    public static String of(JunctionType type, Map<String, Object> payload) {
        String canonical;
        try {
            canonical = type.name() + "\n" + CANONICAL.writeValueAsString(payload == null ? Map.of() : payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Junction payload is not serializable: " + e.getMessage(), e);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String of(PendingJunction junction) {
        return of(junction.type(), junction.payload());
    }
}
