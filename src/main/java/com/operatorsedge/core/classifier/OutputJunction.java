package com.operatorsedge.core.classifier;

import com.operatorsedge.core.model.JunctionType;

/**
 * Verdict of scanning free-text output.
 *
 * @param type   {@link JunctionType#NONE}, {@link JunctionType#BLOCKED} or {@link JunctionType#AMBIGUOUS}
 * @param reason which signal fired, null when {@code type} is NONE
 */
public record OutputJunction(JunctionType type, String reason) {

    private static final OutputJunction NONE = new OutputJunction(JunctionType.NONE, null);

    public static OutputJunction none() {
        return NONE;
    }

    public boolean isPausing() {
        return type.isPausing();
    }
}
