package com.pairstream.server.pipeline.transform;

import java.util.Locale;

/**
 * Which half of a pair a transform step applies to.
 */
public enum TransformSide {
    BOTH,
    INPUT,
    TARGET;

    public boolean appliesToInput() {
        return this != TARGET;
    }

    public boolean appliesToTarget() {
        return this != INPUT;
    }

    public static TransformSide parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            return BOTH;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown transform side '" + value + "'", e);
        }
    }
}
