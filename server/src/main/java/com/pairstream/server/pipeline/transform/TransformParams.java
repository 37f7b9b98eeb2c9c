package com.pairstream.server.pipeline.transform;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Preset parameters for a registered transform, as given in the settings file.
 */
public final class TransformParams {

    private final Map<String, Object> values;

    public TransformParams(Map<String, Object> values) {
        this.values = values != null ? Collections.unmodifiableMap(new HashMap<>(values)) : Collections.emptyMap();
    }

    public static TransformParams none() {
        return new TransformParams(null);
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public int getInt(String key) {
        return number(key, require(key)).intValue();
    }

    public int getInt(String key, int defaultValue) {
        Object v = values.get(key);
        return v == null ? defaultValue : number(key, v).intValue();
    }

    public double getDouble(String key) {
        return number(key, require(key)).doubleValue();
    }

    public double getDouble(String key, double defaultValue) {
        Object v = values.get(key);
        return v == null ? defaultValue : number(key, v).doubleValue();
    }

    private Object require(String key) {
        Object v = values.get(key);
        if (v == null) {
            throw new IllegalArgumentException("Missing required parameter '" + key + "'");
        }
        return v;
    }

    private static Number number(String key, Object v) {
        if (v instanceof Number) {
            return (Number) v;
        }
        try {
            return Double.valueOf(v.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + key + "' is not a number: " + v, e);
        }
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
