package com.pairstream.server.pipeline.transform;

import java.util.Map;

/**
 * One step of a transform spec as read from JSON, e.g.
 * {@code {"name": "threshold", "side": "target", "params": {"threshold": 5}}}.
 */
public class TransformStepSpec {
    public String name;
    public String side;
    public Map<String, Object> params;

    public TransformStepSpec() {
    }

    public TransformStepSpec(String name, String side, Map<String, Object> params) {
        this.name = name;
        this.side = side;
        this.params = params;
    }

    public static TransformStepSpec of(String name) {
        return new TransformStepSpec(name, null, null);
    }
}
