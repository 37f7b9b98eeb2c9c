package com.pairstream.server.pipeline.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named transforms that a {@link TransformStepSpec} can refer to. A registration pairs a stage with a
 * factory; the factory receives the step's preset parameters.
 */
public class TransformRegistry {

    private static final Logger logger = LoggerFactory.getLogger(TransformRegistry.class);

    private static final class Registration {
        final TransformStage stage;
        final TransformFactory factory;

        Registration(TransformStage stage, TransformFactory factory) {
            this.stage = stage;
            this.factory = factory;
        }
    }

    private final Map<String, Registration> registrations = new LinkedHashMap<>();

    /**
     * Registry holding the built-in transforms.
     */
    public static TransformRegistry withDefaults() {
        TransformRegistry registry = new TransformRegistry();
        registry.register("resize", TransformStage.GEOMETRIC,
                p -> Transforms.resize(p.getInt("height"), p.getInt("width")));
        registry.register("scale", TransformStage.GEOMETRIC,
                p -> Transforms.scale(p.getDouble("factor")));
        registry.register("grayscale", TransformStage.COLOR, p -> Transforms.grayscale());
        registry.register("normalize", TransformStage.NORMALIZATION,
                p -> Transforms.normalize(p.getDouble("divisor", 255.0)));
        registry.register("minmax", TransformStage.NORMALIZATION, p -> Transforms.minMax());
        registry.register("clip", TransformStage.NORMALIZATION,
                p -> Transforms.clip(p.getDouble("min", 0.0), p.getDouble("max", 1.0)));
        registry.register("threshold", TransformStage.THRESHOLD,
                p -> Transforms.threshold(p.getDouble("threshold", 5.0)));
        return registry;
    }

    public synchronized TransformRegistry register(String name, TransformStage stage, TransformFactory factory) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Transform name must not be empty");
        }
        if (registrations.containsKey(name)) {
            logger.info("Replacing registered transform '{}'", name);
        }
        registrations.put(name, new Registration(stage != null ? stage : TransformStage.CUSTOM, factory));
        return this;
    }

    /**
     * Registers a parameterless function.
     */
    public TransformRegistry register(String name, ImageTransform transform) {
        return register(name, TransformStage.CUSTOM, p -> transform);
    }

    public synchronized Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(registrations.keySet()));
    }

    public synchronized TransformStep step(String name, TransformSide side, TransformParams params) {
        Registration reg = registrations.get(name);
        if (reg == null) {
            throw new IllegalArgumentException("Unknown transform '" + name + "'. Registered: " + registrations.keySet());
        }
        ImageTransform transform = reg.factory.create(params != null ? params : TransformParams.none());
        return new TransformStep(name, reg.stage, side, transform);
    }

    /**
     * Resolves step specs into a chain. Steps out of the usual geometric, colour, normalization,
     * threshold order are accepted with a warning.
     */
    public TransformChain build(List<TransformStepSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            return TransformChain.empty();
        }
        List<TransformStep> steps = new ArrayList<>(specs.size());
        TransformStage highest = null;
        for (TransformStepSpec spec : specs) {
            TransformStep step = step(spec.name, TransformSide.parse(spec.side), new TransformParams(spec.params));
            TransformStage stage = step.getStage();
            if (stage != TransformStage.CUSTOM) {
                if (highest != null && stage.compareTo(highest) < 0) {
                    logger.warn("Transform '{}' ({}) follows a {} step; expected order is "
                            + "geometric, color, normalization, threshold", step.getName(), stage, highest);
                } else {
                    highest = stage;
                }
            }
            steps.add(step);
        }
        TransformChain chain = new TransformChain(steps);
        logger.info("Built transform chain {}", chain);
        return chain;
    }
}
