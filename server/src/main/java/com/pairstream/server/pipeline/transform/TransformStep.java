package com.pairstream.server.pipeline.transform;

import java.util.Objects;

public final class TransformStep {

    private final String name;
    private final TransformStage stage;
    private final TransformSide side;
    private final ImageTransform transform;

    public TransformStep(String name, TransformStage stage, TransformSide side, ImageTransform transform) {
        this.name = Objects.requireNonNull(name, "name");
        this.stage = stage != null ? stage : TransformStage.CUSTOM;
        this.side = side != null ? side : TransformSide.BOTH;
        this.transform = Objects.requireNonNull(transform, "transform");
    }

    public static TransformStep of(String name, ImageTransform transform) {
        return new TransformStep(name, TransformStage.CUSTOM, TransformSide.BOTH, transform);
    }

    public String getName() {
        return name;
    }

    public TransformStage getStage() {
        return stage;
    }

    public TransformSide getSide() {
        return side;
    }

    public ImageTransform getTransform() {
        return transform;
    }

    @Override
    public String toString() {
        return side == TransformSide.BOTH ? name : name + "[" + side.name().toLowerCase() + "]";
    }
}
