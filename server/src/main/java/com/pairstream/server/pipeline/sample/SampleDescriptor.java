package com.pairstream.server.pipeline.sample;

import java.util.Objects;

/**
 * Identifies one training example: a source image plus optional crop metadata.
 * Immutable; identity is the source path together with the region set.
 */
public final class SampleDescriptor {

    private final String sourcePath;
    private final DerivationStrategy strategy;
    private final Integer commentTag;

    public SampleDescriptor(String sourcePath, CropRegions cropRegions, Integer commentTag) {
        if (sourcePath == null || sourcePath.isEmpty()) {
            throw new IllegalArgumentException("sourcePath must not be empty");
        }
        this.sourcePath = sourcePath;
        this.strategy = cropRegions != null ? DerivationStrategy.crop(cropRegions) : DerivationStrategy.split();
        this.commentTag = commentTag;
    }

    public static SampleDescriptor ofPath(String sourcePath) {
        return new SampleDescriptor(sourcePath, null, null);
    }

    public static SampleDescriptor withRegions(String sourcePath, CropRegions cropRegions) {
        return new SampleDescriptor(sourcePath, cropRegions, null);
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public DerivationStrategy getStrategy() {
        return strategy;
    }

    public boolean hasCropRegions() {
        return strategy.getKind() == DerivationStrategy.Kind.CROP;
    }

    public Integer getCommentTag() {
        return commentTag;
    }

    /**
     * Stable identifier used in logs and error reports.
     */
    public String id() {
        return hasCropRegions() ? sourcePath + "#" + strategy.getRegions() : sourcePath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SampleDescriptor)) {
            return false;
        }
        SampleDescriptor other = (SampleDescriptor) o;
        return sourcePath.equals(other.sourcePath) && strategy.equals(other.strategy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourcePath, strategy);
    }

    @Override
    public String toString() {
        return "SampleDescriptor{path='" + sourcePath + "', strategy=" + strategy
                + (commentTag != null ? ", comment=" + commentTag : "") + "}";
    }
}
