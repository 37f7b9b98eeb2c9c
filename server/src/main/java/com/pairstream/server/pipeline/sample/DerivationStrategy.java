package com.pairstream.server.pipeline.sample;

import java.util.Objects;

/**
 * How a sample's (input, target) pair is cut from its source image. Resolved once when the
 * descriptor is built.
 */
public final class DerivationStrategy {

    public enum Kind {
        /** Source image is a composite; halves become target and input. */
        SPLIT,
        /** Two stored rectangles are cropped from the source image. */
        CROP
    }

    private static final DerivationStrategy SPLIT = new DerivationStrategy(Kind.SPLIT, null);

    private final Kind kind;
    private final CropRegions regions;

    private DerivationStrategy(Kind kind, CropRegions regions) {
        this.kind = kind;
        this.regions = regions;
    }

    public static DerivationStrategy split() {
        return SPLIT;
    }

    public static DerivationStrategy crop(CropRegions regions) {
        return new DerivationStrategy(Kind.CROP, Objects.requireNonNull(regions, "regions"));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @throws IllegalStateException for {@link Kind#SPLIT}
     */
    public CropRegions getRegions() {
        if (kind != Kind.CROP) {
            throw new IllegalStateException("Split derivation has no crop regions");
        }
        return regions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DerivationStrategy)) {
            return false;
        }
        DerivationStrategy other = (DerivationStrategy) o;
        return kind == other.kind && Objects.equals(regions, other.regions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, regions);
    }

    @Override
    public String toString() {
        return kind == Kind.SPLIT ? "SPLIT" : "CROP[" + regions + "]";
    }
}
