package com.pairstream.server.pipeline.sample;

import java.util.Objects;

/**
 * The two regions cut from one source frame: the speckle (input) region and the original
 * (target) region.
 */
public final class CropRegions {

    private final Rectangle inputRegion;
    private final Rectangle targetRegion;

    public CropRegions(Rectangle inputRegion, Rectangle targetRegion) {
        this.inputRegion = Objects.requireNonNull(inputRegion, "inputRegion");
        this.targetRegion = Objects.requireNonNull(targetRegion, "targetRegion");
    }

    public Rectangle getInputRegion() {
        return inputRegion;
    }

    public Rectangle getTargetRegion() {
        return targetRegion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CropRegions)) {
            return false;
        }
        CropRegions other = (CropRegions) o;
        return inputRegion.equals(other.inputRegion) && targetRegion.equals(other.targetRegion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputRegion, targetRegion);
    }

    @Override
    public String toString() {
        return "input=" + inputRegion + ", target=" + targetRegion;
    }
}
