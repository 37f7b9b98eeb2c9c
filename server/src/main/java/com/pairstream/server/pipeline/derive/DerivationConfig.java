package com.pairstream.server.pipeline.derive;

/**
 * How pairs are cut from source images.
 * <ul>
 * <li>{@code splitAxis}, {@code firstHalf}: which half of a composite image is the target;
 * by default the left half is the target and the right half the input.</li>
 * <li>{@code boundaryOwner}: side that receives the middle column (or row) of an odd-sized
 * composite.</li>
 * <li>{@code cropOutputHeight/Width}: size crop regions are resized to; when unset, crops
 * keep the rectangle size.</li>
 * </ul>
 */
public final class DerivationConfig {

    private final SplitAxis splitAxis;
    private final PairSide firstHalf;
    private final PairSide boundaryOwner;
    private final int channels;
    private final Integer cropOutputHeight;
    private final Integer cropOutputWidth;

    public DerivationConfig(SplitAxis splitAxis, PairSide firstHalf, PairSide boundaryOwner, int channels,
            Integer cropOutputHeight, Integer cropOutputWidth) {
        if (channels != 1 && channels != 3) {
            throw new IllegalArgumentException("channels must be 1 or 3, got " + channels);
        }
        if ((cropOutputHeight == null) != (cropOutputWidth == null)) {
            throw new IllegalArgumentException("cropOutputHeight and cropOutputWidth must be set together");
        }
        if (cropOutputHeight != null && (cropOutputHeight <= 0 || cropOutputWidth <= 0)) {
            throw new IllegalArgumentException("Crop output size must be positive");
        }
        this.splitAxis = splitAxis != null ? splitAxis : SplitAxis.WIDTH;
        this.firstHalf = firstHalf != null ? firstHalf : PairSide.TARGET;
        this.boundaryOwner = boundaryOwner != null ? boundaryOwner : PairSide.INPUT;
        this.channels = channels;
        this.cropOutputHeight = cropOutputHeight;
        this.cropOutputWidth = cropOutputWidth;
    }

    public static DerivationConfig defaults() {
        return new DerivationConfig(SplitAxis.WIDTH, PairSide.TARGET, PairSide.INPUT, 3, null, null);
    }

    public DerivationConfig withChannels(int channels) {
        return new DerivationConfig(splitAxis, firstHalf, boundaryOwner, channels, cropOutputHeight,
                cropOutputWidth);
    }

    public DerivationConfig withBoundaryOwner(PairSide owner) {
        return new DerivationConfig(splitAxis, firstHalf, owner, channels, cropOutputHeight, cropOutputWidth);
    }

    public DerivationConfig withFirstHalf(PairSide side) {
        return new DerivationConfig(splitAxis, side, boundaryOwner, channels, cropOutputHeight, cropOutputWidth);
    }

    public DerivationConfig withSplitAxis(SplitAxis axis) {
        return new DerivationConfig(axis, firstHalf, boundaryOwner, channels, cropOutputHeight, cropOutputWidth);
    }

    public DerivationConfig withCropOutput(int height, int width) {
        return new DerivationConfig(splitAxis, firstHalf, boundaryOwner, channels, height, width);
    }

    public SplitAxis getSplitAxis() {
        return splitAxis;
    }

    public PairSide getFirstHalf() {
        return firstHalf;
    }

    public PairSide getBoundaryOwner() {
        return boundaryOwner;
    }

    public int getChannels() {
        return channels;
    }

    public boolean hasCropOutputSize() {
        return cropOutputHeight != null;
    }

    public Integer getCropOutputHeight() {
        return cropOutputHeight;
    }

    public Integer getCropOutputWidth() {
        return cropOutputWidth;
    }

    @Override
    public String toString() {
        return "DerivationConfig{axis=" + splitAxis + ", firstHalf=" + firstHalf + ", boundaryOwner="
                + boundaryOwner + ", channels=" + channels
                + (hasCropOutputSize() ? ", cropOutput=" + cropOutputHeight + "x" + cropOutputWidth : "") + "}";
    }
}
