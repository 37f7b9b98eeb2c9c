package com.pairstream.server.pipeline.image;

import java.util.Arrays;

/**
 * Float image in height-width-channel order. Treated as immutable: operations return new
 * tensors and never write into an existing one.
 */
public final class ImageTensor {

    private final int height;
    private final int width;
    private final int channels;
    private final float[] data;

    public ImageTensor(int height, int width, int channels, float[] data) {
        if (height <= 0 || width <= 0 || channels <= 0) {
            throw new IllegalArgumentException(
                    "Invalid tensor shape [" + height + ", " + width + ", " + channels + "]");
        }
        if (data.length != height * width * channels) {
            throw new IllegalArgumentException("Data length " + data.length + " does not match shape ["
                    + height + ", " + width + ", " + channels + "]");
        }
        this.height = height;
        this.width = width;
        this.channels = channels;
        this.data = data;
    }

    public static ImageTensor zeros(int height, int width, int channels) {
        return new ImageTensor(height, width, channels, new float[height * width * channels]);
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public int getChannels() {
        return channels;
    }

    public int[] shape() {
        return new int[] { height, width, channels };
    }

    public int size() {
        return data.length;
    }

    public float get(int y, int x, int c) {
        return data[(y * width + x) * channels + c];
    }

    /**
     * Backing array. Callers must not modify it.
     */
    public float[] data() {
        return data;
    }

    public float[] copyData() {
        return data.clone();
    }

    public boolean sameShape(ImageTensor other) {
        return height == other.height && width == other.width && channels == other.channels;
    }

    public float min() {
        float m = Float.POSITIVE_INFINITY;
        for (float v : data) {
            if (v < m) {
                m = v;
            }
        }
        return m;
    }

    public float max() {
        float m = Float.NEGATIVE_INFINITY;
        for (float v : data) {
            if (v > m) {
                m = v;
            }
        }
        return m;
    }

    public String shapeString() {
        return "[" + height + ", " + width + ", " + channels + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ImageTensor)) {
            return false;
        }
        ImageTensor other = (ImageTensor) o;
        return sameShape(other) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * height + width) + channels) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ImageTensor" + shapeString();
    }
}
