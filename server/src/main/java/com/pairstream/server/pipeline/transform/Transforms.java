package com.pairstream.server.pipeline.transform;

import com.pairstream.server.pipeline.image.ImageOps;

/**
 * Built-in transforms.
 */
public final class Transforms {

    private Transforms() {
    }

    public static ImageTransform resize(int height, int width) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("resize needs a positive height and width");
        }
        return image -> ImageOps.resize(image, height, width);
    }

    public static ImageTransform scale(double factor) {
        if (factor <= 0) {
            throw new IllegalArgumentException("scale factor must be positive");
        }
        return image -> ImageOps.scale(image, factor);
    }

    public static ImageTransform grayscale() {
        return ImageOps::toGrayscale;
    }

    /**
     * Divides by {@code divisor}; 255 maps 8-bit pixels to [0, 1].
     */
    public static ImageTransform normalize(double divisor) {
        float d = (float) divisor;
        return image -> ImageOps.divide(image, d);
    }

    public static ImageTransform minMax() {
        return ImageOps::minMax;
    }

    /**
     * Zeroes values below {@code threshold}. The threshold is given on the 8-bit scale and is
     * divided by 255 when the image is already within [0, 1].
     */
    public static ImageTransform threshold(double threshold) {
        return image -> {
            boolean normalized = image.min() >= 0f && image.max() <= 1f;
            float t = normalized ? (float) (threshold / 255.0) : (float) threshold;
            return ImageOps.threshold(image, t);
        };
    }

    public static ImageTransform clip(double min, double max) {
        if (min > max) {
            throw new IllegalArgumentException("clip min must not exceed max");
        }
        return image -> ImageOps.clip(image, (float) min, (float) max);
    }
}
