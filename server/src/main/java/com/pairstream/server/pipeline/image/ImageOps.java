package com.pairstream.server.pipeline.image;

import com.pairstream.server.pipeline.sample.Rectangle;

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.util.List;

/**
 * Pure tensor operations used by pair derivation and the built-in transforms. Every method
 * returns a new tensor (or the argument itself when the operation is a no-op).
 */
public final class ImageOps {

    private ImageOps() {
    }

    /**
     * Copies the pixels of {@code rect}. The rectangle must be valid and inside the image.
     */
    public static ImageTensor crop(ImageTensor img, Rectangle rect) {
        int w = rect.width();
        int h = rect.height();
        int c = img.getChannels();
        float[] src = img.data();
        float[] out = new float[h * w * c];
        int rowLen = w * c;
        for (int y = 0; y < h; y++) {
            int srcPos = ((rect.getY1() + y) * img.getWidth() + rect.getX1()) * c;
            System.arraycopy(src, srcPos, out, y * rowLen, rowLen);
        }
        return new ImageTensor(h, w, c, out);
    }

    public static ImageTensor columns(ImageTensor img, int fromX, int toX) {
        return crop(img, new Rectangle(fromX, 0, toX, img.getHeight()));
    }

    public static ImageTensor rows(ImageTensor img, int fromY, int toY) {
        return crop(img, new Rectangle(0, fromY, img.getWidth(), toY));
    }

    /**
     * Bilinear resize with half-pixel centers.
     */
    public static ImageTensor resize(ImageTensor img, int outHeight, int outWidth) {
        if (outHeight <= 0 || outWidth <= 0) {
            throw new IllegalArgumentException("Resize target must be positive, got " + outHeight + "x" + outWidth);
        }
        int inH = img.getHeight();
        int inW = img.getWidth();
        int c = img.getChannels();
        if (inH == outHeight && inW == outWidth) {
            return img;
        }

        float[] src = img.data();
        float[] out = new float[outHeight * outWidth * c];
        float scaleY = (float) inH / outHeight;
        float scaleX = (float) inW / outWidth;

        for (int y = 0; y < outHeight; y++) {
            float sy = clamp((y + 0.5f) * scaleY - 0.5f, 0f, inH - 1);
            int y0 = (int) sy;
            int y1 = Math.min(y0 + 1, inH - 1);
            float wy = sy - y0;
            for (int x = 0; x < outWidth; x++) {
                float sx = clamp((x + 0.5f) * scaleX - 0.5f, 0f, inW - 1);
                int x0 = (int) sx;
                int x1 = Math.min(x0 + 1, inW - 1);
                float wx = sx - x0;
                int o = (y * outWidth + x) * c;
                for (int ch = 0; ch < c; ch++) {
                    float a = src[(y0 * inW + x0) * c + ch];
                    float b = src[(y0 * inW + x1) * c + ch];
                    float d = src[(y1 * inW + x0) * c + ch];
                    float e = src[(y1 * inW + x1) * c + ch];
                    float top = a + (b - a) * wx;
                    float bottom = d + (e - d) * wx;
                    out[o + ch] = top + (bottom - top) * wy;
                }
            }
        }
        return new ImageTensor(outHeight, outWidth, c, out);
    }

    public static ImageTensor scale(ImageTensor img, double factor) {
        if (factor <= 0) {
            throw new IllegalArgumentException("Scaling factor must be positive, got " + factor);
        }
        int h = Math.max(1, (int) (img.getHeight() * factor));
        int w = Math.max(1, (int) (img.getWidth() * factor));
        return resize(img, h, w);
    }

    /**
     * Mean over colour channels; an alpha channel (4th) is dropped first.
     */
    public static ImageTensor toGrayscale(ImageTensor img) {
        int c = img.getChannels();
        if (c == 1) {
            return img;
        }
        int colour = c == 4 ? 3 : c;
        float[] src = img.data();
        int pixels = img.getHeight() * img.getWidth();
        float[] out = new float[pixels];
        for (int p = 0; p < pixels; p++) {
            float sum = 0f;
            for (int ch = 0; ch < colour; ch++) {
                sum += src[p * c + ch];
            }
            out[p] = sum / colour;
        }
        return new ImageTensor(img.getHeight(), img.getWidth(), 1, out);
    }

    public static ImageTensor divide(ImageTensor img, float divisor) {
        if (divisor == 0f) {
            throw new IllegalArgumentException("Divisor must be non-zero");
        }
        float[] src = img.data();
        float[] out = new float[src.length];
        for (int i = 0; i < src.length; i++) {
            out[i] = src[i] / divisor;
        }
        return new ImageTensor(img.getHeight(), img.getWidth(), img.getChannels(), out);
    }

    /**
     * Rescales to [0, 1] using the image's own min and max. A constant image maps to zeros.
     */
    public static ImageTensor minMax(ImageTensor img) {
        float min = img.min();
        float range = img.max() - min;
        float[] src = img.data();
        float[] out = new float[src.length];
        if (range > 0f) {
            for (int i = 0; i < src.length; i++) {
                out[i] = (src[i] - min) / range;
            }
        }
        return new ImageTensor(img.getHeight(), img.getWidth(), img.getChannels(), out);
    }

    /**
     * Values below {@code threshold} become 0; the rest are kept.
     */
    public static ImageTensor threshold(ImageTensor img, float threshold) {
        float[] src = img.data();
        float[] out = new float[src.length];
        for (int i = 0; i < src.length; i++) {
            out[i] = src[i] >= threshold ? src[i] : 0f;
        }
        return new ImageTensor(img.getHeight(), img.getWidth(), img.getChannels(), out);
    }

    public static ImageTensor clip(ImageTensor img, float min, float max) {
        float[] src = img.data();
        float[] out = new float[src.length];
        for (int i = 0; i < src.length; i++) {
            out[i] = clamp(src[i], min, max);
        }
        return new ImageTensor(img.getHeight(), img.getWidth(), img.getChannels(), out);
    }

    /**
     * Places images side by side after resizing each to the tallest height, keeping aspect
     * ratio. All images must have the same channel count.
     */
    public static ImageTensor joinHorizontally(List<ImageTensor> images) {
        if (images == null || images.isEmpty()) {
            throw new IllegalArgumentException("images cannot be empty");
        }
        int channels = images.get(0).getChannels();
        int height = 0;
        for (ImageTensor img : images) {
            if (img.getChannels() != channels) {
                throw new IllegalArgumentException("Cannot join images with different channel counts");
            }
            height = Math.max(height, img.getHeight());
        }

        ImageTensor[] resized = new ImageTensor[images.size()];
        int totalWidth = 0;
        for (int i = 0; i < resized.length; i++) {
            ImageTensor img = images.get(i);
            int w = Math.max(1, (int) (img.getWidth() * ((double) height / img.getHeight())));
            resized[i] = resize(img, height, w);
            totalWidth += w;
        }

        float[] out = new float[height * totalWidth * channels];
        int offsetX = 0;
        for (ImageTensor img : resized) {
            int rowLen = img.getWidth() * channels;
            for (int y = 0; y < height; y++) {
                System.arraycopy(img.data(), y * rowLen, out, (y * totalWidth + offsetX) * channels, rowLen);
            }
            offsetX += img.getWidth();
        }
        return new ImageTensor(height, totalWidth, channels, out);
    }

    /**
     * Raw pixel values in [0, 255]. Single-band images are read from the raster directly so
     * no colour-space conversion is applied.
     */
    public static ImageTensor fromBufferedImage(BufferedImage bi, int channels) {
        if (channels != 1 && channels != 3) {
            throw new IllegalArgumentException("Only 1 or 3 channels are supported, got " + channels);
        }
        int width = bi.getWidth();
        int height = bi.getHeight();
        float[] data = new float[height * width * channels];
        Raster raster = bi.getRaster();
        boolean singleBand = raster.getNumBands() == 1 && raster.getSampleModel().getSampleSize(0) == 8;

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int base = (y * width + x) * channels;
                if (singleBand) {
                    float v = raster.getSample(x, y, 0);
                    for (int ch = 0; ch < channels; ch++) {
                        data[base + ch] = v;
                    }
                    continue;
                }
                int clr = bi.getRGB(x, y);
                int red = (clr & 0x00ff0000) >> 16;
                int green = (clr & 0x0000ff00) >> 8;
                int blue = clr & 0x000000ff;
                if (channels == 1) {
                    data[base] = (red + green + blue) / 3f;
                } else {
                    data[base] = red;
                    data[base + 1] = green;
                    data[base + 2] = blue;
                }
            }
        }
        return new ImageTensor(height, width, channels, data);
    }

    /**
     * Maps [0, valueMax] to 8-bit pixels, clamping values outside that range.
     */
    public static BufferedImage toBufferedImage(ImageTensor img, float valueMax) {
        int c = img.getChannels();
        if (c != 1 && c != 3) {
            throw new IllegalArgumentException("Only 1 or 3 channel tensors can be rendered, got " + c);
        }
        int width = img.getWidth();
        int height = img.getHeight();
        BufferedImage bi = new BufferedImage(width, height,
                c == 1 ? BufferedImage.TYPE_BYTE_GRAY : BufferedImage.TYPE_INT_RGB);
        float factor = 255f / valueMax;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (c == 1) {
                    bi.getRaster().setSample(x, y, 0, toByte(img.get(y, x, 0) * factor));
                } else {
                    int r = toByte(img.get(y, x, 0) * factor);
                    int g = toByte(img.get(y, x, 1) * factor);
                    int b = toByte(img.get(y, x, 2) * factor);
                    bi.setRGB(x, y, (r << 16) | (g << 8) | b);
                }
            }
        }
        return bi;
    }

    private static int toByte(float v) {
        return Math.round(clamp(v, 0f, 255f));
    }

    private static float clamp(float v, float lo, float hi) {
        return v < lo ? lo : (v > hi ? hi : v);
    }
}
