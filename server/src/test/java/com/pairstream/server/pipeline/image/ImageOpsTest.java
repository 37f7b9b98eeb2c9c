package com.pairstream.server.pipeline.image;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class ImageOpsTest {

    @TempDir
    Path tempDir;

    @Test
    public void testResizeToSameSizeIsNoOp() {
        ImageTensor img = ImageTensor.zeros(4, 6, 3);
        Assertions.assertSame(img, ImageOps.resize(img, 4, 6));
    }

    @Test
    public void testResizeConstantImageStaysConstant() {
        float[] data = new float[5 * 7];
        java.util.Arrays.fill(data, 0.25f);
        ImageTensor out = ImageOps.resize(new ImageTensor(5, 7, 1, data), 13, 3);
        Assertions.assertArrayEquals(new int[]{13, 3, 1}, out.shape());
        Assertions.assertEquals(0.25f, out.min(), 1e-6);
        Assertions.assertEquals(0.25f, out.max(), 1e-6);
    }

    @Test
    public void testGrayscaleAveragesAndDropsAlpha() {
        ImageTensor rgba = new ImageTensor(1, 1, 4, new float[]{30f, 60f, 90f, 255f});
        ImageTensor gray = ImageOps.toGrayscale(rgba);
        Assertions.assertArrayEquals(new int[]{1, 1, 1}, gray.shape());
        Assertions.assertEquals(60f, gray.get(0, 0, 0), 1e-6);
    }

    @Test
    public void testMinMaxOfConstantImageIsZero() {
        ImageTensor out = ImageOps.minMax(new ImageTensor(1, 3, 1, new float[]{7f, 7f, 7f}));
        Assertions.assertEquals(0f, out.max());
    }

    @Test
    public void testMinMaxStretchesToUnitRange() {
        ImageTensor out = ImageOps.minMax(new ImageTensor(1, 3, 1, new float[]{10f, 20f, 30f}));
        Assertions.assertArrayEquals(new float[]{0f, 0.5f, 1f}, out.data(), 1e-6f);
    }

    @Test
    public void testJoinHorizontallyResizesToTallest() {
        ImageTensor a = ImageTensor.zeros(4, 4, 1);
        ImageTensor b = ImageTensor.zeros(2, 3, 1);
        ImageTensor joined = ImageOps.joinHorizontally(List.of(a, b));
        Assertions.assertEquals(4, joined.getHeight());
        Assertions.assertEquals(4 + 6, joined.getWidth());
    }

    @Test
    public void testPngDecodeKeepsRawPixelValues() throws IOException {
        BufferedImage bi = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        bi.setRGB(0, 0, (10 << 16) | (20 << 8) | 30);
        bi.setRGB(1, 0, (255 << 16));
        Path file = tempDir.resolve("tiny.png");
        ImageIO.write(bi, "png", file.toFile());

        ImageTensor rgb = new ImageIoDecoder().decode(file, 3);
        Assertions.assertEquals(10f, rgb.get(0, 0, 0));
        Assertions.assertEquals(20f, rgb.get(0, 0, 1));
        Assertions.assertEquals(30f, rgb.get(0, 0, 2));
        Assertions.assertEquals(255f, rgb.get(0, 1, 0));

        ImageTensor gray = new ImageIoDecoder().decode(file, 1);
        Assertions.assertEquals(20f, gray.get(0, 0, 0), 1e-6);
    }

    @Test
    public void testCorruptFileFailsToDecode() throws IOException {
        Path file = tempDir.resolve("broken.png");
        Files.write(file, new byte[]{1, 2, 3, 4});
        Assertions.assertThrows(IOException.class, () -> new ImageIoDecoder().decode(file, 3));
    }

    @Test
    public void testRenderRoundsToBytes() {
        ImageTensor img = new ImageTensor(1, 2, 1, new float[]{0f, 1f});
        BufferedImage bi = ImageOps.toBufferedImage(img, 1f);
        Assertions.assertEquals(0, bi.getRaster().getSample(0, 0, 0));
        Assertions.assertEquals(255, bi.getRaster().getSample(1, 0, 0));
    }
}
