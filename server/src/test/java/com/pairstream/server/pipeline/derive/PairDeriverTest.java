package com.pairstream.server.pipeline.derive;

import com.pairstream.server.pipeline.image.ImageDecoder;
import com.pairstream.server.pipeline.image.ImagePair;
import com.pairstream.server.pipeline.image.ImageTensor;
import com.pairstream.server.pipeline.sample.CropRegions;
import com.pairstream.server.pipeline.sample.Rectangle;
import com.pairstream.server.pipeline.sample.SampleDescriptor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;

public class PairDeriverTest {

    /** Pixel value at (y, x) is x, so a slice reveals which columns it came from. */
    private static ImageTensor columnIndexImage(int height, int width) {
        float[] data = new float[height * width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                data[y * width + x] = x;
            }
        }
        return new ImageTensor(height, width, 1, data);
    }

    private static ImageDecoder fixed(ImageTensor image) {
        return (path, channels) -> image;
    }

    private static DerivationConfig grayDefaults() {
        return DerivationConfig.defaults().withChannels(1);
    }

    @Test
    public void testEvenSplitGivesEqualHalves() throws Exception {
        PairDeriver deriver = new PairDeriver(grayDefaults(), fixed(columnIndexImage(4, 8)));
        ImagePair pair = deriver.derive(SampleDescriptor.ofPath("even.png"));

        Assertions.assertEquals(4, pair.getInput().getWidth());
        Assertions.assertEquals(4, pair.getTarget().getWidth());
        Assertions.assertEquals(4, pair.getInput().getHeight());
        // left half is the target, right half the input
        Assertions.assertEquals(0f, pair.getTarget().get(0, 0, 0));
        Assertions.assertEquals(4f, pair.getInput().get(0, 0, 0));
    }

    @Test
    public void testOddSplitMiddleColumnToInput() throws Exception {
        PairDeriver deriver = new PairDeriver(grayDefaults().withBoundaryOwner(PairSide.INPUT),
                fixed(columnIndexImage(3, 9)));
        ImagePair pair = deriver.derive(SampleDescriptor.ofPath("odd.png"));

        Assertions.assertEquals(5, pair.getInput().getWidth());
        Assertions.assertEquals(4, pair.getTarget().getWidth());
        Assertions.assertEquals(4f, pair.getInput().get(0, 0, 0));
    }

    @Test
    public void testOddSplitMiddleColumnToTarget() throws Exception {
        PairDeriver deriver = new PairDeriver(grayDefaults().withBoundaryOwner(PairSide.TARGET),
                fixed(columnIndexImage(3, 9)));
        ImagePair pair = deriver.derive(SampleDescriptor.ofPath("odd.png"));

        Assertions.assertEquals(4, pair.getInput().getWidth());
        Assertions.assertEquals(5, pair.getTarget().getWidth());
        Assertions.assertEquals(4f, pair.getTarget().get(0, 4, 0));
        Assertions.assertEquals(5f, pair.getInput().get(0, 0, 0));
    }

    @Test
    public void testInputFirstAndHeightAxis() throws Exception {
        DerivationConfig config = grayDefaults().withFirstHalf(PairSide.INPUT).withSplitAxis(SplitAxis.HEIGHT);
        PairDeriver deriver = new PairDeriver(config, fixed(columnIndexImage(6, 5)));
        ImagePair pair = deriver.derive(SampleDescriptor.ofPath("tall.png"));

        Assertions.assertEquals(3, pair.getInput().getHeight());
        Assertions.assertEquals(3, pair.getTarget().getHeight());
        Assertions.assertEquals(5, pair.getInput().getWidth());
    }

    @Test
    public void testCropGivesExactRectangleSize() throws Exception {
        PairDeriver deriver = new PairDeriver(grayDefaults(), fixed(columnIndexImage(20, 30)));
        CropRegions regions = new CropRegions(new Rectangle(2, 1, 7, 5), new Rectangle(10, 0, 22, 20));
        ImagePair pair = deriver.derive(SampleDescriptor.withRegions("crop.png", regions));

        Assertions.assertEquals(4, pair.getInput().getHeight());
        Assertions.assertEquals(5, pair.getInput().getWidth());
        Assertions.assertEquals(2f, pair.getInput().get(0, 0, 0));
        Assertions.assertEquals(20, pair.getTarget().getHeight());
        Assertions.assertEquals(12, pair.getTarget().getWidth());
        Assertions.assertEquals(10f, pair.getTarget().get(0, 0, 0));
    }

    @Test
    public void testCropOutputSizeResizesBothSides() throws Exception {
        PairDeriver deriver = new PairDeriver(grayDefaults().withCropOutput(8, 8), fixed(columnIndexImage(20, 30)));
        CropRegions regions = new CropRegions(new Rectangle(0, 0, 4, 4), new Rectangle(10, 0, 26, 16));
        ImagePair pair = deriver.derive(SampleDescriptor.withRegions("crop.png", regions));
        Assertions.assertArrayEquals(new int[]{8, 8, 1}, pair.getInput().shape());
        Assertions.assertArrayEquals(new int[]{8, 8, 1}, pair.getTarget().shape());
    }

    @Test
    public void testDegenerateRectangleRejected() {
        PairDeriver deriver = new PairDeriver(grayDefaults(), fixed(columnIndexImage(10, 10)));
        CropRegions regions = new CropRegions(new Rectangle(5, 0, 5, 4), new Rectangle(0, 0, 4, 4));
        Assertions.assertThrows(DerivationException.class,
                () -> deriver.derive(SampleDescriptor.withRegions("bad.png", regions)));
    }

    @Test
    public void testOutOfBoundsRectangleRejected() {
        PairDeriver deriver = new PairDeriver(grayDefaults(), fixed(columnIndexImage(10, 10)));
        CropRegions regions = new CropRegions(new Rectangle(0, 0, 4, 4), new Rectangle(6, 6, 11, 10));
        DerivationException e = Assertions.assertThrows(DerivationException.class,
                () -> deriver.derive(SampleDescriptor.withRegions("bad.png", regions)));
        Assertions.assertEquals("derivation", e.kind());
        Assertions.assertTrue(e.getSampleId().startsWith("bad.png"));
    }

    @Test
    public void testTooNarrowToSplit() {
        PairDeriver deriver = new PairDeriver(grayDefaults(), fixed(columnIndexImage(4, 1)));
        Assertions.assertThrows(DerivationException.class, () -> deriver.derive(SampleDescriptor.ofPath("thin.png")));
    }

    @Test
    public void testUnreadableImageBecomesDerivationException() {
        ImageDecoder failing = (path, channels) -> {
            throw new IOException("corrupt");
        };
        PairDeriver deriver = new PairDeriver(grayDefaults(), failing);
        DerivationException e = Assertions.assertThrows(DerivationException.class,
                () -> deriver.derive(SampleDescriptor.ofPath("broken.png")));
        Assertions.assertEquals("broken.png", e.getSampleId());
        Assertions.assertTrue(e.getCause() instanceof IOException);
    }

    @Test
    public void testTimedOutReadBecomesDerivationException() {
        ImageDecoder slow = (path, channels) -> {
            throw new InterruptedIOException("timed out");
        };
        PairDeriver deriver = new PairDeriver(grayDefaults(), slow);
        DerivationException e = Assertions.assertThrows(DerivationException.class,
                () -> deriver.derive(SampleDescriptor.ofPath("slow.png")));
        Assertions.assertTrue(e.getCause() instanceof InterruptedIOException);
    }
}
