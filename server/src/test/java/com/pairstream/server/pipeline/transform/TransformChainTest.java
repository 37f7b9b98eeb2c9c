package com.pairstream.server.pipeline.transform;

import com.pairstream.server.pipeline.image.ImagePair;
import com.pairstream.server.pipeline.image.ImageTensor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

public class TransformChainTest {

    private static ImageTensor image(float... values) {
        return new ImageTensor(1, values.length, 1, values);
    }

    private static final ImageTransform ADD_ONE = img -> {
        float[] out = img.copyData();
        for (int i = 0; i < out.length; i++) {
            out[i] += 1f;
        }
        return new ImageTensor(img.getHeight(), img.getWidth(), img.getChannels(), out);
    };

    private static final ImageTransform DOUBLE = img -> {
        float[] out = img.copyData();
        for (int i = 0; i < out.length; i++) {
            out[i] *= 2f;
        }
        return new ImageTensor(img.getHeight(), img.getWidth(), img.getChannels(), out);
    };

    @Test
    public void testComposeEmptyIsIdentity() {
        ImageTensor x = image(1f, 2f, 3f);
        Assertions.assertSame(x, TransformChain.compose(Collections.emptyList()).apply(x));
    }

    @Test
    public void testComposeSingleIsThatFunction() {
        ImageTensor x = image(1f, 2f);
        Assertions.assertEquals(DOUBLE.apply(x), TransformChain.compose(List.of(DOUBLE)).apply(x));
    }

    @Test
    public void testComposeAppliesLeftToRight() {
        ImageTensor x = image(1f, 2f);
        // (x + 1) * 2
        Assertions.assertEquals(image(4f, 6f), TransformChain.compose(List.of(ADD_ONE, DOUBLE)).apply(x));
        // x * 2 + 1
        Assertions.assertEquals(image(3f, 5f), TransformChain.compose(List.of(DOUBLE, ADD_ONE)).apply(x));
    }

    @Test
    public void testComposeIsAssociative() {
        ImageTensor x = image(0.5f, -1f, 3f);
        ImageTransform left = TransformChain.compose(List.of(TransformChain.compose(List.of(ADD_ONE, DOUBLE)), ADD_ONE));
        ImageTransform right = TransformChain.compose(List.of(ADD_ONE, TransformChain.compose(List.of(DOUBLE, ADD_ONE))));
        Assertions.assertEquals(left.apply(x), right.apply(x));
    }

    @Test
    public void testStepsRespectDeclaredSide() throws Exception {
        TransformChain chain = TransformChain.of(
                new TransformStep("add", TransformStage.CUSTOM, TransformSide.INPUT, ADD_ONE),
                new TransformStep("double", TransformStage.CUSTOM, TransformSide.TARGET, DOUBLE),
                new TransformStep("add-both", TransformStage.CUSTOM, TransformSide.BOTH, ADD_ONE));

        ImagePair out = chain.apply(new ImagePair(image(1f), image(1f)), "s1");
        Assertions.assertEquals(image(3f), out.getInput());
        Assertions.assertEquals(image(3f), out.getTarget());

        ImagePair out2 = TransformChain.of(new TransformStep("double", null, TransformSide.TARGET, DOUBLE))
                .apply(new ImagePair(image(5f), image(5f)), "s2");
        Assertions.assertEquals(image(5f), out2.getInput());
        Assertions.assertEquals(image(10f), out2.getTarget());
    }

    @Test
    public void testFailingStepNamesSampleAndStep() {
        TransformChain chain = TransformChain.empty().then(TransformStep.of("explode", img -> {
            throw new IllegalStateException("boom");
        }));
        TransformException e = Assertions.assertThrows(TransformException.class,
                () -> chain.apply(new ImagePair(image(1f), image(1f)), "sample-7"));
        Assertions.assertEquals("sample-7", e.getSampleId());
        Assertions.assertEquals("explode", e.getTransformName());
        Assertions.assertEquals("transform", e.kind());
    }

    @Test
    public void testNullResultFails() {
        TransformChain chain = TransformChain.of(TransformStep.of("nothing", img -> null));
        Assertions.assertThrows(TransformException.class,
                () -> chain.apply(new ImagePair(image(1f), image(1f)), "s"));
    }

    @Test
    public void testThresholdOnEightBitScale() {
        ImageTensor out = Transforms.threshold(5).apply(image(0f, 4f, 5f, 200f));
        Assertions.assertEquals(image(0f, 0f, 5f, 200f), out);
    }

    @Test
    public void testThresholdScaledForNormalizedImage() {
        float below = 4f / 255f;
        float above = 6f / 255f;
        ImageTensor out = Transforms.threshold(5).apply(image(below, above, 1f));
        Assertions.assertEquals(image(0f, above, 1f), out);
    }

    @Test
    public void testNormalizeAndClip() {
        Assertions.assertEquals(image(0f, 1f), Transforms.normalize(255).apply(image(0f, 255f)));
        Assertions.assertEquals(image(0f, 0.5f, 1f), Transforms.clip(0, 1).apply(image(-2f, 0.5f, 3f)));
    }
}
