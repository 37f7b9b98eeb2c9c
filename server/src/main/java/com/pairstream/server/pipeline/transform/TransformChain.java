package com.pairstream.server.pipeline.transform;

import com.pairstream.server.pipeline.image.ImagePair;
import com.pairstream.server.pipeline.image.ImageTensor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered sequence of transform steps, applied left to right.
 */
public final class TransformChain {

    private static final TransformChain EMPTY = new TransformChain(Collections.emptyList());

    private final List<TransformStep> steps;

    public TransformChain(List<TransformStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public static TransformChain empty() {
        return EMPTY;
    }

    public static TransformChain of(TransformStep... steps) {
        return new TransformChain(List.of(steps));
    }

    /**
     * {@code compose([])} is the identity; {@code compose([f1..fn])(x) = fn(...f1(x))}.
     */
    public static ImageTransform compose(List<? extends ImageTransform> transforms) {
        if (transforms == null || transforms.isEmpty()) {
            return image -> image;
        }
        List<ImageTransform> copy = new ArrayList<>(transforms);
        return image -> {
            ImageTensor current = image;
            for (ImageTransform t : copy) {
                current = t.apply(current);
            }
            return current;
        };
    }

    public List<TransformStep> getSteps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    public TransformChain then(TransformStep step) {
        List<TransformStep> extended = new ArrayList<>(steps);
        extended.add(step);
        return new TransformChain(extended);
    }

    /**
     * Runs every step on the side(s) it declares.
     *
     * @throws TransformException naming the sample and the step that failed
     */
    public ImagePair apply(ImagePair pair, String sampleId) throws TransformException {
        ImageTensor input = pair.getInput();
        ImageTensor target = pair.getTarget();
        for (TransformStep step : steps) {
            try {
                if (step.getSide().appliesToInput()) {
                    input = step.getTransform().apply(input);
                }
                if (step.getSide().appliesToTarget()) {
                    target = step.getTransform().apply(target);
                }
            } catch (RuntimeException e) {
                throw new TransformException(sampleId, step.getName(),
                        "Transform '" + step.getName() + "' failed: " + e.getMessage(), e);
            }
            if (input == null || target == null) {
                throw new TransformException(sampleId, step.getName(),
                        "Transform '" + step.getName() + "' returned no image", null);
            }
        }
        return new ImagePair(input, target);
    }

    @Override
    public String toString() {
        return "TransformChain" + steps;
    }
}
