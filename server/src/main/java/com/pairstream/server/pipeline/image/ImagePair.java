package com.pairstream.server.pipeline.image;

import java.util.Objects;

/**
 * The (input, target) images of one training sample.
 */
public final class ImagePair {

    private final ImageTensor input;
    private final ImageTensor target;

    public ImagePair(ImageTensor input, ImageTensor target) {
        this.input = Objects.requireNonNull(input, "input");
        this.target = Objects.requireNonNull(target, "target");
    }

    public ImageTensor getInput() {
        return input;
    }

    public ImageTensor getTarget() {
        return target;
    }

    public boolean sameShape() {
        return input.sameShape(target);
    }

    @Override
    public String toString() {
        return "ImagePair{input=" + input.shapeString() + ", target=" + target.shapeString() + "}";
    }
}
