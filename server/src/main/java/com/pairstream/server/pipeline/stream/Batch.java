package com.pairstream.server.pipeline.stream;

import com.pairstream.server.pipeline.image.ImageTensor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * N stacked input/target pairs. Both arrays are laid out as [N, H, W, C].
 */
public final class Batch {

    private final int size;
    private final int height;
    private final int width;
    private final int channels;
    private final float[] inputs;
    private final float[] targets;
    private final List<String> sampleIds;

    private Batch(int size, int height, int width, int channels, float[] inputs, float[] targets,
            List<String> sampleIds) {
        this.size = size;
        this.height = height;
        this.width = width;
        this.channels = channels;
        this.inputs = inputs;
        this.targets = targets;
        this.sampleIds = sampleIds;
    }

    /**
     * @throws PipelineException if the samples do not all share one shape
     */
    static Batch stack(List<ProcessedSample> samples) {
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("Cannot build an empty batch");
        }
        ImageTensor first = samples.get(0).getPair().getInput();
        int sampleLen = first.size();
        float[] inputs = new float[samples.size() * sampleLen];
        float[] targets = new float[samples.size() * sampleLen];
        List<String> ids = new ArrayList<>(samples.size());

        for (int i = 0; i < samples.size(); i++) {
            ProcessedSample s = samples.get(i);
            ImageTensor in = s.getPair().getInput();
            ImageTensor tg = s.getPair().getTarget();
            if (!in.sameShape(first) || !tg.sameShape(first)) {
                throw new PipelineException("Batch shape mismatch: sample " + s.id() + " is "
                        + in.shapeString() + " but the batch started with " + first.shapeString()
                        + "; add a resize step so every sample has the same size");
            }
            System.arraycopy(in.data(), 0, inputs, i * sampleLen, sampleLen);
            System.arraycopy(tg.data(), 0, targets, i * sampleLen, sampleLen);
            ids.add(s.id());
        }
        return new Batch(samples.size(), first.getHeight(), first.getWidth(), first.getChannels(),
                inputs, targets, Collections.unmodifiableList(ids));
    }

    public int size() {
        return size;
    }

    public int[] getShape() {
        return new int[]{size, height, width, channels};
    }

    /**
     * Backing array; callers must not modify it.
     */
    public float[] getInputs() {
        return inputs;
    }

    public float[] getTargets() {
        return targets;
    }

    public List<String> getSampleIds() {
        return sampleIds;
    }

    public ImageTensor inputAt(int i) {
        return slice(inputs, i);
    }

    public ImageTensor targetAt(int i) {
        return slice(targets, i);
    }

    private ImageTensor slice(float[] src, int i) {
        if (i < 0 || i >= size) {
            throw new IndexOutOfBoundsException("Sample " + i + " outside batch of " + size);
        }
        int len = height * width * channels;
        float[] out = new float[len];
        System.arraycopy(src, i * len, out, 0, len);
        return new ImageTensor(height, width, channels, out);
    }

    @Override
    public String toString() {
        return "Batch{shape=[" + size + ", " + height + ", " + width + ", " + channels + "]}";
    }
}
