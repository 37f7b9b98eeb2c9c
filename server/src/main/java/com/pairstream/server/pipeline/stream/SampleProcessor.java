package com.pairstream.server.pipeline.stream;

import com.pairstream.server.pipeline.derive.PairDeriver;
import com.pairstream.server.pipeline.image.ImagePair;
import com.pairstream.server.pipeline.image.ImageTensor;
import com.pairstream.server.pipeline.sample.SampleDescriptor;
import com.pairstream.server.pipeline.sample.SampleException;
import com.pairstream.server.pipeline.transform.TransformChain;
import com.pairstream.server.pipeline.transform.TransformException;

/**
 * Per-sample unit of work run on the worker pool: derive the pair, run the transform chain,
 * then validate the result.
 *
 * <p>An input/target shape mismatch is a {@link PipelineException} since every later sample
 * would hit it too. Values outside the configured range only fail the sample.
 */
public class SampleProcessor {

    private final PairDeriver deriver;
    private final TransformChain chain;
    private final float valueMin;
    private final float valueMax;

    public SampleProcessor(PairDeriver deriver, TransformChain chain, float valueMin, float valueMax) {
        this.deriver = deriver;
        this.chain = chain;
        this.valueMin = valueMin;
        this.valueMax = valueMax;
    }

    public ProcessedSample process(SampleDescriptor descriptor) throws SampleException {
        String id = descriptor.id();
        ImagePair pair = chain.apply(deriver.derive(descriptor), id);
        if (!pair.sameShape()) {
            throw new PipelineException("Input and target shapes differ for " + id + ": "
                    + pair.getInput().shapeString() + " vs " + pair.getTarget().shapeString()
                    + "; check the derivation settings and transform chain");
        }
        checkRange(id, "input", pair.getInput());
        checkRange(id, "target", pair.getTarget());
        return new ProcessedSample(descriptor, pair);
    }

    private void checkRange(String id, String side, ImageTensor img) throws TransformException {
        float min = img.min();
        float max = img.max();
        if (Float.isNaN(min) || Float.isNaN(max) || min < valueMin || max > valueMax) {
            throw new TransformException(id, "range-check",
                    side + " values [" + min + ", " + max + "] fall outside [" + valueMin + ", " + valueMax + "]",
                    null);
        }
    }
}
