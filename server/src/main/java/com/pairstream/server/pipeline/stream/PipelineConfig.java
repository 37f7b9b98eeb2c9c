package com.pairstream.server.pipeline.stream;

import com.pairstream.server.pipeline.derive.DerivationConfig;
import com.pairstream.server.pipeline.transform.TransformChain;
import com.pairstream.server.pipeline.transform.TransformStage;
import com.pairstream.server.pipeline.transform.TransformStep;
import com.pairstream.server.pipeline.transform.TransformSide;
import com.pairstream.server.pipeline.transform.Transforms;

import java.time.Duration;

/**
 * Immutable settings of one pipeline run. Together with the manifest, fully determines the
 * batches produced, including shuffle order (through {@code seed}).
 */
public final class PipelineConfig {

    private final int batchSize;
    private final int shuffleWindowSize;
    private final int prefetchDepth;
    private final int parallelism;
    private final double skipRatioThreshold;
    private final PartialBatchPolicy partialBatchPolicy;
    private final ErrorPolicy errorPolicy;
    private final long seed;
    private final Duration ioTimeout;
    private final float valueMin;
    private final float valueMax;
    private final DerivationConfig derivation;
    private final TransformChain transformChain;

    private PipelineConfig(Builder b) {
        this.batchSize = b.batchSize;
        this.shuffleWindowSize = b.shuffleWindowSize;
        this.prefetchDepth = b.prefetchDepth;
        this.parallelism = b.parallelism;
        this.skipRatioThreshold = b.skipRatioThreshold;
        this.partialBatchPolicy = b.partialBatchPolicy;
        this.errorPolicy = b.errorPolicy;
        this.seed = b.seed;
        this.ioTimeout = b.ioTimeout;
        this.valueMin = b.valueMin;
        this.valueMax = b.valueMax;
        this.derivation = b.derivation;
        this.transformChain = b.transformChain;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Chain used when none is configured: divide 8-bit pixels by 255.
     */
    public static TransformChain defaultTransformChain() {
        return TransformChain.of(new TransformStep("normalize", TransformStage.NORMALIZATION, TransformSide.BOTH,
                Transforms.normalize(255.0)));
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getShuffleWindowSize() {
        return shuffleWindowSize;
    }

    public boolean isShuffled() {
        return shuffleWindowSize > 1;
    }

    public int getPrefetchDepth() {
        return prefetchDepth;
    }

    public int getParallelism() {
        return parallelism;
    }

    public double getSkipRatioThreshold() {
        return skipRatioThreshold;
    }

    public PartialBatchPolicy getPartialBatchPolicy() {
        return partialBatchPolicy;
    }

    public ErrorPolicy getErrorPolicy() {
        return errorPolicy;
    }

    public long getSeed() {
        return seed;
    }

    /**
     * Bound on a single image read, or null when reads are not guarded.
     */
    public Duration getIoTimeout() {
        return ioTimeout;
    }

    public float getValueMin() {
        return valueMin;
    }

    public float getValueMax() {
        return valueMax;
    }

    public DerivationConfig getDerivation() {
        return derivation;
    }

    public TransformChain getTransformChain() {
        return transformChain;
    }

    public Builder toBuilder() {
        return new Builder()
                .batchSize(batchSize)
                .shuffleWindowSize(shuffleWindowSize)
                .prefetchDepth(prefetchDepth)
                .parallelism(parallelism)
                .skipRatioThreshold(skipRatioThreshold)
                .partialBatchPolicy(partialBatchPolicy)
                .errorPolicy(errorPolicy)
                .seed(seed)
                .ioTimeout(ioTimeout)
                .valueRange(valueMin, valueMax)
                .derivation(derivation)
                .transformChain(transformChain);
    }

    @Override
    public String toString() {
        return "PipelineConfig{batchSize=" + batchSize + ", shuffleWindowSize=" + shuffleWindowSize
                + ", prefetchDepth=" + prefetchDepth + ", parallelism=" + parallelism
                + ", skipRatioThreshold=" + skipRatioThreshold + ", partialBatchPolicy=" + partialBatchPolicy
                + ", errorPolicy=" + errorPolicy + ", seed=" + seed + ", ioTimeout=" + ioTimeout
                + ", valueRange=[" + valueMin + ", " + valueMax + "], derivation=" + derivation
                + ", transforms=" + transformChain.getSteps() + "}";
    }

    public static final class Builder {
        private int batchSize = 32;
        private int shuffleWindowSize = 1000;
        private int prefetchDepth = 2;
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private double skipRatioThreshold = 0.05;
        private PartialBatchPolicy partialBatchPolicy = PartialBatchPolicy.KEEP;
        private ErrorPolicy errorPolicy = ErrorPolicy.SKIP;
        private long seed = 42L;
        private Duration ioTimeout = Duration.ofSeconds(30);
        private float valueMin = 0f;
        private float valueMax = 1f;
        private DerivationConfig derivation = DerivationConfig.defaults();
        private TransformChain transformChain = defaultTransformChain();

        private Builder() {
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * A window of 1 disables shuffling.
         */
        public Builder shuffleWindowSize(int shuffleWindowSize) {
            this.shuffleWindowSize = shuffleWindowSize;
            return this;
        }

        public Builder prefetchDepth(int prefetchDepth) {
            this.prefetchDepth = prefetchDepth;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder skipRatioThreshold(double skipRatioThreshold) {
            this.skipRatioThreshold = skipRatioThreshold;
            return this;
        }

        public Builder partialBatchPolicy(PartialBatchPolicy partialBatchPolicy) {
            this.partialBatchPolicy = partialBatchPolicy;
            return this;
        }

        public Builder errorPolicy(ErrorPolicy errorPolicy) {
            this.errorPolicy = errorPolicy;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * Null or zero disables the per-read timeout.
         */
        public Builder ioTimeout(Duration ioTimeout) {
            this.ioTimeout = ioTimeout;
            return this;
        }

        public Builder valueRange(float min, float max) {
            this.valueMin = min;
            this.valueMax = max;
            return this;
        }

        public Builder derivation(DerivationConfig derivation) {
            this.derivation = derivation;
            return this;
        }

        public Builder transformChain(TransformChain transformChain) {
            this.transformChain = transformChain;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any setting is out of range
         */
        public PipelineConfig build() {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be > 0, got " + batchSize);
            }
            if (shuffleWindowSize != 1 && shuffleWindowSize < batchSize) {
                throw new IllegalArgumentException("shuffleWindowSize must be 1 (unshuffled) or >= batchSize ("
                        + batchSize + "), got " + shuffleWindowSize);
            }
            if (prefetchDepth < 1) {
                throw new IllegalArgumentException("prefetchDepth must be >= 1, got " + prefetchDepth);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
            }
            if (!(skipRatioThreshold >= 0.0 && skipRatioThreshold <= 1.0)) {
                throw new IllegalArgumentException("skipRatioThreshold must be in [0, 1], got " + skipRatioThreshold);
            }
            if (!(valueMin < valueMax)) {
                throw new IllegalArgumentException("valueMin must be below valueMax");
            }
            if (partialBatchPolicy == null || errorPolicy == null || derivation == null || transformChain == null) {
                throw new IllegalArgumentException("Policies, derivation and transform chain must be set");
            }
            if (ioTimeout != null && (ioTimeout.isZero() || ioTimeout.isNegative())) {
                ioTimeout = null;
            }
            return new PipelineConfig(this);
        }
    }
}
