package com.pairstream.server.pipeline.stream;

/**
 * Snapshot of the counters of the current epoch. Counters restart at zero on every epoch.
 */
public final class PipelineStats {

    private final int epoch;
    private final EpochState state;
    private final int manifestSize;
    private final long samplesSeen;
    private final long samplesSkipped;
    private final long batchesDelivered;
    private final double meanBatchLatencyMillis;

    public PipelineStats(int epoch, EpochState state, int manifestSize, long samplesSeen, long samplesSkipped,
            long batchesDelivered, double meanBatchLatencyMillis) {
        this.epoch = epoch;
        this.state = state;
        this.manifestSize = manifestSize;
        this.samplesSeen = samplesSeen;
        this.samplesSkipped = samplesSkipped;
        this.batchesDelivered = batchesDelivered;
        this.meanBatchLatencyMillis = meanBatchLatencyMillis;
    }

    public int getEpoch() {
        return epoch;
    }

    public EpochState getState() {
        return state;
    }

    public int getManifestSize() {
        return manifestSize;
    }

    /**
     * Descriptors processed so far, skipped ones included.
     */
    public long getSamplesSeen() {
        return samplesSeen;
    }

    public long getSamplesSkipped() {
        return samplesSkipped;
    }

    public long getBatchesDelivered() {
        return batchesDelivered;
    }

    /**
     * Average time a consumer waited inside {@code nextBatch()}.
     */
    public double getMeanBatchLatencyMillis() {
        return meanBatchLatencyMillis;
    }

    @Override
    public String toString() {
        return String.format("PipelineStats{epoch=%d, state=%s, seen=%d/%d, skipped=%d, batches=%d, latency=%.2fms}",
                epoch, state, samplesSeen, manifestSize, samplesSkipped, batchesDelivered, meanBatchLatencyMillis);
    }
}
