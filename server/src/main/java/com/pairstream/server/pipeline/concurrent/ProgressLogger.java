package com.pairstream.server.pipeline.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs {@code processed/total} every {@code every} items and on the last one.
 */
public class ProgressLogger implements ParallelExecutor.ProgressListener {

    private static final Logger logger = LoggerFactory.getLogger(ProgressLogger.class);

    private final String label;
    private final int every;

    public ProgressLogger(String label, int every) {
        this.label = label;
        this.every = Math.max(1, every);
    }

    @Override
    public void onItemDone(int completed, int total) {
        if (completed % every == 0 || completed == total) {
            logger.info("{}: processed {}/{}", label, completed, total);
        }
    }
}
