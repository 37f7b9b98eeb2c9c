package com.pairstream.server.service;

import com.pairstream.server.pipeline.manifest.ManifestResolver;
import com.pairstream.server.pipeline.sample.SampleDescriptor;
import com.pairstream.server.pipeline.stream.PipelineConfig;
import com.pairstream.server.pipeline.stream.PipelineStats;
import com.pairstream.server.pipeline.stream.StreamingPipeline;
import com.pairstream.server.pipeline.transform.TransformRegistry;
import com.pairstream.server.util.PipelineSettings;
import com.pairstream.server.util.SettingsResolver;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Owns the process-wide pipeline. The manifest is resolved in the background at startup;
 * until then {@link #isReady()} is false.
 */
@Service
public class DatasetService {

    private static final Logger logger = LoggerFactory.getLogger(DatasetService.class);

    private final TransformRegistry registry = TransformRegistry.withDefaults();
    private volatile StreamingPipeline pipeline;
    private volatile String failure;

    public boolean isReady() {
        return pipeline != null;
    }

    /**
     * Why initialization failed, or null.
     */
    public String getFailure() {
        return failure;
    }

    public TransformRegistry getRegistry() {
        return registry;
    }

    @PostConstruct
    public void init() {
        Thread loader = new Thread(() -> {
            try {
                logger.info("Initializing dataset service...");
                PipelineSettings settings = SettingsResolver.resolve();
                PipelineConfig config = settings.toConfig(registry);
                ManifestResolver resolver = settings.toManifestResolver();
                List<SampleDescriptor> descriptors = resolver.resolve();
                if (descriptors.isEmpty()) {
                    logger.warn("Manifest resolved to zero samples");
                }
                pipeline = new StreamingPipeline(descriptors, config);
                logger.info("Dataset service ready with {} samples", descriptors.size());
            } catch (Exception e) {
                failure = e.getMessage();
                logger.error("Failed to initialize dataset pipeline", e);
            }
        }, "dataset-init");
        loader.setDaemon(true);
        loader.start();
    }

    /**
     * @throws IllegalStateException if the pipeline is not ready
     */
    public StreamingPipeline getPipeline() {
        StreamingPipeline p = pipeline;
        if (p == null) {
            throw new IllegalStateException("Pipeline is not ready");
        }
        return p;
    }

    /**
     * Serves the given pipeline, closing the one it replaces.
     */
    public void setPipeline(StreamingPipeline replacement) {
        StreamingPipeline previous = pipeline;
        pipeline = replacement;
        failure = null;
        if (previous != null && previous != replacement) {
            previous.close();
        }
    }

    public PipelineStats stats() {
        return getPipeline().stats();
    }

    public PipelineStats resetEpoch() {
        StreamingPipeline p = getPipeline();
        p.resetEpoch();
        return p.stats();
    }

    @PreDestroy
    public void shutdown() {
        StreamingPipeline p = pipeline;
        if (p != null) {
            p.close();
        }
    }
}
