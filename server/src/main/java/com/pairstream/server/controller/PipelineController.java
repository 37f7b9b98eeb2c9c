package com.pairstream.server.controller;

import com.pairstream.server.pipeline.sample.SampleDescriptor;
import com.pairstream.server.pipeline.stream.StreamingPipeline;
import com.pairstream.server.service.DatasetService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/pipeline")
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);
    private static final int PREVIEW_LIMIT = 20;

    private final DatasetService datasetService;

    public PipelineController(DatasetService datasetService) {
        this.datasetService = datasetService;
    }

    public static class ManifestSummary {
        public int sampleCount;
        public int cropSamples;
        public int splitSamples;
        public List<String> preview = new ArrayList<>();
    }

    @GetMapping("/stats")
    public ResponseEntity<?> stats() {
        if (!datasetService.isReady()) {
            return notReady();
        }
        return ResponseEntity.ok(datasetService.stats());
    }

    @GetMapping("/manifest")
    public ResponseEntity<?> manifest() {
        if (!datasetService.isReady()) {
            return notReady();
        }
        StreamingPipeline pipeline = datasetService.getPipeline();
        ManifestSummary summary = new ManifestSummary();
        for (SampleDescriptor d : pipeline.getDescriptors()) {
            summary.sampleCount++;
            if (d.hasCropRegions()) {
                summary.cropSamples++;
            } else {
                summary.splitSamples++;
            }
            if (summary.preview.size() < PREVIEW_LIMIT) {
                summary.preview.add(d.id());
            }
        }
        return ResponseEntity.ok(summary);
    }

    @PostMapping("/reset")
    public ResponseEntity<?> reset() {
        if (!datasetService.isReady()) {
            return notReady();
        }
        logger.info("Epoch reset requested.");
        return ResponseEntity.ok(datasetService.resetEpoch());
    }

    private ResponseEntity<?> notReady() {
        String failure = datasetService.getFailure();
        return ResponseEntity.status(503).body(failure != null
                ? "Pipeline failed to initialize: " + failure
                : "Pipeline is still loading, please try again later.");
    }
}
