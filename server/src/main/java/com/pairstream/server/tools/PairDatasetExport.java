package com.pairstream.server.tools;

import com.pairstream.server.pipeline.concurrent.GuardedExecutor;
import com.pairstream.server.pipeline.concurrent.ItemResult;
import com.pairstream.server.pipeline.concurrent.ParallelExecutor;
import com.pairstream.server.pipeline.concurrent.ProgressLogger;
import com.pairstream.server.pipeline.derive.PairDeriver;
import com.pairstream.server.pipeline.image.GuardedImageDecoder;
import com.pairstream.server.pipeline.image.ImageDecoder;
import com.pairstream.server.pipeline.image.ImageIoDecoder;
import com.pairstream.server.pipeline.image.ImageOps;
import com.pairstream.server.pipeline.image.ImagePair;
import com.pairstream.server.pipeline.manifest.ManifestException;
import com.pairstream.server.pipeline.sample.SampleDescriptor;
import com.pairstream.server.pipeline.stream.PipelineConfig;
import com.pairstream.server.pipeline.stream.ProcessedSample;
import com.pairstream.server.pipeline.stream.SampleProcessor;
import com.pairstream.server.pipeline.transform.TransformRegistry;
import com.pairstream.server.util.PipelineSettings;
import com.pairstream.server.util.SettingsResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Offline tool that derives and transforms every manifest sample and writes each pair as a
 * side-by-side PNG (input left, target right).
 * Usage: PairDatasetExport <outputDir> [settingsFile]
 */
public class PairDatasetExport {

    private static final Logger logger = LoggerFactory.getLogger(PairDatasetExport.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: PairDatasetExport <outputDir> [settingsFile]");
            System.exit(1);
        }

        try {
            PipelineSettings settings = args.length > 1
                    ? SettingsResolver.load(Paths.get(args[1]))
                    : SettingsResolver.resolve();
            int failed = run(settings, Paths.get(args[0]));
            if (failed > 0) {
                System.exit(2);
            }
        } catch (IOException | ManifestException | IllegalArgumentException e) {
            logger.error("Export failed: {}", e.getMessage(), e);
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Export interrupted");
            System.exit(1);
        }
    }

    /**
     * @return number of samples that could not be exported
     */
    public static int run(PipelineSettings settings, Path outputDir)
            throws IOException, ManifestException, InterruptedException {
        PipelineConfig config = settings.toConfig(TransformRegistry.withDefaults());
        List<SampleDescriptor> descriptors = settings.toManifestResolver().resolve();
        logger.info("Exporting {} samples to {}", descriptors.size(), outputDir.toAbsolutePath());
        Files.createDirectories(outputDir);

        try (GuardedExecutor guard = new GuardedExecutor("export-io");
                ParallelExecutor executor = new ParallelExecutor(config.getParallelism(), "export")) {
            ImageDecoder decoder = new ImageIoDecoder();
            if (config.getIoTimeout() != null) {
                decoder = new GuardedImageDecoder(decoder, guard, config.getIoTimeout());
            }
            SampleProcessor processor = new SampleProcessor(new PairDeriver(config.getDerivation(), decoder),
                    config.getTransformChain(), config.getValueMin(), config.getValueMax());
            float valueMax = config.getValueMax();
            int digits = Math.max(5, String.valueOf(descriptors.size()).length());

            List<Integer> indices = new ArrayList<>(descriptors.size());
            for (int i = 0; i < descriptors.size(); i++) {
                indices.add(i);
            }

            List<ItemResult<Integer, Path>> results = executor.mapParallel(index -> {
                ProcessedSample sample = processor.process(descriptors.get(index));
                ImagePair pair = sample.getPair();
                Path out = outputDir.resolve(String.format("pair_%0" + digits + "d.png", index));
                ImageIO.write(ImageOps.toBufferedImage(
                        ImageOps.joinHorizontally(Arrays.asList(pair.getInput(), pair.getTarget())), valueMax),
                        "png", out.toFile());
                return out;
            }, indices, new ProgressLogger("Exported", 100));

            int failed = 0;
            for (ItemResult<Integer, Path> r : results) {
                if (!r.isSuccess()) {
                    failed++;
                    logger.warn("Failed to export {}: {}", descriptors.get(r.getItem()).id(),
                            r.getError().getMessage());
                }
            }
            logger.info("Export finished: {} written, {} failed", results.size() - failed, failed);
            return failed;
        }
    }
}
