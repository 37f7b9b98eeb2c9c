package com.pairstream.server.util;

import com.pairstream.db.SampleMetadataDao;
import com.pairstream.server.pipeline.derive.DerivationConfig;
import com.pairstream.server.pipeline.derive.PairSide;
import com.pairstream.server.pipeline.derive.SplitAxis;
import com.pairstream.server.pipeline.manifest.FileSystemManifestResolver;
import com.pairstream.server.pipeline.manifest.ManifestResolver;
import com.pairstream.server.pipeline.manifest.SqlManifestResolver;
import com.pairstream.server.pipeline.stream.ErrorPolicy;
import com.pairstream.server.pipeline.stream.PartialBatchPolicy;
import com.pairstream.server.pipeline.stream.PipelineConfig;
import com.pairstream.server.pipeline.transform.TransformRegistry;
import com.pairstream.server.pipeline.transform.TransformStepSpec;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * JSON shape of {@code pipeline_config.json}. Every field is optional; unset values keep the
 * {@link PipelineConfig} defaults.
 */
public class PipelineSettings {

    public static class ManifestSettings {
        /** "filesystem" or "sql". */
        public String source = "filesystem";
        public List<String> roots;
        public List<String> types;
        public String dbPath;
        public String query;
    }

    public static class DerivationSettings {
        public String splitAxis;
        public String firstHalf;
        public String boundaryOwner;
        public Integer channels;
        public Integer cropOutputHeight;
        public Integer cropOutputWidth;
    }

    public ManifestSettings manifest;
    public DerivationSettings derivation;
    public List<TransformStepSpec> transforms;

    public Integer batchSize;
    public Integer shuffleWindowSize;
    public Integer prefetchDepth;
    public Integer parallelism;
    public Double skipRatioThreshold;
    public String partialBatchPolicy;
    public String errorPolicy;
    public Long seed;
    /** 0 disables the read timeout. */
    public Long ioTimeoutMillis;
    public Float valueMin;
    public Float valueMax;

    /**
     * @throws IllegalArgumentException on unknown enum names, unknown transforms or
     *                                  out-of-range values
     */
    public PipelineConfig toConfig(TransformRegistry registry) {
        PipelineConfig.Builder b = PipelineConfig.builder();
        if (batchSize != null) {
            b.batchSize(batchSize);
        }
        if (shuffleWindowSize != null) {
            b.shuffleWindowSize(shuffleWindowSize);
        }
        if (prefetchDepth != null) {
            b.prefetchDepth(prefetchDepth);
        }
        if (parallelism != null) {
            b.parallelism(parallelism);
        }
        if (skipRatioThreshold != null) {
            b.skipRatioThreshold(skipRatioThreshold);
        }
        if (partialBatchPolicy != null) {
            b.partialBatchPolicy(parseEnum(PartialBatchPolicy.class, partialBatchPolicy, "partialBatchPolicy"));
        }
        if (errorPolicy != null) {
            b.errorPolicy(parseEnum(ErrorPolicy.class, errorPolicy, "errorPolicy"));
        }
        if (seed != null) {
            b.seed(seed);
        }
        if (ioTimeoutMillis != null) {
            b.ioTimeout(Duration.ofMillis(ioTimeoutMillis));
        }
        if (valueMin != null || valueMax != null) {
            b.valueRange(valueMin != null ? valueMin : 0f, valueMax != null ? valueMax : 1f);
        }
        if (derivation != null) {
            b.derivation(toDerivationConfig(derivation));
        }
        if (transforms != null) {
            b.transformChain(registry.build(transforms));
        }
        return b.build();
    }

    /**
     * Builds the resolver named by {@code manifest.source}.
     */
    public ManifestResolver toManifestResolver() {
        ManifestSettings m = manifest != null ? manifest : new ManifestSettings();
        String source = m.source != null ? m.source.toLowerCase(Locale.ROOT) : "filesystem";
        switch (source) {
            case "filesystem": {
                if (m.roots == null || m.roots.isEmpty()) {
                    throw new IllegalArgumentException("manifest.roots is required for a filesystem manifest");
                }
                List<Path> roots = new ArrayList<>();
                for (String r : m.roots) {
                    roots.add(Paths.get(r));
                }
                return new FileSystemManifestResolver(roots, m.types != null ? m.types : List.of(".png"));
            }
            case "sql":
                if (m.dbPath == null || m.query == null) {
                    throw new IllegalArgumentException("manifest.dbPath and manifest.query are required for a sql manifest");
                }
                return new SqlManifestResolver(new SampleMetadataDao(m.dbPath), m.query);
            default:
                throw new IllegalArgumentException("Unknown manifest source: " + m.source);
        }
    }

    private static DerivationConfig toDerivationConfig(DerivationSettings d) {
        DerivationConfig defaults = DerivationConfig.defaults();
        return new DerivationConfig(
                d.splitAxis != null ? parseEnum(SplitAxis.class, d.splitAxis, "splitAxis") : defaults.getSplitAxis(),
                d.firstHalf != null ? parseEnum(PairSide.class, d.firstHalf, "firstHalf") : defaults.getFirstHalf(),
                d.boundaryOwner != null ? parseEnum(PairSide.class, d.boundaryOwner, "boundaryOwner")
                        : defaults.getBoundaryOwner(),
                d.channels != null ? d.channels : defaults.getChannels(),
                d.cropOutputHeight,
                d.cropOutputWidth);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + field + ": '" + value + "'", e);
        }
    }
}
