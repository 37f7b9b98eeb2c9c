package com.pairstream.server.pipeline.manifest;

import com.pairstream.server.pipeline.sample.CropRegions;
import com.pairstream.server.pipeline.sample.Rectangle;
import com.pairstream.server.pipeline.sample.SampleDescriptor;
import com.pairstream.util.RectangleCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Resolves descriptors from a query against a {@link ManifestSource}. Results keep the
 * query's order when it has an ORDER BY clause; otherwise they are sorted by path, then by
 * crop regions, so resolution is reproducible.
 */
public class SqlManifestResolver implements ManifestResolver {

    private static final Logger logger = LoggerFactory.getLogger(SqlManifestResolver.class);
    private static final Pattern ORDER_BY = Pattern.compile("\\border\\s+by\\b");

    private static final Comparator<SampleDescriptor> BY_PATH_THEN_REGIONS = Comparator
            .comparing(SampleDescriptor::getSourcePath)
            .thenComparing(d -> d.getStrategy().toString());

    private final ManifestSource source;
    private final String query;
    private final ManifestColumns columns;

    public SqlManifestResolver(ManifestSource source, String query, ManifestColumns columns) {
        this.source = source;
        this.query = query;
        this.columns = columns != null ? columns : ManifestColumns.DEFAULT;
    }

    public SqlManifestResolver(ManifestSource source, String query) {
        this(source, query, ManifestColumns.DEFAULT);
    }

    @Override
    public List<SampleDescriptor> resolve() throws ManifestException {
        if (source == null) {
            throw new ManifestException("No manifest source configured");
        }
        if (query == null || query.trim().isEmpty()) {
            throw new ManifestException("Manifest query is empty");
        }

        List<ManifestRow> rows;
        try {
            rows = source.select(query, columns);
        } catch (SQLException e) {
            throw new ManifestException("Manifest query failed: " + query, e);
        }

        List<SampleDescriptor> descriptors = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            descriptors.add(toDescriptor(rows.get(i), i));
        }

        if (!hasExplicitOrder(query)) {
            descriptors.sort(BY_PATH_THEN_REGIONS);
        }
        logger.info("Resolved {} samples from manifest query", descriptors.size());
        return descriptors;
    }

    static boolean hasExplicitOrder(String query) {
        return ORDER_BY.matcher(query.toLowerCase(Locale.ROOT)).find();
    }

    private SampleDescriptor toDescriptor(ManifestRow row, int index) throws ManifestException {
        String path = row.getImagePath();
        if (path == null || path.trim().isEmpty()) {
            throw new ManifestException("Manifest row " + index + " has no image path");
        }

        boolean hasInput = row.getInputCrop() != null && !row.getInputCrop().trim().isEmpty();
        boolean hasTarget = row.getTargetCrop() != null && !row.getTargetCrop().trim().isEmpty();
        if (hasInput != hasTarget) {
            throw new ManifestException("Manifest row for " + path + " has only one crop region");
        }

        CropRegions regions = null;
        if (hasInput) {
            try {
                Rectangle input = RectangleCodec.fromText(row.getInputCrop());
                Rectangle target = RectangleCodec.fromText(row.getTargetCrop());
                regions = new CropRegions(input, target);
            } catch (IllegalArgumentException e) {
                throw new ManifestException("Malformed crop metadata for " + path, e);
            }
        }
        return new SampleDescriptor(path, regions, row.getCommentTag());
    }
}
