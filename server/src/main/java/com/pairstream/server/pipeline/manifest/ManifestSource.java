package com.pairstream.server.pipeline.manifest;

import java.sql.SQLException;
import java.util.List;

/**
 * Queryable record source holding image paths and crop metadata. The caller owns the
 * source's connection lifecycle.
 */
public interface ManifestSource {

    List<ManifestRow> select(String query, ManifestColumns columns) throws SQLException;
}
