package com.pairstream.db;

import com.pairstream.server.pipeline.manifest.ManifestColumns;
import com.pairstream.server.pipeline.manifest.ManifestRow;
import com.pairstream.server.pipeline.manifest.ManifestSource;

import java.sql.*;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public class SampleMetadataDao implements ManifestSource {

    private final String dbPath;

    public SampleMetadataDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public SampleRecord insert(String imagePath, String speckleCropPos, String originalCropPos,
            Integer comments, boolean calibration, Integer batch) throws SQLException {
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO sample_metadata " +
                "(image_path, speckle_crop_pos, original_crop_pos, comments, is_calibration, batch, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, imagePath);
            ps.setString(2, speckleCropPos);
            ps.setString(3, originalCropPos);
            setNullableInt(ps, 4, comments);
            ps.setInt(5, calibration ? 1 : 0);
            setNullableInt(ps, 6, batch);
            ps.setLong(7, now);
            ps.executeUpdate();

            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) {
                    return new SampleRecord(rs.getLong(1), imagePath, speckleCropPos, originalCropPos,
                            comments, calibration, batch, now);
                }
                throw new SQLException("Creating sample_metadata row failed, no ID obtained.");
            }
        }
    }

    public Optional<SampleRecord> findByPath(String imagePath) throws SQLException {
        String sql = "SELECT id, image_path, speckle_crop_pos, original_crop_pos, comments, is_calibration, " +
                "batch, created_ts FROM sample_metadata WHERE image_path = ? ORDER BY id LIMIT 1";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, imagePath);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new SampleRecord(
                            rs.getLong("id"),
                            rs.getString("image_path"),
                            rs.getString("speckle_crop_pos"),
                            rs.getString("original_crop_pos"),
                            getNullableInt(rs, "comments"),
                            rs.getInt("is_calibration") != 0,
                            getNullableInt(rs, "batch"),
                            rs.getLong("created_ts")));
                }
            }
        }
        return Optional.empty();
    }

    public int count() throws SQLException {
        try (Connection conn = connect();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM sample_metadata")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    @Override
    public List<ManifestRow> select(String query, ManifestColumns columns) throws SQLException {
        List<ManifestRow> rows = new ArrayList<>();
        try (Connection conn = connect();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(query)) {
            Set<String> present = columnLabels(rs.getMetaData());
            if (!present.contains(columns.getImagePath().toLowerCase(Locale.ROOT))) {
                throw new SQLException("Query result has no '" + columns.getImagePath() + "' column");
            }
            boolean hasInput = present.contains(columns.getInputCrop().toLowerCase(Locale.ROOT));
            boolean hasTarget = present.contains(columns.getTargetCrop().toLowerCase(Locale.ROOT));
            boolean hasComment = present.contains(columns.getCommentTag().toLowerCase(Locale.ROOT));

            while (rs.next()) {
                rows.add(new ManifestRow(
                        rs.getString(columns.getImagePath()),
                        hasInput ? rs.getString(columns.getInputCrop()) : null,
                        hasTarget ? rs.getString(columns.getTargetCrop()) : null,
                        hasComment ? getNullableInt(rs, columns.getCommentTag()) : null));
            }
        }
        return rows;
    }

    private static Set<String> columnLabels(ResultSetMetaData meta) throws SQLException {
        Set<String> labels = new HashSet<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            labels.add(meta.getColumnLabel(i).toLowerCase(Locale.ROOT));
        }
        return labels;
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
