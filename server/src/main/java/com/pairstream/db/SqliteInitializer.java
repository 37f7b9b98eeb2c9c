package com.pairstream.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                // Enable WAL mode
                stmt.execute("PRAGMA journal_mode = WAL;");

                // One row per captured frame; crop columns hold "((x1, y1), (x2, y2))"
                stmt.execute("CREATE TABLE IF NOT EXISTS sample_metadata (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "image_path TEXT NOT NULL, " +
                        "speckle_crop_pos TEXT, " +
                        "original_crop_pos TEXT, " +
                        "comments INTEGER, " +
                        "is_calibration INTEGER NOT NULL DEFAULT 0, " +
                        "batch INTEGER, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_sample_path " +
                        "ON sample_metadata (image_path);");
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_sample_batch " +
                        "ON sample_metadata (batch, is_calibration);");
            }
        }
    }
}
