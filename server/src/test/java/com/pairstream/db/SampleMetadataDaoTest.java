package com.pairstream.db;

import com.pairstream.server.pipeline.manifest.ManifestColumns;
import com.pairstream.server.pipeline.manifest.ManifestRow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

public class SampleMetadataDaoTest {

    private static final String TEST_DB = "test_samples.db";
    private SampleMetadataDao dao;

    @BeforeEach
    public void setup() throws SQLException {
        deleteDbFiles();
        SqliteInitializer.initialize(TEST_DB);
        dao = new SampleMetadataDao(TEST_DB);
    }

    @AfterEach
    public void teardown() {
        deleteDbFiles();
    }

    private static void deleteDbFiles() {
        for (String suffix : new String[]{"", "-wal", "-shm"}) {
            File f = new File(TEST_DB + suffix);
            if (f.exists()) {
                f.delete();
            }
        }
    }

    @Test
    public void testInsertAndFind() throws SQLException {
        SampleRecord rec = dao.insert("frames/0001.png", "((0, 0), (64, 64))", "((64, 0), (128, 64))",
                3, false, 7);
        Assertions.assertTrue(rec.getId() > 0);

        Optional<SampleRecord> found = dao.findByPath("frames/0001.png");
        Assertions.assertTrue(found.isPresent());
        Assertions.assertEquals(rec.getId(), found.get().getId());
        Assertions.assertEquals("((0, 0), (64, 64))", found.get().getSpeckleCropPos());
        Assertions.assertEquals("((64, 0), (128, 64))", found.get().getOriginalCropPos());
        Assertions.assertEquals(Integer.valueOf(3), found.get().getComments());
        Assertions.assertEquals(Integer.valueOf(7), found.get().getBatch());
        Assertions.assertFalse(found.get().isCalibration());

        Assertions.assertFalse(dao.findByPath("missing.png").isPresent());
        Assertions.assertEquals(1, dao.count());
    }

    @Test
    public void testNullableColumns() throws SQLException {
        dao.insert("frames/calib.png", null, null, null, true, null);
        SampleRecord rec = dao.findByPath("frames/calib.png").orElseThrow();
        Assertions.assertNull(rec.getSpeckleCropPos());
        Assertions.assertNull(rec.getComments());
        Assertions.assertNull(rec.getBatch());
        Assertions.assertTrue(rec.isCalibration());
    }

    @Test
    public void testSelectMapsManifestColumns() throws SQLException {
        dao.insert("a.png", "((0, 0), (2, 2))", "((2, 0), (4, 2))", 1, false, 1);
        dao.insert("b.png", null, null, null, false, 1);
        dao.insert("c.png", null, null, null, true, 1);

        List<ManifestRow> rows = dao.select(
                "SELECT image_path, speckle_crop_pos, original_crop_pos, comments FROM sample_metadata "
                        + "WHERE is_calibration = 0 ORDER BY image_path", ManifestColumns.DEFAULT);
        Assertions.assertEquals(2, rows.size());
        Assertions.assertEquals("a.png", rows.get(0).getImagePath());
        Assertions.assertEquals("((0, 0), (2, 2))", rows.get(0).getInputCrop());
        Assertions.assertEquals(Integer.valueOf(1), rows.get(0).getCommentTag());
        Assertions.assertNull(rows.get(1).getInputCrop());
        Assertions.assertNull(rows.get(1).getCommentTag());
    }

    @Test
    public void testSelectWithoutOptionalColumns() throws SQLException {
        dao.insert("a.png", "((0, 0), (2, 2))", "((2, 0), (4, 2))", 1, false, 1);
        List<ManifestRow> rows = dao.select("SELECT image_path FROM sample_metadata", ManifestColumns.DEFAULT);
        Assertions.assertEquals(1, rows.size());
        Assertions.assertNull(rows.get(0).getInputCrop());
        Assertions.assertNull(rows.get(0).getTargetCrop());
    }

    @Test
    public void testSelectWithoutPathColumnFails() {
        Assertions.assertThrows(SQLException.class,
                () -> dao.select("SELECT comments FROM sample_metadata", ManifestColumns.DEFAULT));
    }
}
