package com.pairstream.db;

/**
 * A row of the {@code sample_metadata} table.
 */
public class SampleRecord {
    private final long id;
    private final String imagePath;
    private final String speckleCropPos;
    private final String originalCropPos;
    private final Integer comments;
    private final boolean calibration;
    private final Integer batch;
    private final long createdTs;

    public SampleRecord(long id, String imagePath, String speckleCropPos, String originalCropPos,
            Integer comments, boolean calibration, Integer batch, long createdTs) {
        this.id = id;
        this.imagePath = imagePath;
        this.speckleCropPos = speckleCropPos;
        this.originalCropPos = originalCropPos;
        this.comments = comments;
        this.calibration = calibration;
        this.batch = batch;
        this.createdTs = createdTs;
    }

    public long getId() {
        return id;
    }

    public String getImagePath() {
        return imagePath;
    }

    public String getSpeckleCropPos() {
        return speckleCropPos;
    }

    public String getOriginalCropPos() {
        return originalCropPos;
    }

    public Integer getComments() {
        return comments;
    }

    public boolean isCalibration() {
        return calibration;
    }

    public Integer getBatch() {
        return batch;
    }

    public long getCreatedTs() {
        return createdTs;
    }

    @Override
    public String toString() {
        return "SampleRecord{id=" + id + ", path='" + imagePath + "'}";
    }
}
