package com.pairstream.server.pipeline.manifest;

/**
 * Column names read from manifest query results. Only the path column is required; the
 * others are read when the result set contains them.
 */
public class ManifestColumns {

    public static final ManifestColumns DEFAULT = new ManifestColumns(
            "image_path", "speckle_crop_pos", "original_crop_pos", "comments");

    private final String imagePath;
    private final String inputCrop;
    private final String targetCrop;
    private final String commentTag;

    public ManifestColumns(String imagePath, String inputCrop, String targetCrop, String commentTag) {
        this.imagePath = imagePath;
        this.inputCrop = inputCrop;
        this.targetCrop = targetCrop;
        this.commentTag = commentTag;
    }

    public String getImagePath() {
        return imagePath;
    }

    public String getInputCrop() {
        return inputCrop;
    }

    public String getTargetCrop() {
        return targetCrop;
    }

    public String getCommentTag() {
        return commentTag;
    }
}
