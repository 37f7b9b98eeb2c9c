package com.pairstream.server.pipeline.manifest;

/**
 * One raw row from a manifest source, before crop metadata is parsed.
 */
public class ManifestRow {
    private final String imagePath;
    private final String inputCrop;
    private final String targetCrop;
    private final Integer commentTag;

    public ManifestRow(String imagePath, String inputCrop, String targetCrop, Integer commentTag) {
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

    public Integer getCommentTag() {
        return commentTag;
    }
}
