package com.pairstream.server.pipeline.image;

import java.io.IOException;
import java.nio.file.Path;

public interface ImageDecoder {
    /**
     * Read an image as raw pixel values in [0, 255] with the requested channel count
     * (1 for grayscale, 3 for RGB).
     */
    ImageTensor decode(Path path, int channels) throws IOException;
}
