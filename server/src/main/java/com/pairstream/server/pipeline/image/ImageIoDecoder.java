package com.pairstream.server.pipeline.image;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

public class ImageIoDecoder implements ImageDecoder {

    @Override
    public ImageTensor decode(Path path, int channels) throws IOException {
        BufferedImage bi = ImageIO.read(path.toFile());
        if (bi == null) {
            throw new IOException("Unsupported or corrupt image: " + path);
        }
        return ImageOps.fromBufferedImage(bi, channels);
    }
}
