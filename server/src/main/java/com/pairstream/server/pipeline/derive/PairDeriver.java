package com.pairstream.server.pipeline.derive;

import com.pairstream.server.pipeline.image.ImageDecoder;
import com.pairstream.server.pipeline.image.ImageOps;
import com.pairstream.server.pipeline.image.ImagePair;
import com.pairstream.server.pipeline.image.ImageTensor;
import com.pairstream.server.pipeline.sample.CropRegions;
import com.pairstream.server.pipeline.sample.Rectangle;
import com.pairstream.server.pipeline.sample.SampleDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Produces the raw (input, target) pair of one sample. Pixel values are left in the decoder's
 * [0, 255] range; normalization belongs to the transform chain.
 */
public class PairDeriver {

    private static final Logger logger = LoggerFactory.getLogger(PairDeriver.class);

    private final DerivationConfig config;
    private final ImageDecoder decoder;

    public PairDeriver(DerivationConfig config, ImageDecoder decoder) {
        this.config = config;
        this.decoder = decoder;
    }

    public DerivationConfig getConfig() {
        return config;
    }

    public ImagePair derive(SampleDescriptor descriptor) throws DerivationException {
        ImageTensor source = read(descriptor);
        switch (descriptor.getStrategy().getKind()) {
            case SPLIT:
                return split(descriptor.id(), source);
            case CROP:
                return crop(descriptor.id(), source, descriptor.getStrategy().getRegions());
            default:
                throw new IllegalStateException("Unknown derivation strategy " + descriptor.getStrategy());
        }
    }

    ImagePair split(String sampleId, ImageTensor source) throws DerivationException {
        boolean alongWidth = config.getSplitAxis() == SplitAxis.WIDTH;
        int extent = alongWidth ? source.getWidth() : source.getHeight();
        if (extent < 2) {
            throw new DerivationException(sampleId,
                    "Image " + source.shapeString() + " is too small to split along " + config.getSplitAxis());
        }

        // The middle column of an odd extent goes to the configured owner
        int half = extent / 2;
        boolean odd = extent % 2 == 1;
        int firstEnd = odd && config.getBoundaryOwner() == config.getFirstHalf() ? half + 1 : half;

        ImageTensor first = alongWidth ? ImageOps.columns(source, 0, firstEnd) : ImageOps.rows(source, 0, firstEnd);
        ImageTensor second = alongWidth ? ImageOps.columns(source, firstEnd, extent)
                : ImageOps.rows(source, firstEnd, extent);

        if (config.getFirstHalf() == PairSide.TARGET) {
            return new ImagePair(second, first);
        }
        return new ImagePair(first, second);
    }

    ImagePair crop(String sampleId, ImageTensor source, CropRegions regions) throws DerivationException {
        ImageTensor input = cropRegion(sampleId, source, regions.getInputRegion(), "input");
        ImageTensor target = cropRegion(sampleId, source, regions.getTargetRegion(), "target");
        return new ImagePair(input, target);
    }

    private ImageTensor cropRegion(String sampleId, ImageTensor source, Rectangle rect, String side)
            throws DerivationException {
        if (!rect.isValid()) {
            throw new DerivationException(sampleId, "Degenerate " + side + " rectangle " + rect);
        }
        if (!rect.fitsWithin(source.getWidth(), source.getHeight())) {
            throw new DerivationException(sampleId, "The " + side + " rectangle " + rect
                    + " exceeds image bounds " + source.getWidth() + "x" + source.getHeight());
        }
        ImageTensor cropped = ImageOps.crop(source, rect);
        if (config.hasCropOutputSize()) {
            cropped = ImageOps.resize(cropped, config.getCropOutputHeight(), config.getCropOutputWidth());
        }
        return cropped;
    }

    private ImageTensor read(SampleDescriptor descriptor) throws DerivationException {
        String id = descriptor.id();
        Path path;
        try {
            path = Paths.get(descriptor.getSourcePath());
        } catch (InvalidPathException e) {
            throw new DerivationException(id, "Invalid image path", e);
        }

        try {
            ImageTensor image = decoder.decode(path, config.getChannels());
            logger.debug("Decoded {} as {}", path, image.shapeString());
            return image;
        } catch (InterruptedIOException e) {
            throw new DerivationException(id, "Image read timed out or was interrupted: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DerivationException(id, "Unreadable image: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // ImageIO plugins report some corrupt streams with unchecked exceptions
            throw new DerivationException(id, "Image decode failed: " + e, e);
        }
    }
}
