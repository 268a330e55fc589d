package au.org.ala.imagedate.normalize;

import au.org.ala.imagedate.metadata.Orientation;
import au.org.ala.imagedate.raster.PixelFormat;
import au.org.ala.imagedate.raster.RasterImage;
import au.org.ala.imagedate.raster.RasterImages;
import com.twelvemonkeys.image.AffineTransformOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;

/**
 * Turns an image upright according to its EXIF orientation. Orientation is best effort: if the transform can't be
 * applied the image is passed through as stored.
 */
public class OrientationNormalizer {

    private static final Logger log = LoggerFactory.getLogger(OrientationNormalizer.class);

    private final RenderingHints renderingHints =
            new RenderingHints(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);

    public RasterImage apply(RasterImage image, Orientation orientation) {
        if (orientation == null || orientation == Orientation.Normal) {
            return image;
        }
        try {
            if (image.getFormat().isKind(PixelFormat.Kind.FOREIGN)) {
                BufferedImage src = image.getForeign();
                AffineTransform transform = orientation.getAffineTransform(src.getWidth(), src.getHeight());
                return RasterImage.foreign(new AffineTransformOp(transform, renderingHints).filter(src, null));
            }
            RasterImage result = remap(image, orientation);
            log.debug("Applied orientation {}: {}x{} -> {}x{}", orientation,
                    image.getWidth(), image.getHeight(), result.getWidth(), result.getHeight());
            return result;
        } catch (RuntimeException e) {
            log.warn("Could not apply orientation {} to {}, leaving it as stored", orientation, image, e);
            return image;
        }
    }

    private RasterImage remap(RasterImage image, Orientation orientation) {
        int width = image.getWidth();
        int height = image.getHeight();
        int outWidth = orientation.isFlipDimensions() ? height : width;
        int outHeight = orientation.isFlipDimensions() ? width : height;
        int channels = image.getFormat().getChannels();

        AffineTransform inverse;
        try {
            inverse = orientation.getAffineTransform(width, height).createInverse();
        } catch (NoninvertibleTransformException e) {
            throw new IllegalStateException("Orientation transform is not invertible: " + orientation, e);
        }

        DataBuffer src = image.getSamples();
        DataBuffer dst = RasterImages.createBuffer(src.getDataType(), outWidth * outHeight * channels);
        boolean floating = src.getDataType() == DataBuffer.TYPE_FLOAT || src.getDataType() == DataBuffer.TYPE_DOUBLE;

        // map each output pixel centre back into the stored image
        double[] centres = new double[outWidth * 2];
        double[] sources = new double[outWidth * 2];
        for (int y = 0; y < outHeight; y++) {
            for (int x = 0; x < outWidth; x++) {
                centres[2 * x] = x + 0.5;
                centres[2 * x + 1] = y + 0.5;
            }
            inverse.transform(centres, 0, sources, 0, outWidth);
            for (int x = 0; x < outWidth; x++) {
                int sx = (int) Math.floor(sources[2 * x]);
                int sy = (int) Math.floor(sources[2 * x + 1]);
                int si = (sy * width + sx) * channels;
                int di = (y * outWidth + x) * channels;
                for (int c = 0; c < channels; c++) {
                    if (floating) {
                        dst.setElemDouble(di + c, src.getElemDouble(si + c));
                    } else {
                        dst.setElem(di + c, src.getElem(si + c));
                    }
                }
            }
        }

        if (image.getFormat().isKind(PixelFormat.Kind.PALETTE)) {
            return RasterImage.palette(outWidth, outHeight, dst, image.getPalette());
        }
        return RasterImage.of(outWidth, outHeight, image.getFormat(), dst);
    }
}
