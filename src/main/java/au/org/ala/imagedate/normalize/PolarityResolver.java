package au.org.ala.imagedate.normalize;

import au.org.ala.imagedate.metadata.PhotometricHint;
import au.org.ala.imagedate.raster.PixelFormat;
import au.org.ala.imagedate.raster.RasterImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.DataBuffer;

/**
 * Inverts WhiteIsZero images so that zero renders as black. Only gray-8 and RGB images are inverted; every other
 * format has to be converted to one of those first.
 */
public class PolarityResolver {

    private static final Logger log = LoggerFactory.getLogger(PolarityResolver.class);

    public static final int MAX_VALUE = 255;

    /**
     * Inverts the image's samples in place when the hint says WhiteIsZero.
     *
     * @return the same image
     */
    public RasterImage resolve(RasterImage image, PhotometricHint hint) {
        if (!hint.isWhiteIsZero()) {
            return image;
        }
        if (!isInvertible(image.getFormat())) {
            log.debug("WhiteIsZero ignored for {}", image.getFormat());
            return image;
        }
        DataBuffer samples = image.getSamples();
        int count = image.getPixelCount() * image.getFormat().getChannels();
        for (int i = 0; i < count; i++) {
            samples.setElem(i, MAX_VALUE - samples.getElem(i));
        }
        return image;
    }

    public static boolean isInvertible(PixelFormat format) {
        return format.isKind(PixelFormat.Kind.GRAY8) || format.isKind(PixelFormat.Kind.RGB);
    }
}
