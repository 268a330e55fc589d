package au.org.ala.imagedate.normalize;

import au.org.ala.imagedate.metadata.PhotometricHint;
import au.org.ala.imagedate.raster.RasterImage;

/**
 * One way of turning an image of a given pixel format into a gray-8 or RGB image that polarity can be resolved on.
 */
@FunctionalInterface
public interface ConversionStrategy {

    RasterImage convert(RasterImage source, PhotometricHint hint) throws UnsupportedConversionException;
}
