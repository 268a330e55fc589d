package au.org.ala.imagedate.normalize;

import au.org.ala.imagedate.metadata.PhotometricHint;
import au.org.ala.imagedate.raster.PixelFormat;
import au.org.ala.imagedate.raster.RasterImage;
import com.google.common.base.MoreObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.DataBuffer;
import java.awt.image.DataBufferByte;
import java.util.Set;

/**
 * Maps gray images with more than 8 bits per sample onto 0..255.
 * <p/>
 * The source range is the one declared in the image's tags when it is valid ({@code max > min}), otherwise the
 * actual extrema of the samples. A flat range is clamp-cast instead of scaled.
 */
public class RangeRescaler {

    private static final Logger log = LoggerFactory.getLogger(RangeRescaler.class);

    public static final int DISPLAY_MAX = 255;

    private static final Set<Integer> SCALABLE_TYPES = Set.of(
            DataBuffer.TYPE_USHORT, DataBuffer.TYPE_SHORT, DataBuffer.TYPE_INT, DataBuffer.TYPE_FLOAT, DataBuffer.TYPE_DOUBLE);

    public static class Range {
        public final double lo;
        public final double hi;

        public Range(double lo, double hi) {
            this.lo = lo;
            this.hi = hi;
        }

        public boolean isFlat() {
            return hi == lo;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("lo", lo).add("hi", hi).toString();
        }
    }

    /**
     * Linearly rescale a wide gray image to gray-8.
     *
     * @throws UnsupportedConversionException if the image is not wide gray or its sample type can't be scaled
     */
    public RasterImage rescale(RasterImage image, PhotometricHint hint) throws UnsupportedConversionException {
        requireWideGray(image);
        int dataType = image.getSamples().getDataType();
        if (!SCALABLE_TYPES.contains(dataType)) {
            throw new UnsupportedConversionException("No linear rescale for data buffer type " + dataType);
        }

        Range range = resolveRange(image, hint);
        if (range.isFlat()) {
            log.debug("Flat sample range {}, casting samples directly", range);
            return castDirect(image, hint);
        }

        DataBuffer src = image.getSamples();
        int count = image.getPixelCount();
        byte[] out = new byte[count];
        double span = range.hi - range.lo;
        for (int i = 0; i < count; i++) {
            double scaled = (src.getElemDouble(i) - range.lo) * DISPLAY_MAX / span;
            out[i] = (byte) Math.round(clamp(scaled));
        }
        log.debug("Rescaled {} from {} to 0..{}", image.getFormat(), range, DISPLAY_MAX);
        return RasterImage.of(image.getWidth(), image.getHeight(), PixelFormat.GRAY8, new DataBufferByte(out, out.length));
    }

    /**
     * Lossy conversion to gray-8: each sample is rounded and clamped to 0..255 with no scaling.
     */
    public RasterImage castDirect(RasterImage image, PhotometricHint hint) throws UnsupportedConversionException {
        requireWideGray(image);
        DataBuffer src = image.getSamples();
        int count = image.getPixelCount();
        byte[] out = new byte[count];
        for (int i = 0; i < count; i++) {
            out[i] = (byte) Math.round(clamp(src.getElemDouble(i)));
        }
        return RasterImage.of(image.getWidth(), image.getHeight(), PixelFormat.GRAY8, new DataBufferByte(out, out.length));
    }

    /**
     * The range to map onto 0..255: the declared bounds if both are present and {@code max > min}, otherwise the
     * minimum and maximum of the samples, ignoring NaN. An image with no usable samples has the flat range 0..0.
     */
    public Range resolveRange(RasterImage image, PhotometricHint hint) {
        if (hint.hasDeclaredRange()) {
            double lo = hint.getDeclaredMin().getAsDouble();
            double hi = hint.getDeclaredMax().getAsDouble();
            if (hi > lo) {
                return new Range(lo, hi);
            }
            log.debug("Declared sample range {}..{} is invalid, using actual extrema", lo, hi);
        }

        DataBuffer samples = image.getSamples();
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (int i = 0, n = image.getPixelCount(); i < n; i++) {
            double v = samples.getElemDouble(i);
            if (Double.isNaN(v)) {
                continue;
            }
            if (v < lo) lo = v;
            if (v > hi) hi = v;
        }
        if (lo > hi) {
            return new Range(0, 0);
        }
        return new Range(lo, hi);
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) {
            return 0;
        }
        return Math.max(0, Math.min(DISPLAY_MAX, v));
    }

    private static void requireWideGray(RasterImage image) throws UnsupportedConversionException {
        if (!image.getFormat().isKind(PixelFormat.Kind.GRAY_WIDE)) {
            throw new UnsupportedConversionException("Range rescaling needs wide gray samples, got " + image.getFormat());
        }
    }
}
