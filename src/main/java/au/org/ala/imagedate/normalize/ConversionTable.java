package au.org.ala.imagedate.normalize;

import au.org.ala.imagedate.metadata.PhotometricHint;
import au.org.ala.imagedate.raster.PixelFormat;
import au.org.ala.imagedate.raster.RasterImage;
import com.google.common.base.MoreObjects;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The fallback ladder of the normalizer: for each pixel format, the conversion strategies to try, in order. When all
 * of them fail (or none is registered) the normalizer falls through to a blank canvas.
 */
public class ConversionTable {

    public static final String DIRECT_GRAY = "direct-gray";
    public static final String DIRECT_RGB = "direct-rgb";
    public static final String BILEVEL_EXPAND = "bilevel-expand";
    public static final String LINEAR_RESCALE = "linear-rescale";
    public static final String DIRECT_CAST = "direct-cast";
    public static final String PALETTE_EXPAND = "palette-expand";
    public static final String ALPHA_FLATTEN = "alpha-flatten";
    public static final String GRAY_ALPHA_FLATTEN = "gray-alpha-flatten";
    public static final String CMYK_CONVERT = "cmyk-convert";
    public static final String YCBCR_CONVERT = "ycbcr-convert";
    public static final String GENERIC_RENDER = "generic-render";

    public static class Step {
        private final String name;
        private final ConversionStrategy strategy;

        public Step(String name, ConversionStrategy strategy) {
            this.name = Objects.requireNonNull(name, "name");
            this.strategy = Objects.requireNonNull(strategy, "strategy");
        }

        public String getName() {
            return name;
        }

        public ConversionStrategy getStrategy() {
            return strategy;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private final Map<PixelFormat.Kind, List<Step>> steps = new EnumMap<>(PixelFormat.Kind.class);

    /**
     * Appends a strategy to the ladder of the given pixel format.
     */
    public ConversionTable register(PixelFormat.Kind kind, String name, ConversionStrategy strategy) {
        steps.computeIfAbsent(kind, k -> new ArrayList<>()).add(new Step(name, strategy));
        return this;
    }

    public List<Step> stepsFor(PixelFormat.Kind kind) {
        List<Step> registered = steps.get(kind);
        return registered != null ? Collections.unmodifiableList(registered) : List.of();
    }

    /**
     * The standard table: one direct conversion per format, plus a lossy cast behind the linear rescale of wide
     * gray images.
     */
    public static ConversionTable standard(RangeRescaler rescaler, ChannelCompositor compositor) {
        return new ConversionTable()
                .register(PixelFormat.Kind.GRAY8, DIRECT_GRAY, ConversionTable::requireGray8)
                .register(PixelFormat.Kind.RGB, DIRECT_RGB, ConversionTable::requireRgb)
                .register(PixelFormat.Kind.BILEVEL, BILEVEL_EXPAND, (image, hint) -> compositor.expandBilevel(image))
                .register(PixelFormat.Kind.GRAY_WIDE, LINEAR_RESCALE, rescaler::rescale)
                .register(PixelFormat.Kind.GRAY_WIDE, DIRECT_CAST, rescaler::castDirect)
                .register(PixelFormat.Kind.PALETTE, PALETTE_EXPAND, (image, hint) -> compositor.expandPalette(image))
                .register(PixelFormat.Kind.RGBA, ALPHA_FLATTEN, (image, hint) -> compositor.flattenAlpha(image))
                .register(PixelFormat.Kind.GRAY_ALPHA, GRAY_ALPHA_FLATTEN, (image, hint) -> compositor.flattenGrayAlpha(image))
                .register(PixelFormat.Kind.CMYK, CMYK_CONVERT, (image, hint) -> compositor.convertCmyk(image))
                .register(PixelFormat.Kind.YCBCR, YCBCR_CONVERT, (image, hint) -> compositor.convertYCbCr(image))
                .register(PixelFormat.Kind.FOREIGN, GENERIC_RENDER, (image, hint) -> compositor.renderForeign(image));
    }

    private static RasterImage requireGray8(RasterImage image, PhotometricHint hint) throws UnsupportedConversionException {
        if (!image.getFormat().isKind(PixelFormat.Kind.GRAY8)) {
            throw new UnsupportedConversionException("Expected GRAY8 but got " + image.getFormat());
        }
        return image;
    }

    private static RasterImage requireRgb(RasterImage image, PhotometricHint hint) throws UnsupportedConversionException {
        if (!image.getFormat().isKind(PixelFormat.Kind.RGB)) {
            throw new UnsupportedConversionException("Expected RGB but got " + image.getFormat());
        }
        return image;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("steps", steps).toString();
    }
}
