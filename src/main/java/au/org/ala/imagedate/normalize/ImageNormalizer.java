package au.org.ala.imagedate.normalize;

import au.org.ala.imagedate.metadata.PhotometricHint;
import au.org.ala.imagedate.metadata.PhotometricHintExtractor;
import au.org.ala.imagedate.metadata.TagLookup;
import au.org.ala.imagedate.raster.PixelFormat;
import au.org.ala.imagedate.raster.RasterImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.util.List;

/**
 * Turns a decoded image of any supported encoding into an upright 8-bit RGB image ready for display.
 * <p/>
 * The stages always run in the same order:
 * <ol>
 *     <li>the {@link PhotometricHint} is read from the tags, before any pixel conversion</li>
 *     <li>the EXIF orientation is applied</li>
 *     <li>the {@link ConversionTable} ladder for the image's pixel format reduces it to gray-8 or RGB
 *     (palette expansion, alpha flattening, colour space conversion, range rescaling, bilevel expansion)</li>
 *     <li>WhiteIsZero images are inverted</li>
 *     <li>gray is widened to RGB</li>
 * </ol>
 * Failures never propagate: when every conversion for a format fails the result is a blank canvas of the oriented
 * image's size.
 */
public class ImageNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ImageNormalizer.class);

    private final PhotometricHintExtractor hintExtractor;
    private final OrientationNormalizer orientationNormalizer;
    private final PolarityResolver polarityResolver;
    private final ChannelCompositor compositor;
    private final ConversionTable conversionTable;

    public ImageNormalizer() {
        this(Color.WHITE);
    }

    public ImageNormalizer(Color background) {
        this(new ChannelCompositor(background));
    }

    private ImageNormalizer(ChannelCompositor compositor) {
        this(new PhotometricHintExtractor(), new OrientationNormalizer(), new PolarityResolver(), compositor,
                ConversionTable.standard(new RangeRescaler(), compositor));
    }

    public ImageNormalizer(PhotometricHintExtractor hintExtractor, OrientationNormalizer orientationNormalizer,
                           PolarityResolver polarityResolver, ChannelCompositor compositor, ConversionTable conversionTable) {
        this.hintExtractor = hintExtractor;
        this.orientationNormalizer = orientationNormalizer;
        this.polarityResolver = polarityResolver;
        this.compositor = compositor;
        this.conversionTable = conversionTable;
    }

    public NormalizationResult normalize(RasterImage image, TagLookup tags) {
        return normalize(image, hintExtractor.extract(tags));
    }

    public NormalizationResult normalize(RasterImage image, PhotometricHint hint) {
        PixelFormat sourceFormat = image.getFormat();
        RasterImage oriented = orientationNormalizer.apply(image, hint.getOrientation());

        List<ConversionTable.Step> steps = conversionTable.stepsFor(sourceFormat.getKind());
        for (int i = 0; i < steps.size(); i++) {
            ConversionTable.Step step = steps.get(i);
            RasterImage ready;
            try {
                ready = step.getStrategy().convert(oriented, hint);
                if (!PolarityResolver.isInvertible(ready.getFormat())) {
                    throw new UnsupportedConversionException("Conversion produced " + ready.getFormat() + " rather than GRAY8 or RGB");
                }
                RasterImage rgb = compositor.toRgb(polarityResolver.resolve(ready, hint));
                log.debug("Normalized {} via {}", sourceFormat, step.getName());
                return new NormalizationResult(rgb, hint, sourceFormat, step.getName(), i > 0);
            } catch (UnsupportedConversionException e) {
                log.warn("Conversion {} failed for {}: {}", step.getName(), sourceFormat, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Conversion {} threw for {}", step.getName(), sourceFormat, e);
            }
        }

        log.warn("No conversion succeeded for {}, rendering a blank canvas", sourceFormat);
        RasterImage blank = compositor.blankCanvas(oriented.getWidth(), oriented.getHeight());
        return new NormalizationResult(blank, hint, sourceFormat, NormalizationResult.BLANK_CANVAS, true);
    }
}
