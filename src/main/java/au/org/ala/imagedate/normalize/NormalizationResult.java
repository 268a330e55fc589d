package au.org.ala.imagedate.normalize;

import au.org.ala.imagedate.metadata.PhotometricHint;
import au.org.ala.imagedate.raster.PixelFormat;
import au.org.ala.imagedate.raster.RasterImage;
import com.google.common.base.MoreObjects;

public class NormalizationResult {

    public static final String BLANK_CANVAS = "blank-canvas";

    private final RasterImage image;
    private final PhotometricHint hint;
    private final PixelFormat sourceFormat;
    private final String conversion;
    private final boolean degraded;

    public NormalizationResult(RasterImage image, PhotometricHint hint, PixelFormat sourceFormat, String conversion, boolean degraded) {
        this.image = image;
        this.hint = hint;
        this.sourceFormat = sourceFormat;
        this.conversion = conversion;
        this.degraded = degraded;
    }

    /**
     * @return the normalized image, always {@link PixelFormat#RGB}
     */
    public RasterImage getImage() {
        return image;
    }

    public PhotometricHint getHint() {
        return hint;
    }

    public PixelFormat getSourceFormat() {
        return sourceFormat;
    }

    /**
     * @return the name of the conversion that produced the image, or {@link #BLANK_CANVAS}
     */
    public String getConversion() {
        return conversion;
    }

    /**
     * @return true when a fallback conversion or the blank canvas had to be used
     */
    public boolean isDegraded() {
        return degraded;
    }

    public boolean isBlankCanvas() {
        return BLANK_CANVAS.equals(conversion);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("image", image)
                .add("hint", hint)
                .add("sourceFormat", sourceFormat)
                .add("conversion", conversion)
                .add("degraded", degraded)
                .toString();
    }
}
