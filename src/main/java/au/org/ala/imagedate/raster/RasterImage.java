package au.org.ala.imagedate.raster;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.util.Objects;

/**
 * A decoded image on its way through the normalization pipeline.
 * <p/>
 * Samples are stored pixel interleaved in a single {@link DataBuffer}, {@code format.getChannels()} elements per
 * pixel, rows top to bottom. The image owns its buffer: stages either invert it in place or hand back a new image
 * with a fresh buffer, and nothing keeps a reference to a buffer once it has been replaced.
 * <p/>
 * Palette images additionally carry their colour table as packed ARGB values. {@link PixelFormat#FOREIGN} images
 * carry the decoder's {@link BufferedImage} instead of a sample buffer.
 */
public final class RasterImage {

    private final int width;
    private final int height;
    private final PixelFormat format;
    private final DataBuffer samples;
    private final int[] palette;
    private final BufferedImage foreign;

    private RasterImage(int width, int height, PixelFormat format, DataBuffer samples, int[] palette, BufferedImage foreign) {
        Preconditions.checkArgument(width > 0 && height > 0, "Image dimensions must be positive: %sx%s", width, height);
        this.width = width;
        this.height = height;
        this.format = Objects.requireNonNull(format, "format");
        this.samples = samples;
        this.palette = palette;
        this.foreign = foreign;
    }

    public static RasterImage of(int width, int height, PixelFormat format, DataBuffer samples) {
        Preconditions.checkArgument(!format.isKind(PixelFormat.Kind.PALETTE), "Palette images need a colour table");
        Preconditions.checkArgument(!format.isKind(PixelFormat.Kind.FOREIGN), "Foreign images wrap a BufferedImage");
        checkSampleCount(width, height, format.getChannels(), samples);
        return new RasterImage(width, height, format, samples, null, null);
    }

    public static RasterImage palette(int width, int height, DataBuffer indices, int[] argbPalette) {
        Objects.requireNonNull(argbPalette, "palette");
        checkSampleCount(width, height, 1, indices);
        return new RasterImage(width, height, PixelFormat.PALETTE, indices, argbPalette, null);
    }

    public static RasterImage foreign(BufferedImage image) {
        Objects.requireNonNull(image, "image");
        return new RasterImage(image.getWidth(), image.getHeight(), PixelFormat.FOREIGN, null, null, image);
    }

    private static void checkSampleCount(int width, int height, int channels, DataBuffer samples) {
        Objects.requireNonNull(samples, "samples");
        long needed = (long) width * height * channels;
        Preconditions.checkArgument(samples.getSize() >= needed,
                "Sample buffer holds %s elements but %sx%s with %s channel(s) needs %s",
                samples.getSize(), width, height, channels, needed);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getPixelCount() {
        return width * height;
    }

    public PixelFormat getFormat() {
        return format;
    }

    public DataBuffer getSamples() {
        return samples;
    }

    public int[] getPalette() {
        return palette;
    }

    public BufferedImage getForeign() {
        return foreign;
    }

    /**
     * Convenience accessor for 8-bit images: the sample at the given pixel and channel, 0..255.
     */
    public int getSample(int x, int y, int channel) {
        return samples.getElem((y * width + x) * format.getChannels() + channel);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("width", width)
                .add("height", height)
                .add("format", format)
                .toString();
    }
}
