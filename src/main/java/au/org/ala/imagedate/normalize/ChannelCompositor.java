package au.org.ala.imagedate.normalize;

import au.org.ala.imagedate.raster.PixelFormat;
import au.org.ala.imagedate.raster.RasterImage;
import au.org.ala.imagedate.raster.RasterImages;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.util.Arrays;

/**
 * Resolves colour tables, transparency and non-RGB colour spaces, and finally widens gray to three channels.
 * <p/>
 * Transparent pixels are composited over an opaque background, white unless configured otherwise.
 */
public class ChannelCompositor {

    private final Color background;
    private final int backgroundGray;

    public ChannelCompositor() {
        this(Color.WHITE);
    }

    public ChannelCompositor(Color background) {
        this.background = background;
        this.backgroundGray = (int) Math.round(0.299 * background.getRed() + 0.587 * background.getGreen() + 0.114 * background.getBlue());
    }

    public Color getBackground() {
        return background;
    }

    public RasterImage expandPalette(RasterImage image) throws UnsupportedConversionException {
        requireKind(image, PixelFormat.Kind.PALETTE);
        int[] palette = image.getPalette();
        DataBuffer indices = image.getSamples();
        int count = image.getPixelCount();
        byte[] out = new byte[count * 3];
        for (int i = 0; i < count; i++) {
            int index = indices.getElem(i);
            // indices past the end of the table render black
            int argb = index < palette.length ? palette[index] : 0;
            out[3 * i] = (byte) (argb >> 16);
            out[3 * i + 1] = (byte) (argb >> 8);
            out[3 * i + 2] = (byte) argb;
        }
        return RasterImages.rgb(image.getWidth(), image.getHeight(), out);
    }

    /**
     * RGBA to RGB: {@code out = a * fg + (1 - a) * background} per channel.
     */
    public RasterImage flattenAlpha(RasterImage image) throws UnsupportedConversionException {
        requireKind(image, PixelFormat.Kind.RGBA);
        DataBuffer src = image.getSamples();
        int count = image.getPixelCount();
        int[] bg = {background.getRed(), background.getGreen(), background.getBlue()};
        byte[] out = new byte[count * 3];
        for (int i = 0; i < count; i++) {
            int alpha = src.getElem(4 * i + 3);
            for (int c = 0; c < 3; c++) {
                out[3 * i + c] = (byte) composite(src.getElem(4 * i + c), alpha, bg[c]);
            }
        }
        return RasterImages.rgb(image.getWidth(), image.getHeight(), out);
    }

    /**
     * Gray + alpha to gray-8, composited over the background's luma.
     */
    public RasterImage flattenGrayAlpha(RasterImage image) throws UnsupportedConversionException {
        requireKind(image, PixelFormat.Kind.GRAY_ALPHA);
        DataBuffer src = image.getSamples();
        int count = image.getPixelCount();
        byte[] out = new byte[count];
        for (int i = 0; i < count; i++) {
            out[i] = (byte) composite(src.getElem(2 * i), src.getElem(2 * i + 1), backgroundGray);
        }
        return RasterImages.gray8(image.getWidth(), image.getHeight(), out);
    }

    /**
     * Subtractive CMYK conversion: {@code R = 255 - min(255, C + K)} and likewise for G and B.
     */
    public RasterImage convertCmyk(RasterImage image) throws UnsupportedConversionException {
        requireKind(image, PixelFormat.Kind.CMYK);
        DataBuffer src = image.getSamples();
        int count = image.getPixelCount();
        byte[] out = new byte[count * 3];
        for (int i = 0; i < count; i++) {
            int k = src.getElem(4 * i + 3);
            for (int c = 0; c < 3; c++) {
                out[3 * i + c] = (byte) (255 - Math.min(255, src.getElem(4 * i + c) + k));
            }
        }
        return RasterImages.rgb(image.getWidth(), image.getHeight(), out);
    }

    /**
     * Full range ITU-R BT.601 YCbCr, as used by JPEG/JFIF.
     */
    public RasterImage convertYCbCr(RasterImage image) throws UnsupportedConversionException {
        requireKind(image, PixelFormat.Kind.YCBCR);
        DataBuffer src = image.getSamples();
        int count = image.getPixelCount();
        byte[] out = new byte[count * 3];
        for (int i = 0; i < count; i++) {
            int y = src.getElem(3 * i);
            int cb = src.getElem(3 * i + 1) - 128;
            int cr = src.getElem(3 * i + 2) - 128;

            double red = y + 1.402 * cr;
            double green = y - 0.34414 * cb - 0.71414 * cr;
            double blue = y + 1.772 * cb;

            out[3 * i] = (byte) toUnsignedByte(red);
            out[3 * i + 1] = (byte) toUnsignedByte(green);
            out[3 * i + 2] = (byte) toUnsignedByte(blue);
        }
        return RasterImages.rgb(image.getWidth(), image.getHeight(), out);
    }

    /**
     * 1-bit samples to gray-8: zero stays 0, anything else becomes 255.
     */
    public RasterImage expandBilevel(RasterImage image) throws UnsupportedConversionException {
        requireKind(image, PixelFormat.Kind.BILEVEL);
        DataBuffer src = image.getSamples();
        int count = image.getPixelCount();
        byte[] out = new byte[count];
        for (int i = 0; i < count; i++) {
            out[i] = (byte) (src.getElem(i) == 0 ? 0 : 255);
        }
        return RasterImages.gray8(image.getWidth(), image.getHeight(), out);
    }

    /**
     * Renders an image the decoder gave us in an unrecognised encoding through its own colour model.
     *
     * @throws UnsupportedConversionException when the colour model can't produce RGB values
     */
    public RasterImage renderForeign(RasterImage image) throws UnsupportedConversionException {
        requireKind(image, PixelFormat.Kind.FOREIGN);
        BufferedImage foreign = image.getForeign();
        int width = foreign.getWidth();
        int height = foreign.getHeight();
        int[] argb;
        try {
            argb = foreign.getRGB(0, 0, width, height, null, 0, width);
        } catch (RuntimeException e) {
            throw new UnsupportedConversionException("Colour model " + foreign.getColorModel() + " can't render RGB", e);
        }
        int[] bg = {background.getRed(), background.getGreen(), background.getBlue()};
        byte[] out = new byte[argb.length * 3];
        for (int i = 0; i < argb.length; i++) {
            int alpha = (argb[i] >>> 24) & 0xFF;
            out[3 * i] = (byte) composite((argb[i] >> 16) & 0xFF, alpha, bg[0]);
            out[3 * i + 1] = (byte) composite((argb[i] >> 8) & 0xFF, alpha, bg[1]);
            out[3 * i + 2] = (byte) composite(argb[i] & 0xFF, alpha, bg[2]);
        }
        return RasterImages.rgb(width, height, out);
    }

    /**
     * Widens gray-8 to RGB by repeating the sample; RGB images are returned unchanged.
     */
    public RasterImage toRgb(RasterImage image) throws UnsupportedConversionException {
        if (image.getFormat().isKind(PixelFormat.Kind.RGB)) {
            return image;
        }
        requireKind(image, PixelFormat.Kind.GRAY8);
        DataBuffer src = image.getSamples();
        int count = image.getPixelCount();
        byte[] out = new byte[count * 3];
        for (int i = 0; i < count; i++) {
            byte v = (byte) src.getElem(i);
            out[3 * i] = v;
            out[3 * i + 1] = v;
            out[3 * i + 2] = v;
        }
        return RasterImages.rgb(image.getWidth(), image.getHeight(), out);
    }

    /**
     * An RGB canvas filled with the background colour.
     */
    public RasterImage blankCanvas(int width, int height) {
        byte[] out = new byte[width * height * 3];
        if (background.getRed() == background.getGreen() && background.getGreen() == background.getBlue()) {
            Arrays.fill(out, (byte) background.getRed());
        } else {
            for (int i = 0; i < out.length; i += 3) {
                out[i] = (byte) background.getRed();
                out[i + 1] = (byte) background.getGreen();
                out[i + 2] = (byte) background.getBlue();
            }
        }
        return RasterImages.rgb(width, height, out);
    }

    static int composite(int foreground, int alpha, int backdrop) {
        return (foreground * alpha + backdrop * (255 - alpha) + 127) / 255;
    }

    private static int toUnsignedByte(double v) {
        return v < 0.0 ? 0 : v > 255.0 ? 255 : (int) Math.round(v);
    }

    private static void requireKind(RasterImage image, PixelFormat.Kind kind) throws UnsupportedConversionException {
        if (!image.getFormat().isKind(kind)) {
            throw new UnsupportedConversionException("Expected " + kind + " but got " + image.getFormat());
        }
    }
}
