package au.org.ala.imagedate.raster;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.DataBufferByte;
import java.awt.image.DataBufferDouble;
import java.awt.image.DataBufferFloat;
import java.awt.image.DataBufferInt;
import java.awt.image.DataBufferShort;
import java.awt.image.DataBufferUShort;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;

/**
 * Conversions between AWT {@link BufferedImage}s and {@link RasterImage}s.
 */
public class RasterImages {

    private static final Logger log = LoggerFactory.getLogger(RasterImages.class);

    private RasterImages() {
    }

    public static RasterImage gray8(int width, int height, byte[] samples) {
        return RasterImage.of(width, height, PixelFormat.GRAY8, new DataBufferByte(samples, samples.length));
    }

    public static RasterImage rgb(int width, int height, byte[] samples) {
        return RasterImage.of(width, height, PixelFormat.RGB, new DataBufferByte(samples, samples.length));
    }

    /**
     * Allocate an empty buffer of the given {@link DataBuffer} type.
     */
    public static DataBuffer createBuffer(int dataType, int size) {
        switch (dataType) {
            case DataBuffer.TYPE_BYTE:
                return new DataBufferByte(size);
            case DataBuffer.TYPE_USHORT:
                return new DataBufferUShort(size);
            case DataBuffer.TYPE_SHORT:
                return new DataBufferShort(size);
            case DataBuffer.TYPE_INT:
                return new DataBufferInt(size);
            case DataBuffer.TYPE_FLOAT:
                return new DataBufferFloat(size);
            case DataBuffer.TYPE_DOUBLE:
                return new DataBufferDouble(size);
            default:
                throw new IllegalArgumentException("Unsupported data buffer type " + dataType);
        }
    }

    /**
     * Copy the samples of a decoded image into a new {@link RasterImage}, classifying its encoding.
     * <p/>
     * Samples are kept raw so polarity is resolved exactly once, later in the pipeline. When {@code whiteIsZeroTagged}
     * is set, integer gray samples the reader already flipped to BlackIsZero are flipped back, and inverted gray colour
     * tables (used for bilevel data) are unwrapped to the raw indices. Any encoding that can't be classified is wrapped as
     * {@link PixelFormat#FOREIGN}.
     *
     * @param image the decoded image
     * @param whiteIsZeroTagged whether the source's photometric tag declared WhiteIsZero
     */
    public static RasterImage fromBufferedImage(BufferedImage image, boolean whiteIsZeroTagged) {
        ColorModel cm = image.getColorModel();
        Raster raster = image.getRaster();
        int width = image.getWidth();
        int height = image.getHeight();
        int dataType = raster.getSampleModel().getDataType();
        int[] sampleSizes = raster.getSampleModel().getSampleSize();

        if (cm instanceof IndexColorModel) {
            return fromIndexed(image, (IndexColorModel) cm, whiteIsZeroTagged);
        }

        int csType = cm.getColorSpace().getType();
        int components = cm.getNumComponents();
        boolean alpha = cm.hasAlpha();
        boolean eightBit = allEqual(sampleSizes, 8) && raster.getNumBands() == components;

        if (csType == ColorSpace.TYPE_GRAY && components == 1 && raster.getNumBands() == 1) {
            if (dataType == DataBuffer.TYPE_BYTE && sampleSizes[0] == 8) {
                DataBufferByte samples = copyBytes(raster, width, height);
                if (whiteIsZeroTagged) {
                    complement(samples, 8);
                }
                return RasterImage.of(width, height, PixelFormat.GRAY8, samples);
            }
            switch (dataType) {
                case DataBuffer.TYPE_USHORT:
                case DataBuffer.TYPE_SHORT: {
                    DataBuffer samples = copyInts(raster, width, height, dataType);
                    if (whiteIsZeroTagged) {
                        complement(samples, 16);
                    }
                    return RasterImage.of(width, height, PixelFormat.grayWide(16, false), samples);
                }
                case DataBuffer.TYPE_INT: {
                    DataBuffer samples = copyInts(raster, width, height, dataType);
                    if (whiteIsZeroTagged) {
                        complement(samples, 32);
                    }
                    return RasterImage.of(width, height, PixelFormat.grayWide(32, false), samples);
                }
                case DataBuffer.TYPE_FLOAT:
                    float[] floats = raster.getPixels(raster.getMinX(), raster.getMinY(), width, height, (float[]) null);
                    return RasterImage.of(width, height, PixelFormat.grayWide(32, true), new DataBufferFloat(floats, floats.length));
                case DataBuffer.TYPE_DOUBLE:
                    double[] doubles = raster.getPixels(raster.getMinX(), raster.getMinY(), width, height, (double[]) null);
                    return RasterImage.of(width, height, PixelFormat.grayWide(64, true), new DataBufferDouble(doubles, doubles.length));
                default:
                    break;
            }
        } else if (csType == ColorSpace.TYPE_GRAY && components == 2 && alpha && eightBit) {
            DataBufferByte samples = copyBytes(raster, width, height);
            if (cm.isAlphaPremultiplied()) {
                unpremultiply(samples.getData(), 2);
            }
            return RasterImage.of(width, height, PixelFormat.GRAY_ALPHA, samples);
        } else if (csType == ColorSpace.TYPE_RGB && eightBit) {
            if (components == 3 && !alpha) {
                return RasterImage.of(width, height, PixelFormat.RGB, copyBytes(raster, width, height));
            }
            if (components == 4 && alpha) {
                DataBufferByte samples = copyBytes(raster, width, height);
                if (cm.isAlphaPremultiplied()) {
                    unpremultiply(samples.getData(), 4);
                }
                return RasterImage.of(width, height, PixelFormat.RGBA, samples);
            }
        } else if (csType == ColorSpace.TYPE_CMYK && components == 4 && !alpha && eightBit) {
            return RasterImage.of(width, height, PixelFormat.CMYK, copyBytes(raster, width, height));
        } else if (csType == ColorSpace.TYPE_YCbCr && components == 3 && !alpha && eightBit) {
            return RasterImage.of(width, height, PixelFormat.YCBCR, copyBytes(raster, width, height));
        }

        log.debug("No direct mapping for colour model {} with sample sizes {}, keeping decoded image", cm, sampleSizes);
        return RasterImage.foreign(image);
    }

    private static RasterImage fromIndexed(BufferedImage image, IndexColorModel icm, boolean whiteIsZeroTagged) {
        int width = image.getWidth();
        int height = image.getHeight();
        int mapSize = icm.getMapSize();
        if (mapSize > 256) {
            return RasterImage.foreign(image);
        }
        int[] argb = new int[mapSize];
        icm.getRGBs(argb);

        DataBufferByte indices = copyBytes(image.getRaster(), width, height);
        boolean ascending = isGrayRamp(argb, true);
        boolean descending = isGrayRamp(argb, false);

        if (mapSize == 2 && (ascending || (descending && whiteIsZeroTagged))) {
            return RasterImage.of(width, height, PixelFormat.BILEVEL, indices);
        }
        if (mapSize == 256 && (ascending || (descending && whiteIsZeroTagged))) {
            return RasterImage.of(width, height, PixelFormat.GRAY8, indices);
        }
        return RasterImage.palette(width, height, indices, argb);
    }

    static boolean isGrayRamp(int[] argb, boolean ascending) {
        int n = argb.length;
        if (n < 2) {
            return false;
        }
        for (int i = 0; i < n; i++) {
            int expected = (int) Math.round(i * 255.0 / (n - 1));
            if (!ascending) {
                expected = 255 - expected;
            }
            int c = argb[i];
            int a = (c >>> 24) & 0xFF;
            int r = (c >> 16) & 0xFF;
            int g = (c >> 8) & 0xFF;
            int b = c & 0xFF;
            if (a != 255 || r != expected || g != expected || b != expected) {
                return false;
            }
        }
        return true;
    }

    /**
     * Integer gray readers hand WhiteIsZero data back already flipped to BlackIsZero ({@code max - v}); flipping the
     * copy again restores the stored samples. Floating point samples are left as decoded.
     */
    private static void complement(DataBuffer samples, int bits) {
        for (int i = 0, n = samples.getSize(); i < n; i++) {
            samples.setElem(i, ~samples.getElem(i) & (int) ((1L << bits) - 1));
        }
        log.trace("Restored {} stored WhiteIsZero samples of {} bits", samples.getSize(), bits);
    }

    private static boolean allEqual(int[] values, int expected) {
        for (int v : values) {
            if (v != expected) {
                return false;
            }
        }
        return true;
    }

    private static DataBufferByte copyBytes(Raster raster, int width, int height) {
        int[] pixels = raster.getPixels(raster.getMinX(), raster.getMinY(), width, height, (int[]) null);
        byte[] bytes = new byte[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            bytes[i] = (byte) pixels[i];
        }
        return new DataBufferByte(bytes, bytes.length);
    }

    private static DataBuffer copyInts(Raster raster, int width, int height, int dataType) {
        int[] pixels = raster.getPixels(raster.getMinX(), raster.getMinY(), width, height, (int[]) null);
        if (dataType == DataBuffer.TYPE_INT) {
            return new DataBufferInt(pixels, pixels.length);
        }
        DataBuffer buffer = createBuffer(dataType, pixels.length);
        for (int i = 0; i < pixels.length; i++) {
            buffer.setElem(i, pixels[i]);
        }
        return buffer;
    }

    private static void unpremultiply(byte[] samples, int channels) {
        for (int i = 0; i < samples.length; i += channels) {
            int a = samples[i + channels - 1] & 0xFF;
            for (int c = 0; c < channels - 1; c++) {
                int v = samples[i + c] & 0xFF;
                samples[i + c] = (byte) (a == 0 ? 0 : Math.min(255, Math.round(v * 255f / a)));
            }
        }
    }

    /**
     * Render an RGB {@link RasterImage} as a {@link BufferedImage#TYPE_INT_RGB} image for display or encoding.
     */
    public static BufferedImage toBufferedImage(RasterImage rgb) {
        Preconditions.checkArgument(rgb.getFormat().isKind(PixelFormat.Kind.RGB), "Expected an RGB image but got %s", rgb.getFormat());
        int width = rgb.getWidth();
        int height = rgb.getHeight();
        DataBuffer samples = rgb.getSamples();
        int[] packed = new int[width * height];
        for (int i = 0, s = 0; i < packed.length; i++, s += 3) {
            packed[i] = (samples.getElem(s) << 16) | (samples.getElem(s + 1) << 8) | samples.getElem(s + 2);
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, packed, 0, width);
        return image;
    }
}
