package au.org.ala.imagedate.raster;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * The sample encoding of a {@link RasterImage}. Exactly one {@link Kind} is active for an image; wide gray
 * formats additionally carry their bit depth and whether samples are floating point.
 */
public final class PixelFormat {

    public enum Kind {
        BILEVEL(1),
        GRAY8(1),
        GRAY_WIDE(1),
        PALETTE(1),
        RGB(3),
        RGBA(4),
        GRAY_ALPHA(2),
        CMYK(4),
        YCBCR(3),
        /** A decoded image none of the other kinds describe, kept as the decoder produced it. */
        FOREIGN(0);

        private final int channels;

        Kind(int channels) {
            this.channels = channels;
        }

        public int getChannels() {
            return channels;
        }
    }

    public static final PixelFormat BILEVEL = new PixelFormat(Kind.BILEVEL, 1, false);
    public static final PixelFormat GRAY8 = new PixelFormat(Kind.GRAY8, 8, false);
    public static final PixelFormat PALETTE = new PixelFormat(Kind.PALETTE, 8, false);
    public static final PixelFormat RGB = new PixelFormat(Kind.RGB, 8, false);
    public static final PixelFormat RGBA = new PixelFormat(Kind.RGBA, 8, false);
    public static final PixelFormat GRAY_ALPHA = new PixelFormat(Kind.GRAY_ALPHA, 8, false);
    public static final PixelFormat CMYK = new PixelFormat(Kind.CMYK, 8, false);
    public static final PixelFormat YCBCR = new PixelFormat(Kind.YCBCR, 8, false);
    public static final PixelFormat FOREIGN = new PixelFormat(Kind.FOREIGN, 0, false);

    private final Kind kind;
    private final int bitDepth;
    private final boolean floatingPoint;

    private PixelFormat(Kind kind, int bitDepth, boolean floatingPoint) {
        this.kind = kind;
        this.bitDepth = bitDepth;
        this.floatingPoint = floatingPoint;
    }

    /**
     * @param bitDepth bits per sample, 16, 32 or 64
     * @param floatingPoint whether samples are IEEE floating point
     */
    public static PixelFormat grayWide(int bitDepth, boolean floatingPoint) {
        Preconditions.checkArgument(bitDepth > 8, "Wide gray needs more than 8 bits per sample, got %s", bitDepth);
        return new PixelFormat(Kind.GRAY_WIDE, bitDepth, floatingPoint);
    }

    public Kind getKind() {
        return kind;
    }

    public int getBitDepth() {
        return bitDepth;
    }

    public boolean isFloatingPoint() {
        return floatingPoint;
    }

    public int getChannels() {
        return kind.getChannels();
    }

    public boolean isKind(Kind other) {
        return kind == other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PixelFormat that = (PixelFormat) o;
        return bitDepth == that.bitDepth && floatingPoint == that.floatingPoint && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, bitDepth, floatingPoint);
    }

    @Override
    public String toString() {
        if (kind == Kind.GRAY_WIDE) {
            return String.format("GRAY_WIDE(%d%s)", bitDepth, floatingPoint ? ", float" : "");
        }
        return kind.name();
    }
}
