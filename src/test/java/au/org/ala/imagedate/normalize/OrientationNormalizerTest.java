package au.org.ala.imagedate.normalize;

import au.org.ala.imagedate.metadata.Orientation;
import au.org.ala.imagedate.raster.PixelFormat;
import au.org.ala.imagedate.raster.RasterImage;
import au.org.ala.imagedate.raster.RasterImages;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferUShort;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

@RunWith(JUnit4.class)
public class OrientationNormalizerTest {

    private static final byte A = 10;
    private static final byte B = 20;
    private static final byte C = 30;
    private static final byte D = 40;
    private static final byte E = 50;
    private static final byte F = 60;

    private final OrientationNormalizer normalizer = new OrientationNormalizer();

    // A B C
    // D E F
    private static RasterImage sample() {
        return RasterImages.gray8(3, 2, new byte[] {A, B, C, D, E, F});
    }

    private static byte[] samples(RasterImage image) {
        byte[] out = new byte[image.getPixelCount()];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) image.getSamples().getElem(i);
        }
        return out;
    }

    @Test
    public void testNormalIsUntouched() {
        RasterImage image = sample();
        assertSame(image, normalizer.apply(image, Orientation.Normal));
        assertSame(image, normalizer.apply(image, null));
    }

    @Test
    public void testMirrorAndRotate180() {
        assertArrayEquals(new byte[] {C, B, A, F, E, D}, samples(normalizer.apply(sample(), Orientation.FlipH)));
        assertArrayEquals(new byte[] {F, E, D, C, B, A}, samples(normalizer.apply(sample(), Orientation.Rotate180)));
        assertArrayEquals(new byte[] {D, E, F, A, B, C}, samples(normalizer.apply(sample(), Orientation.FlipV)));
    }

    @Test
    public void testQuarterTurnsSwapDimensions() {
        RasterImage clockwise = normalizer.apply(sample(), Orientation.Rotate270);
        assertEquals(2, clockwise.getWidth());
        assertEquals(3, clockwise.getHeight());
        assertArrayEquals(new byte[] {D, A, E, B, F, C}, samples(clockwise));

        RasterImage counterClockwise = normalizer.apply(sample(), Orientation.Rotate90);
        assertArrayEquals(new byte[] {C, F, B, E, A, D}, samples(counterClockwise));

        RasterImage transposed = normalizer.apply(sample(), Orientation.FlipVRotate90);
        assertArrayEquals(new byte[] {A, D, B, E, C, F}, samples(transposed));

        RasterImage transversed = normalizer.apply(sample(), Orientation.FlipHRotate90);
        assertArrayEquals(new byte[] {F, C, E, B, D, A}, samples(transversed));
    }

    @Test
    public void testMultiChannelAndWideSamples() {
        RasterImage rgb = RasterImages.rgb(2, 1, new byte[] {1, 2, 3, 4, 5, 6});
        RasterImage mirrored = normalizer.apply(rgb, Orientation.FlipH);
        assertEquals(4, mirrored.getSample(0, 0, 0));
        assertEquals(6, mirrored.getSample(0, 0, 2));
        assertEquals(1, mirrored.getSample(1, 0, 0));

        short[] wide = {1000, 2000};
        RasterImage gray16 = RasterImage.of(2, 1, PixelFormat.grayWide(16, false), new DataBufferUShort(wide, wide.length));
        RasterImage rotated = normalizer.apply(gray16, Orientation.Rotate90);
        assertEquals(PixelFormat.grayWide(16, false), rotated.getFormat());
        assertEquals(1, rotated.getWidth());
        assertEquals(2000, rotated.getSamples().getElem(0));
        assertEquals(1000, rotated.getSamples().getElem(1));
    }

    @Test
    public void testPaletteKeepsColourTable() {
        int[] palette = {0xFFFF0000, 0xFF00FF00};
        byte[] indices = {0, 1};
        RasterImage image = RasterImage.palette(2, 1, new java.awt.image.DataBufferByte(indices, indices.length), palette);

        RasterImage rotated = normalizer.apply(image, Orientation.Rotate270);

        assertEquals(PixelFormat.PALETTE, rotated.getFormat());
        assertSame(palette, rotated.getPalette());
        assertEquals(1, rotated.getWidth());
        assertEquals(2, rotated.getHeight());
    }

    @Test
    public void testForeignImageIsRotated() {
        BufferedImage foreign = new BufferedImage(5, 3, BufferedImage.TYPE_USHORT_565_RGB);

        RasterImage rotated = normalizer.apply(RasterImage.foreign(foreign), Orientation.Rotate270);

        assertEquals(PixelFormat.FOREIGN, rotated.getFormat());
        assertEquals(3, rotated.getWidth());
        assertEquals(5, rotated.getHeight());
    }
}
