package au.org.ala.imagedate.normalize;

import au.org.ala.imagedate.raster.PixelFormat;
import au.org.ala.imagedate.raster.RasterImage;
import au.org.ala.imagedate.raster.RasterImages;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.awt.*;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

@RunWith(JUnit4.class)
public class ChannelCompositorTest {

    private final ChannelCompositor compositor = new ChannelCompositor();

    private static RasterImage image(int width, int height, PixelFormat format, int... samples) {
        byte[] bytes = new byte[samples.length];
        for (int i = 0; i < samples.length; i++) {
            bytes[i] = (byte) samples[i];
        }
        return RasterImage.of(width, height, format, new DataBufferByte(bytes, bytes.length));
    }

    private static void assertRgb(RasterImage image, int x, int y, int r, int g, int b) {
        assertEquals(PixelFormat.RGB, image.getFormat());
        assertEquals("red", r, image.getSample(x, y, 0));
        assertEquals("green", g, image.getSample(x, y, 1));
        assertEquals("blue", b, image.getSample(x, y, 2));
    }

    @Test
    public void testExpandPalette() throws Exception {
        byte[] indices = {0, 1, 5};
        RasterImage image = RasterImage.palette(3, 1, new DataBufferByte(indices, indices.length),
                new int[] {0xFF102030, 0xFFFFFF00});

        RasterImage rgb = compositor.expandPalette(image);

        assertRgb(rgb, 0, 0, 0x10, 0x20, 0x30);
        assertRgb(rgb, 1, 0, 255, 255, 0);
        assertRgb(rgb, 2, 0, 0, 0, 0);
    }

    @Test
    public void testFlattenAlpha() throws Exception {
        RasterImage image = image(3, 1, PixelFormat.RGBA,
                200, 10, 20, 0,
                200, 10, 20, 255,
                0, 0, 0, 128);

        RasterImage rgb = compositor.flattenAlpha(image);

        assertRgb(rgb, 0, 0, 255, 255, 255);
        assertRgb(rgb, 1, 0, 200, 10, 20);
        assertRgb(rgb, 2, 0, 127, 127, 127);
    }

    @Test
    public void testFlattenAlphaOverCustomBackground() throws Exception {
        RasterImage rgb = new ChannelCompositor(Color.BLUE).flattenAlpha(image(1, 1, PixelFormat.RGBA, 255, 255, 255, 0));

        assertRgb(rgb, 0, 0, 0, 0, 255);
    }

    @Test
    public void testFlattenGrayAlpha() throws Exception {
        RasterImage gray = compositor.flattenGrayAlpha(image(2, 1, PixelFormat.GRAY_ALPHA, 30, 0, 30, 255));

        assertEquals(PixelFormat.GRAY8, gray.getFormat());
        assertEquals(255, gray.getSample(0, 0, 0));
        assertEquals(30, gray.getSample(1, 0, 0));
    }

    @Test
    public void testConvertCmyk() throws Exception {
        RasterImage rgb = compositor.convertCmyk(image(3, 1, PixelFormat.CMYK,
                0, 0, 0, 0,
                255, 0, 0, 0,
                100, 50, 0, 200));

        assertRgb(rgb, 0, 0, 255, 255, 255);
        assertRgb(rgb, 1, 0, 0, 255, 255);
        assertRgb(rgb, 2, 0, 0, 5, 55);
    }

    @Test
    public void testConvertYCbCr() throws Exception {
        RasterImage rgb = compositor.convertYCbCr(image(2, 1, PixelFormat.YCBCR,
                128, 128, 128,
                255, 128, 255));

        assertRgb(rgb, 0, 0, 128, 128, 128);
        assertEquals(255, rgb.getSample(1, 0, 0));
        assertEquals(164, rgb.getSample(1, 0, 1));
        assertEquals(255, rgb.getSample(1, 0, 2));
    }

    @Test
    public void testExpandBilevel() throws Exception {
        RasterImage gray = compositor.expandBilevel(image(2, 1, PixelFormat.BILEVEL, 0, 1));

        assertEquals(0, gray.getSample(0, 0, 0));
        assertEquals(255, gray.getSample(1, 0, 0));
    }

    @Test
    public void testRenderForeign() throws Exception {
        BufferedImage foreign = new BufferedImage(2, 1, BufferedImage.TYPE_USHORT_565_RGB);
        foreign.setRGB(0, 0, 0xFF0000);
        foreign.setRGB(1, 0, 0x0000FF);

        RasterImage rgb = compositor.renderForeign(RasterImage.foreign(foreign));

        assertRgb(rgb, 0, 0, 255, 0, 0);
        assertRgb(rgb, 1, 0, 0, 0, 255);
    }

    @Test
    public void testToRgb() throws Exception {
        RasterImage rgb = compositor.toRgb(RasterImages.gray8(1, 1, new byte[] {77}));
        assertRgb(rgb, 0, 0, 77, 77, 77);

        assertSame(rgb, compositor.toRgb(rgb));
    }

    @Test(expected = UnsupportedConversionException.class)
    public void testWrongFormatRejected() throws Exception {
        compositor.convertCmyk(RasterImages.gray8(1, 1, new byte[] {0}));
    }

    @Test
    public void testBlankCanvas() {
        assertRgb(compositor.blankCanvas(2, 2), 1, 1, 255, 255, 255);
        assertRgb(new ChannelCompositor(new Color(1, 2, 3)).blankCanvas(1, 1), 0, 0, 1, 2, 3);
    }

    @Test
    public void testComposite() {
        assertEquals(255, ChannelCompositor.composite(0, 0, 255));
        assertEquals(200, ChannelCompositor.composite(200, 255, 0));
        assertEquals(127, ChannelCompositor.composite(0, 128, 255));
    }
}
