package au.org.ala.imagedate.raster;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.WritableRaster;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class RasterImagesTest {

    @Test
    public void testGrayByteImage() {
        BufferedImage image = new BufferedImage(3, 2, BufferedImage.TYPE_BYTE_GRAY);
        image.getRaster().setSample(1, 1, 0, 200);

        RasterImage raster = RasterImages.fromBufferedImage(image, false);

        assertEquals(PixelFormat.GRAY8, raster.getFormat());
        assertEquals(3, raster.getWidth());
        assertEquals(2, raster.getHeight());
        assertEquals(200, raster.getSample(1, 1, 0));
        assertEquals(0, raster.getSample(0, 0, 0));
    }

    @Test
    public void testSixteenBitGrayIsWide() {
        BufferedImage image = new BufferedImage(2, 2, BufferedImage.TYPE_USHORT_GRAY);
        image.getRaster().setSample(1, 0, 0, 40000);

        RasterImage raster = RasterImages.fromBufferedImage(image, false);

        assertEquals(PixelFormat.grayWide(16, false), raster.getFormat());
        assertEquals(DataBuffer.TYPE_USHORT, raster.getSamples().getDataType());
        assertEquals(40000, raster.getSamples().getElem(1));
    }

    @Test
    public void testWhiteIsZeroGrayRestoresStoredSamples() {
        // what the reader hands back for stored samples 0 and 200
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_GRAY);
        image.getRaster().setSample(0, 0, 0, 255);
        image.getRaster().setSample(1, 0, 0, 55);

        RasterImage raster = RasterImages.fromBufferedImage(image, true);

        assertEquals(PixelFormat.GRAY8, raster.getFormat());
        assertEquals(0, raster.getSample(0, 0, 0));
        assertEquals(200, raster.getSample(1, 0, 0));
        assertEquals(255, RasterImages.fromBufferedImage(image, false).getSample(0, 0, 0));
    }

    @Test
    public void testWhiteIsZeroSixteenBitRestoresStoredSamples() {
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_USHORT_GRAY);
        image.getRaster().setSample(0, 0, 0, 64535);
        image.getRaster().setSample(1, 0, 0, 60535);

        RasterImage raster = RasterImages.fromBufferedImage(image, true);

        assertEquals(PixelFormat.grayWide(16, false), raster.getFormat());
        assertEquals(1000, raster.getSamples().getElem(0));
        assertEquals(5000, raster.getSamples().getElem(1));
    }

    @Test
    public void testRgbLayouts() {
        BufferedImage bgr = new BufferedImage(1, 1, BufferedImage.TYPE_3BYTE_BGR);
        bgr.setRGB(0, 0, 0x102030);
        RasterImage fromBgr = RasterImages.fromBufferedImage(bgr, false);
        assertEquals(PixelFormat.RGB, fromBgr.getFormat());
        assertEquals(0x10, fromBgr.getSample(0, 0, 0));
        assertEquals(0x20, fromBgr.getSample(0, 0, 1));
        assertEquals(0x30, fromBgr.getSample(0, 0, 2));

        BufferedImage packed = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
        packed.setRGB(0, 0, 0x102030);
        assertEquals(PixelFormat.RGB, RasterImages.fromBufferedImage(packed, false).getFormat());
    }

    @Test
    public void testArgbIsRgba() {
        BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, 0x80FF0000);

        RasterImage raster = RasterImages.fromBufferedImage(image, false);

        assertEquals(PixelFormat.RGBA, raster.getFormat());
        assertEquals(255, raster.getSample(0, 0, 0));
        assertEquals(0, raster.getSample(0, 0, 1));
        assertEquals(0x80, raster.getSample(0, 0, 3));
    }

    @Test
    public void testBinaryImageIsBilevel() {
        BufferedImage image = new BufferedImage(4, 1, BufferedImage.TYPE_BYTE_BINARY);
        image.getRaster().setSample(2, 0, 0, 1);

        RasterImage raster = RasterImages.fromBufferedImage(image, false);

        assertEquals(PixelFormat.BILEVEL, raster.getFormat());
        assertEquals(0, raster.getSamples().getElem(1));
        assertEquals(1, raster.getSamples().getElem(2));
    }

    @Test
    public void testInvertedGrayRampOnlyUnwrappedForWhiteIsZero() {
        byte[] ramp = new byte[256];
        for (int i = 0; i < 256; i++) {
            ramp[i] = (byte) (255 - i);
        }
        IndexColorModel icm = new IndexColorModel(8, 256, ramp, ramp, ramp);
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_INDEXED, icm);
        WritableRaster wr = image.getRaster();
        wr.setSample(0, 0, 0, 10);
        wr.setSample(1, 0, 0, 250);

        RasterImage whiteIsZero = RasterImages.fromBufferedImage(image, true);
        assertEquals(PixelFormat.GRAY8, whiteIsZero.getFormat());
        assertEquals(10, whiteIsZero.getSample(0, 0, 0));
        assertEquals(250, whiteIsZero.getSample(1, 0, 0));

        RasterImage untagged = RasterImages.fromBufferedImage(image, false);
        assertEquals(PixelFormat.PALETTE, untagged.getFormat());
        assertEquals(256, untagged.getPalette().length);
    }

    @Test
    public void testColourPalette() {
        byte[] r = {(byte) 255, 0, 0};
        byte[] g = {0, (byte) 255, 0};
        byte[] b = {0, 0, (byte) 255};
        IndexColorModel icm = new IndexColorModel(2, 3, r, g, b);
        BufferedImage image = new BufferedImage(3, 1, BufferedImage.TYPE_BYTE_BINARY, icm);
        image.getRaster().setSample(1, 0, 0, 2);

        RasterImage raster = RasterImages.fromBufferedImage(image, false);

        assertEquals(PixelFormat.PALETTE, raster.getFormat());
        assertEquals(2, raster.getSamples().getElem(1));
        assertEquals(0xFF0000FF, raster.getPalette()[2]);
    }

    @Test
    public void testUnknownLayoutIsForeign() {
        BufferedImage image = new BufferedImage(2, 3, BufferedImage.TYPE_USHORT_565_RGB);

        RasterImage raster = RasterImages.fromBufferedImage(image, false);

        assertEquals(PixelFormat.FOREIGN, raster.getFormat());
        assertSame(image, raster.getForeign());
        assertEquals(2, raster.getWidth());
        assertEquals(3, raster.getHeight());
    }

    @Test
    public void testIsGrayRamp() {
        assertTrue(RasterImages.isGrayRamp(new int[] {0xFF000000, 0xFFFFFFFF}, true));
        assertFalse(RasterImages.isGrayRamp(new int[] {0xFF000000, 0xFFFFFFFF}, false));
        assertTrue(RasterImages.isGrayRamp(new int[] {0xFFFFFFFF, 0xFF000000}, false));
        assertFalse(RasterImages.isGrayRamp(new int[] {0xFF000000, 0xFFFF0000}, true));
        assertFalse(RasterImages.isGrayRamp(new int[] {0xFF000000}, true));
    }

    @Test
    public void testToBufferedImage() {
        RasterImage rgb = RasterImages.rgb(2, 1, new byte[] {1, 2, 3, (byte) 200, (byte) 201, (byte) 202});

        BufferedImage image = RasterImages.toBufferedImage(rgb);

        assertEquals(BufferedImage.TYPE_INT_RGB, image.getType());
        assertEquals(0x010203, image.getRGB(0, 0) & 0xFFFFFF);
        assertEquals(0xC8C9CA, image.getRGB(1, 0) & 0xFFFFFF);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testShortBufferRejected() {
        RasterImages.rgb(2, 2, new byte[3]);
    }
}
