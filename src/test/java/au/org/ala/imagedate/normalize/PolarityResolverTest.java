package au.org.ala.imagedate.normalize;

import au.org.ala.imagedate.metadata.Orientation;
import au.org.ala.imagedate.metadata.PhotometricHint;
import au.org.ala.imagedate.raster.PixelFormat;
import au.org.ala.imagedate.raster.RasterImage;
import au.org.ala.imagedate.raster.RasterImages;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.awt.image.DataBufferByte;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class PolarityResolverTest {

    private static final PhotometricHint WHITE_IS_ZERO = PhotometricHint.of(Orientation.Normal, true);

    private final PolarityResolver resolver = new PolarityResolver();

    @Test
    public void testInvertsGray() {
        RasterImage image = RasterImages.gray8(2, 1, new byte[] {0, 40});

        RasterImage result = resolver.resolve(image, WHITE_IS_ZERO);

        assertSame(image, result);
        assertEquals(255, result.getSample(0, 0, 0));
        assertEquals(215, result.getSample(1, 0, 0));
    }

    @Test
    public void testInvertsRgb() {
        RasterImage image = RasterImages.rgb(1, 1, new byte[] {0, (byte) 128, (byte) 255});

        resolver.resolve(image, WHITE_IS_ZERO);

        assertEquals(255, image.getSample(0, 0, 0));
        assertEquals(127, image.getSample(0, 0, 1));
        assertEquals(0, image.getSample(0, 0, 2));
    }

    @Test
    public void testBlackIsZeroUntouched() {
        RasterImage image = RasterImages.gray8(1, 1, new byte[] {40});

        resolver.resolve(image, PhotometricHint.DEFAULT);

        assertEquals(40, image.getSample(0, 0, 0));
    }

    @Test
    public void testOtherFormatsUntouched() {
        byte[] samples = {10, 20, 30, 40};
        RasterImage rgba = RasterImage.of(1, 1, PixelFormat.RGBA, new DataBufferByte(samples, samples.length));

        resolver.resolve(rgba, WHITE_IS_ZERO);

        assertEquals(10, rgba.getSample(0, 0, 0));
        assertFalse(PolarityResolver.isInvertible(PixelFormat.RGBA));
        assertFalse(PolarityResolver.isInvertible(PixelFormat.grayWide(16, false)));
        assertTrue(PolarityResolver.isInvertible(PixelFormat.GRAY8));
        assertTrue(PolarityResolver.isInvertible(PixelFormat.RGB));
    }
}
