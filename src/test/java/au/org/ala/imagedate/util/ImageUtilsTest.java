package au.org.ala.imagedate.util;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.awt.image.BufferedImage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

@RunWith(JUnit4.class)
public class ImageUtilsTest {

    @Test
    public void testShrinksToFit() {
        BufferedImage wide = new BufferedImage(3600, 1000, BufferedImage.TYPE_INT_RGB);

        BufferedImage scaled = ImageUtils.scaleToFit(wide, 1800, 1300);

        assertEquals(1800, scaled.getWidth());
        assertEquals(500, scaled.getHeight());
    }

    @Test
    public void testHeightBound() {
        BufferedImage tall = new BufferedImage(1000, 2600, BufferedImage.TYPE_INT_RGB);

        BufferedImage scaled = ImageUtils.scaleToFit(tall, 1800, 1300);

        assertEquals(500, scaled.getWidth());
        assertEquals(1300, scaled.getHeight());
    }

    @Test
    public void testNeverEnlarges() {
        BufferedImage small = new BufferedImage(200, 100, BufferedImage.TYPE_INT_RGB);

        assertSame(small, ImageUtils.scaleToFit(small, 1800, 1300));
    }
}
