package au.org.ala.imagedate.util;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class DefaultImageReaderSelectionStrategyTest {

    private static List<ImageReader> jpegReaders() {
        List<ImageReader> readers = new ArrayList<>();
        ImageIO.getImageReadersByFormatName("jpeg").forEachRemaining(readers::add);
        return readers;
    }

    @Test
    public void testPrefersTwelveMonkeys() {
        List<ImageReader> readers = jpegReaders();
        // make sure the preferred reader isn't simply the first one
        Collections.reverse(readers);

        ImageReader selected = DefaultImageReaderSelectionStrategy.INSTANCE.selectImageReader(readers);

        assertTrue(selected.getClass().getName(), selected.getClass().getName().contains("twelvemonkeys"));
    }

    @Test
    public void testFallsBackToFirstReader() {
        List<ImageReader> readers = jpegReaders();

        ImageReader selected = new DefaultImageReaderSelectionStrategy("no.such.vendor").selectImageReader(readers);

        assertSame(readers.get(0), selected);
    }

    @Test
    public void testNoCandidates() {
        assertNull(DefaultImageReaderSelectionStrategy.INSTANCE.selectImageReader(Collections.emptyIterator()));
        assertNull(DefaultImageReaderSelectionStrategy.INSTANCE.selectImageReader((java.util.Iterator<ImageReader>) null));
    }
}
