package au.org.ala.imagedate.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageReader;
import java.util.Iterator;

/**
 * Prefers readers from a given plug-in vendor (TwelveMonkeys by default, whose TIFF and JPEG readers cope with far more
 * sample layouts than the JDK's), otherwise the first candidate.
 */
public class DefaultImageReaderSelectionStrategy implements ImageReaderSelectionStrategy {

    private static final Logger log = LoggerFactory.getLogger(DefaultImageReaderSelectionStrategy.class);

    public static final String TWELVEMONKEYS = "twelvemonkeys";

    public static final DefaultImageReaderSelectionStrategy INSTANCE = new DefaultImageReaderSelectionStrategy(TWELVEMONKEYS);

    private final String preferredVendor;

    public DefaultImageReaderSelectionStrategy(String preferredVendor) {
        this.preferredVendor = preferredVendor;
    }

    public ImageReader selectImageReader(Iterator<ImageReader> candidates) {

        if (candidates == null) {
            return null;
        }

        ImageReader first = null;
        ImageReader preferred = null;
        while (candidates.hasNext()) {
            ImageReader reader = candidates.next();
            if (first == null) {
                first = reader;
            }
            if (preferredVendor != null && reader.getClass().getName().contains(preferredVendor)) {
                preferred = reader;
                break;
            }
        }

        ImageReader selected = preferred != null ? preferred : first;
        log.trace("Selected ImageReader: {}", selected != null ? selected.getClass().getName() : null);
        return selected;
    }

}
