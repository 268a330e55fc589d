package au.org.ala.imagedate.util;

import javax.imageio.ImageReader;
import java.util.Iterator;

/**
 * Picks one {@link ImageReader} out of the candidates ImageIO offers for an input.
 */
public interface ImageReaderSelectionStrategy {

    default ImageReader selectImageReader(Iterable<ImageReader> candidates) {
        return selectImageReader(candidates.iterator());
    }

    /**
     * @return the chosen reader, or null if there are no candidates
     */
    ImageReader selectImageReader(Iterator<ImageReader> candidates);

}
