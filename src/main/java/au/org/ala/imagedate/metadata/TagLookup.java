package au.org.ala.imagedate.metadata;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Optional;

/**
 * Read-only access to an image's tags by numeric (TIFF/EXIF) tag code.
 * <p/>
 * Implementations wrap whichever tag store a decoder produced; callers only ever see raw values, which may be
 * numbers, strings, arrays or collections.
 */
@FunctionalInterface
public interface TagLookup {

    TagLookup EMPTY = tagCode -> Optional.empty();

    /**
     * @param tagCode the numeric tag code, e.g. 262 for PhotometricInterpretation
     * @return the raw tag value or empty if the tag is not present
     */
    Optional<Object> lookup(int tagCode);

    /**
     * The tag value collapsed to a scalar: sequences yield their first element, empty sequences yield nothing.
     */
    default Optional<Object> scalar(int tagCode) {
        return lookup(tagCode).flatMap(TagLookup::firstElement);
    }

    static Optional<Object> firstElement(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0 ? Optional.ofNullable(Array.get(value, 0)) : Optional.empty();
        }
        if (value instanceof Collection) {
            Collection<?> c = (Collection<?>) value;
            return c.isEmpty() ? Optional.empty() : Optional.ofNullable(c.iterator().next());
        }
        return Optional.of(value);
    }
}
