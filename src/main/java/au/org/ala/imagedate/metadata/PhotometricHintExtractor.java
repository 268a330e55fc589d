package au.org.ala.imagedate.metadata;

import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Builds a {@link PhotometricHint} from a {@link TagLookup}. Missing or malformed tags never fail; they resolve to the
 * defaults declared on {@link PhotometricHint}.
 */
public class PhotometricHintExtractor {

    private static final Logger log = LoggerFactory.getLogger(PhotometricHintExtractor.class);

    public static final int TAG_ORIENTATION = TiffTagConstants.TIFF_TAG_ORIENTATION.tag;
    public static final int TAG_PHOTOMETRIC_INTERPRETATION = TiffTagConstants.TIFF_TAG_PHOTOMETRIC_INTERPRETATION.tag;
    public static final int TAG_MIN_SAMPLE_VALUE = TiffTagConstants.TIFF_TAG_MIN_SAMPLE_VALUE.tag;
    public static final int TAG_MAX_SAMPLE_VALUE = TiffTagConstants.TIFF_TAG_MAX_SAMPLE_VALUE.tag;

    public static final int PHOTOMETRIC_WHITE_IS_ZERO = 0;

    public PhotometricHint extract(TagLookup tags) {
        Orientation orientation = readOrientation(tags);
        boolean whiteIsZero = isWhiteIsZero(tags);

        OptionalDouble min = readDouble(tags, TAG_MIN_SAMPLE_VALUE);
        OptionalDouble max = readDouble(tags, TAG_MAX_SAMPLE_VALUE);
        PhotometricHint hint;
        if (min.isPresent() && max.isPresent()) {
            hint = PhotometricHint.of(orientation, whiteIsZero, min.getAsDouble(), max.getAsDouble());
        } else {
            hint = PhotometricHint.of(orientation, whiteIsZero);
        }
        log.debug("Photometric hint: {}", hint);
        return hint;
    }

    public boolean isWhiteIsZero(TagLookup tags) {
        OptionalInt photometric = readInt(tags, TAG_PHOTOMETRIC_INTERPRETATION);
        return photometric.isPresent() ? photometric.getAsInt() == PHOTOMETRIC_WHITE_IS_ZERO : PhotometricHint.DEFAULT_WHITE_IS_ZERO;
    }

    private Orientation readOrientation(TagLookup tags) {
        OptionalInt code = readInt(tags, TAG_ORIENTATION);
        return code.isPresent() ? Orientation.fromExifOrientation(code.getAsInt()) : PhotometricHint.DEFAULT_ORIENTATION;
    }

    private static OptionalInt readInt(TagLookup tags, int tagCode) {
        OptionalDouble value = readDouble(tags, tagCode);
        if (value.isPresent() && value.getAsDouble() == Math.rint(value.getAsDouble())) {
            return OptionalInt.of((int) value.getAsDouble());
        }
        return OptionalInt.empty();
    }

    private static OptionalDouble readDouble(TagLookup tags, int tagCode) {
        Optional<Object> value;
        try {
            value = tags.scalar(tagCode);
        } catch (RuntimeException e) {
            log.debug("Tag {} could not be read", tagCode, e);
            return OptionalDouble.empty();
        }
        if (value.isEmpty()) {
            return OptionalDouble.empty();
        }
        Object v = value.get();
        if (v instanceof Number) {
            return OptionalDouble.of(((Number) v).doubleValue());
        }
        try {
            return OptionalDouble.of(Double.parseDouble(v.toString().trim()));
        } catch (NumberFormatException e) {
            log.debug("Tag {} value '{}' is not numeric", tagCode, v);
            return OptionalDouble.empty();
        }
    }
}
