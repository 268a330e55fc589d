package au.org.ala.imagedate.normalize;

/**
 * Thrown by a {@link ConversionStrategy} that can't handle the image it was given. The normalizer moves on to the next
 * strategy registered for the pixel format.
 */
public class UnsupportedConversionException extends Exception {

    public UnsupportedConversionException(String message) {
        super(message);
    }

    public UnsupportedConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
