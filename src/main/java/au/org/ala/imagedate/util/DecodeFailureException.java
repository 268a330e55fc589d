package au.org.ala.imagedate.util;

/**
 * An image file could not be decoded by any available reader.
 */
public class DecodeFailureException extends Exception {

    private final String filename;

    public DecodeFailureException(String filename, String message) {
        super(String.format("Could not decode %s: %s", filename, message));
        this.filename = filename;
    }

    public DecodeFailureException(String filename, String message, Throwable cause) {
        super(String.format("Could not decode %s: %s", filename, message), cause);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
