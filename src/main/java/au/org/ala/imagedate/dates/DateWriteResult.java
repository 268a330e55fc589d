package au.org.ala.imagedate.dates;

import com.google.common.base.MoreObjects;

/**
 * What {@link ImageDateWriter} managed to do to a file.
 */
public class DateWriteResult {

    public enum Status {
        /** The date tags were written and the rest of the metadata kept. */
        TAGS_WRITTEN,
        /** The tags couldn't be written; the image was saved again without any metadata. */
        SAVED_WITHOUT_TAGS,
        FAILED;

        public boolean isSuccess() {
            return this != FAILED;
        }
    }

    private final Status status;
    private final String dateStamp;
    private final String message;

    private DateWriteResult(Status status, String dateStamp, String message) {
        this.status = status;
        this.dateStamp = dateStamp;
        this.message = message;
    }

    public static DateWriteResult tagsWritten(String dateStamp) {
        return new DateWriteResult(Status.TAGS_WRITTEN, dateStamp, "Date updated to " + dateStamp);
    }

    public static DateWriteResult savedWithoutTags(String dateStamp, String reason) {
        return new DateWriteResult(Status.SAVED_WITHOUT_TAGS, dateStamp,
                "Image saved without date tags (" + reason + ")");
    }

    public static DateWriteResult failed(String dateStamp, String reason) {
        return new DateWriteResult(Status.FAILED, dateStamp, "Error updating image: " + reason);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }

    public String getDateStamp() {
        return dateStamp;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("status", status)
                .add("dateStamp", dateStamp)
                .add("message", message)
                .toString();
    }
}
