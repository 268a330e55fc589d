package au.org.ala.imagedate.session;

import au.org.ala.imagedate.dates.DateWriteResult;

import java.util.Optional;

public class DateUpdateOutcome {

    public enum Status {
        EMPTY_INPUT,
        PARSE_FAILURE,
        TAGS_WRITTEN,
        SAVED_WITHOUT_TAGS,
        WRITE_FAILURE
    }

    private final Status _status;
    private final String _message;
    private final DateWriteResult _writeResult;

    private DateUpdateOutcome(Status status, String message, DateWriteResult writeResult) {
        _status = status;
        _message = message;
        _writeResult = writeResult;
    }

    static DateUpdateOutcome emptyInput() {
        return new DateUpdateOutcome(Status.EMPTY_INPUT,
                "Please enter a date (e.g., 'Nov 24', 'yesterday', '2 months ago').", null);
    }

    static DateUpdateOutcome parseFailure(String input) {
        return new DateUpdateOutcome(Status.PARSE_FAILURE, String.format("Could not understand '%s'", input), null);
    }

    static DateUpdateOutcome written(String filename, String input, DateWriteResult result) {
        switch (result.getStatus()) {
            case TAGS_WRITTEN:
                return new DateUpdateOutcome(Status.TAGS_WRITTEN,
                        String.format("%s - '%s' -> %s", filename, input, result.getMessage()), result);
            case SAVED_WITHOUT_TAGS:
                return new DateUpdateOutcome(Status.SAVED_WITHOUT_TAGS,
                        String.format("%s - '%s' -> %s", filename, input, result.getMessage()), result);
            default:
                return new DateUpdateOutcome(Status.WRITE_FAILURE, result.getMessage(), result);
        }
    }

    public Status getStatus() {
        return _status;
    }

    public boolean isSuccess() {
        return _status == Status.TAGS_WRITTEN || _status == Status.SAVED_WITHOUT_TAGS;
    }

    public String getMessage() {
        return _message;
    }

    public Optional<DateWriteResult> getWriteResult() {
        return Optional.ofNullable(_writeResult);
    }
}
