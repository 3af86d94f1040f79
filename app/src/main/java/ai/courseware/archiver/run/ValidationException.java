package ai.courseware.archiver.run;

/**
 * Raised before any network activity when run inputs are invalid. Names the offending field.
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
