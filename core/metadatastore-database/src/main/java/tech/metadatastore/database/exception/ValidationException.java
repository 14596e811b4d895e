package tech.metadatastore.database.exception;

import java.util.Map;

/**
 * Exception thrown when a record field fails validation.
 * Always raised at construction time, before any storage call.
 */
public class ValidationException extends MetadataStoreException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message, null, Map.of("field", field));
        this.field = field;
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(message, cause, Map.of("field", field));
        this.field = field;
    }

    /**
     * Name of the persisted field that failed validation (e.g. "scan_id").
     */
    public String getField() {
        return field;
    }

    public static ValidationException missing(String field) {
        return new ValidationException(field, field + " is required");
    }

    public static ValidationException empty(String field) {
        return new ValidationException(field, field + " must not be empty");
    }

    public static ValidationException wrongType(String field, String expected, Object value) {
        return new ValidationException(field,
            field + " must be " + expected + " but was " + describe(value));
    }

    public static ValidationException malformedTimestamp(String field, Object value, Throwable cause) {
        return new ValidationException(field,
            field + " is not a valid timestamp: " + value, cause);
    }

    public static ValidationException negative(String field, long value) {
        return new ValidationException(field, field + " must not be negative but was " + value);
    }

    public static ValidationException endBeforeStart(Object start, Object end) {
        return new ValidationException("end_time",
            "end_time " + end + " is before start_time " + start);
    }

    public static ValidationException unknownField(String field) {
        return new ValidationException(field, "Unknown field: " + field);
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " (" + value + ")";
    }
}
