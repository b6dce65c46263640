package uk.gegc.linguapractice.shared.exception;

/**
 * Thrown when caller input falls outside the accepted range of an operation.
 * Nothing is persisted when this is raised.
 */
public class ValidationException extends RuntimeException {

    private final String field;
    private final Object rejectedValue;

    public ValidationException(String message) {
        this(message, null, null);
    }

    public ValidationException(String message, String field, Object rejectedValue) {
        super(message);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
