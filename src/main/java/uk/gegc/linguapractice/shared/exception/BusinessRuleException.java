package uk.gegc.linguapractice.shared.exception;

/**
 * Exception thrown when an operation is not allowed in the current state of an aggregate,
 * e.g. completing a session that is already finished.
 */
public class BusinessRuleException extends RuntimeException {

    private final String currentState;
    private final String attemptedAction;

    public BusinessRuleException(String message) {
        this(message, null, null);
    }

    public BusinessRuleException(String message, String currentState, String attemptedAction) {
        super(message);
        this.currentState = currentState;
        this.attemptedAction = attemptedAction;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getAttemptedAction() {
        return attemptedAction;
    }
}
