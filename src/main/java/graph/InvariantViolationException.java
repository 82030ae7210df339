package graph;

/**
 * Raised when the suffix tree construction reaches a state its invariants rule out, for
 * example a missing edge under a canonical active point or an unset suffix link. These are
 * programming faults in the builder, never recoverable input errors.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
