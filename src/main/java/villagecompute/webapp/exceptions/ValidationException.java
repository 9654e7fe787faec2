package villagecompute.webapp.exceptions;

/**
 * Exception thrown when input validation fails (e.g., unknown two-factor provider, missing selection).
 *
 * <p>
 * Extends RuntimeException per project standards. Typically mapped to HTTP 400 Bad Request in REST resources.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
