package energyprogress.etl.exceptions;

/**
 * Exception thrown when a referenced record is not found (e.g., area, processing job).
 *
 * <p>
 * Extends RuntimeException per project standards.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
