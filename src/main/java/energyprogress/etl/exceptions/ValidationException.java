package energyprogress.etl.exceptions;

/**
 * Exception thrown when job input fails validation (e.g., missing raster key, malformed month, unknown job type).
 *
 * <p>
 * Extends RuntimeException per project standards. A job failing with this exception is marked failed before any side
 * effect (download, upload, upsert) takes place.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
