package energyprogress.etl.exceptions;

/**
 * Exception thrown when input data is present but unusable (no valid pixels inside the area, unreadable raster).
 *
 * <p>
 * Kept distinct from {@link ExternalServiceException} so operators can tell bad imagery apart from an outage.
 */
public class DataQualityException extends RuntimeException {

    public DataQualityException(String message) {
        super(message);
    }

    public DataQualityException(String message, Throwable cause) {
        super(message, cause);
    }
}
