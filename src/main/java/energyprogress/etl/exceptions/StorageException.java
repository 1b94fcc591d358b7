package energyprogress.etl.exceptions;

/**
 * Object storage failure (bucket initialization, upload, download).
 */
public class StorageException extends ExternalServiceException {

    public StorageException(String message) {
        super("object-storage", message);
    }

    public StorageException(String message, Throwable cause) {
        super("object-storage", message, cause);
    }

    public StorageException(String message, int statusCode, Throwable cause) {
        super("object-storage", message, statusCode, cause);
    }
}
