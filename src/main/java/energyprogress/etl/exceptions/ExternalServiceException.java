package energyprogress.etl.exceptions;

/**
 * Exception thrown when a downstream service (imagery provider, object storage, relational store) is unreachable or
 * returns an error.
 *
 * <p>
 * {@code statusCode} carries the HTTP status of the failed call when one was received, or {@code -1} for transport
 * failures.
 */
public class ExternalServiceException extends RuntimeException {

    private final String service;
    private final int statusCode;

    public ExternalServiceException(String service, String message) {
        this(service, message, -1, null);
    }

    public ExternalServiceException(String service, String message, Throwable cause) {
        this(service, message, -1, cause);
    }

    public ExternalServiceException(String service, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.service = service;
        this.statusCode = statusCode;
    }

    public String getService() {
        return service;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
