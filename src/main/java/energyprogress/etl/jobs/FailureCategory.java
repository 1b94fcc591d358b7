package energyprogress.etl.jobs;

import java.util.concurrent.TimeoutException;

import energyprogress.etl.exceptions.DataQualityException;
import energyprogress.etl.exceptions.ExternalServiceException;
import energyprogress.etl.exceptions.ResourceNotFoundException;
import energyprogress.etl.exceptions.StorageException;
import energyprogress.etl.exceptions.ValidationException;

/**
 * Classifies per-job failures into the categories recorded in {@code error_message} and metrics.
 */
public enum FailureCategory {

    VALIDATION("validation", "Validation error"),
    STORAGE("storage", "Storage error"),
    EXTERNAL_SERVICE("external_service", "External service error"),
    DATA_QUALITY("data_quality", "Data quality error"),
    TIMEOUT("timeout", "Timeout"),
    INTERNAL("internal", "Internal error");

    private final String tag;
    private final String prefix;

    FailureCategory(String tag, String prefix) {
        this.tag = tag;
        this.prefix = prefix;
    }

    /**
     * Metric tag value.
     */
    public String tag() {
        return tag;
    }

    /**
     * Formats a human-readable error message, e.g. {@code "Storage error: Upload of 1/2023_01/8/1/2.png failed"}.
     */
    public String message(String detail) {
        return prefix + ": " + (detail == null || detail.isBlank() ? "no details" : detail);
    }

    public static FailureCategory of(Throwable error) {
        if (error instanceof ValidationException || error instanceof ResourceNotFoundException) {
            return VALIDATION;
        }
        if (error instanceof StorageException) {
            return STORAGE;
        }
        if (error instanceof ExternalServiceException) {
            return EXTERNAL_SERVICE;
        }
        if (error instanceof DataQualityException) {
            return DATA_QUALITY;
        }
        if (error instanceof TimeoutException) {
            return TIMEOUT;
        }
        return INTERNAL;
    }

    /**
     * Category-prefixed message for {@code error}. Internal errors include the exception type.
     */
    public static String describe(Throwable error) {
        FailureCategory category = of(error);
        if (category == INTERNAL) {
            return category.message(error.getClass().getSimpleName() + ": " + error.getMessage());
        }
        return category.message(error.getMessage());
    }
}
