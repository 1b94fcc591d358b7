package energyprogress.etl.jobs;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Result of one job execution, handed to the job store for finalization.
 *
 * @param succeeded
 *            true to complete the job, false to fail it
 * @param metadata
 *            output references merged into the job's metadata (never null)
 * @param errorMessage
 *            human-readable cause; non-null iff {@code succeeded} is false
 */
public record JobOutcome(boolean succeeded, Map<String, Object> metadata, String errorMessage) {

    public JobOutcome {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata));
        if (succeeded && errorMessage != null) {
            throw new IllegalArgumentException("Successful outcome cannot carry an error message");
        }
        if (!succeeded && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("Failed outcome requires an error message");
        }
    }

    public static JobOutcome success(Map<String, Object> metadata) {
        return new JobOutcome(true, metadata, null);
    }

    public static JobOutcome failure(String errorMessage) {
        return new JobOutcome(false, Map.of(), errorMessage);
    }

    public static JobOutcome failure(String errorMessage, Map<String, Object> metadata) {
        return new JobOutcome(false, metadata, errorMessage);
    }
}
