package energyprogress.etl.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching pipeline logs with job and trace context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier for distributed tracing</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code job_id} - Processing job UUID (only during job execution)</li>
 * <li>{@code job_type} - Persisted job type code, e.g. {@code etl_processing}</li>
 * <li>{@code area_id} - Area the job works on</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the job dispatcher:</b>
 *
 * <pre>
 * LoggingConfig.setJobContext(job.id, job.jobType, job.areaId);
 * LoggingConfig.enrichWithTraceContext();
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Worker threads are reused
 * across jobs, so MDC must be cleared at the end of every job.
 */
public final class LoggingConfig {

    /**
     * OpenTelemetry trace identifier (hexadecimal string, 32 characters).
     */
    public static final String MDC_TRACE_ID = "trace_id";

    /**
     * OpenTelemetry span identifier (hexadecimal string, 16 characters).
     */
    public static final String MDC_SPAN_ID = "span_id";

    /**
     * Processing job UUID.
     */
    public static final String MDC_JOB_ID = "job_id";

    /**
     * Persisted job type code.
     */
    public static final String MDC_JOB_TYPE = "job_type";

    public static final String MDC_AREA_ID = "area_id";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. If no valid span is active the
     * fields are set to empty strings to keep a consistent log structure.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * Sets job identification fields for the current thread.
     *
     * @param jobId
     *            processing job id
     * @param jobType
     *            persisted job type code
     * @param areaId
     *            area of interest, may be null
     */
    public static void setJobContext(Object jobId, String jobType, Long areaId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
        if (jobType != null) {
            MDC.put(MDC_JOB_TYPE, jobType);
        }
        if (areaId != null) {
            MDC.put(MDC_AREA_ID, areaId.toString());
        }
    }

    /**
     * Clears all pipeline MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_JOB_TYPE);
        MDC.remove(MDC_AREA_ID);
    }
}
