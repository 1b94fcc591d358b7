package energyprogress.etl.services;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.jboss.logging.Logger;

import energyprogress.etl.data.models.ProcessingJob;
import energyprogress.etl.jobs.FailureCategory;
import energyprogress.etl.jobs.JobHandler;
import energyprogress.etl.jobs.JobOutcome;
import energyprogress.etl.jobs.JobType;
import energyprogress.etl.observability.LoggingConfig;
import energyprogress.etl.observability.PipelineMetrics;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

/**
 * Routes claimed jobs to their {@link JobHandler} and converts every result into a {@link JobOutcome}.
 *
 * <p>
 * This is the per-job error boundary: handler exceptions never escape {@link #execute(ProcessingJob)}. They become a
 * failed outcome whose error message starts with the {@link FailureCategory} prefix, so one bad job cannot abort a poll
 * cycle.
 *
 * <p>
 * Each execution runs inside a {@code job.execute} span with {@code job.id}, {@code job.type} and
 * {@code job.area_id} attributes, and with job/trace MDC fields set for the handler's logs.
 *
 * @see JobHandler for handler contract
 * @see JobType for supported job types
 */
@ApplicationScoped
public class JobDispatchService {

    private static final Logger LOG = Logger.getLogger(JobDispatchService.class);

    /**
     * Registry mapping JobType to JobHandler, built once at startup.
     */
    private final Map<JobType, JobHandler> handlerRegistry;

    @Inject
    Tracer tracer;

    @Inject
    PipelineMetrics metrics;

    @Inject
    public JobDispatchService(Instance<JobHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        LOG.infof("Initialized JobDispatchService with %d registered handlers", handlerRegistry.size());
    }

    /**
     * Builds a dispatcher over an explicit handler list, outside of CDI.
     */
    public JobDispatchService(Iterable<JobHandler> handlers, Tracer tracer, PipelineMetrics metrics) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        this.tracer = tracer;
        this.metrics = metrics;
    }

    /**
     * Discovers all {@link JobHandler} beans and builds a type to handler map.
     *
     * @throws IllegalStateException
     *             if duplicate handlers register for the same JobType
     */
    private static Map<JobType, JobHandler> buildHandlerRegistry(Iterable<JobHandler> handlers) {
        Map<JobType, JobHandler> registry = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for JobType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for JobType.%s", handler.getClass().getSimpleName(), type);
        }
        return registry;
    }

    /**
     * Executes a claimed job by dispatching to its registered handler.
     *
     * @param job
     *            a job in the {@code running} state
     * @return the outcome to record; never null
     */
    public JobOutcome execute(ProcessingJob job) {
        long start = System.nanoTime();
        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", String.valueOf(job.id))
                .setAttribute("job.type", String.valueOf(job.jobType))
                .setAttribute("job.area_id", job.areaId == null ? -1L : job.areaId).startSpan();

        JobOutcome outcome;
        String errorCategory = null;
        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.setJobContext(job.id, job.jobType, job.areaId);
            LoggingConfig.enrichWithTraceContext();

            Optional<JobType> type = job.type();
            JobHandler handler = type.map(handlerRegistry::get).orElse(null);
            if (handler == null) {
                errorCategory = FailureCategory.VALIDATION.tag();
                outcome = JobOutcome.failure(FailureCategory.VALIDATION.message("Unknown job type: " + job.jobType));
                LOG.errorf("Job %s has unknown job type '%s'", job.id, job.jobType);
            } else {
                LOG.infof("Starting job %s (type: %s, area: %d)", job.id, job.jobType, job.areaId);
                outcome = handler.execute(job);
                if (outcome == null) {
                    throw new IllegalStateException("Handler " + handler.getClass().getSimpleName()
                            + " returned no outcome");
                }
                if (!outcome.succeeded()) {
                    errorCategory = "reported";
                    LOG.warnf("Job %s (type: %s) reported failure: %s", job.id, job.jobType, outcome.errorMessage());
                }
            }

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            span.recordException(e);
            errorCategory = FailureCategory.TIMEOUT.tag();
            outcome = JobOutcome.failure(FailureCategory.TIMEOUT.message("job interrupted"));
            LOG.warnf("Job %s (type: %s) interrupted during execution", job.id, job.jobType);

        } catch (Exception e) {
            span.recordException(e);
            FailureCategory category = FailureCategory.of(e);
            errorCategory = category.tag();
            outcome = JobOutcome.failure(FailureCategory.describe(e));
            if (category == FailureCategory.INTERNAL) {
                LOG.errorf(e, "Job %s (type: %s) failed unexpectedly", job.id, job.jobType);
            } else {
                LOG.errorf("Job %s (type: %s) failed: %s", job.id, job.jobType, outcome.errorMessage());
            }

        } finally {
            LoggingConfig.clearMDC();
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        if (outcome.succeeded()) {
            span.addEvent("job.completed");
            LOG.infof("Job %s (type: %s) completed in %dms", job.id, job.jobType, elapsed.toMillis());
        } else {
            span.addEvent("job.failed");
            span.setStatus(StatusCode.ERROR, outcome.errorMessage());
        }
        span.setAttribute("job.succeeded", outcome.succeeded());
        span.end();
        metrics.jobFinished(job.jobType, outcome.succeeded(), errorCategory, elapsed);
        return outcome;
    }

    /**
     * Whether a handler is registered for {@code type}.
     */
    public boolean supports(JobType type) {
        return handlerRegistry.containsKey(type);
    }
}
