package energyprogress.etl.observability;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.jboss.logging.Logger;

import energyprogress.etl.data.models.ProcessingJob;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Counters, timers and gauges for the job pipeline.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counters:</b> {@code pipeline.jobs.claimed}, {@code pipeline.jobs.completed{job_type}},
 * {@code pipeline.jobs.failed{job_type,error_category}}, {@code pipeline.cycles{result}}</li>
 * <li><b>Timers:</b> {@code pipeline.jobs.duration{job_type,status}}</li>
 * <li><b>Gauges:</b> {@code pipeline.jobs.by_status{status}} - refreshed at the end of every poll cycle; a growing
 * {@code running} count with no active cycle points at jobs orphaned by a process crash</li>
 * <li><b>Counters:</b> {@code raster.tiles.generated}, {@code imagery.exports{status}}</li>
 * </ul>
 *
 * <p>
 * Metrics are exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class PipelineMetrics {

    private static final Logger LOG = Logger.getLogger(PipelineMetrics.class);

    @Inject
    MeterRegistry registry;

    private final Map<ProcessingJob.Status, AtomicLong> statusCounts = new ConcurrentHashMap<>();

    public void jobClaimed() {
        Counter.builder("pipeline.jobs.claimed").register(registry).increment();
    }

    /**
     * Records a finished job.
     *
     * @param jobType
     *            persisted job type code
     * @param succeeded
     *            whether the job completed
     * @param errorCategory
     *            failure category tag, ignored for successes
     * @param duration
     *            wall-clock execution time
     */
    public void jobFinished(String jobType, boolean succeeded, String errorCategory, Duration duration) {
        String type = jobType == null ? "unknown" : jobType;
        if (succeeded) {
            Counter.builder("pipeline.jobs.completed").tag("job_type", type).register(registry).increment();
        } else {
            Counter.builder("pipeline.jobs.failed").tag("job_type", type)
                    .tag("error_category", errorCategory == null ? "unknown" : errorCategory).register(registry)
                    .increment();
        }
        Timer.builder("pipeline.jobs.duration").tag("job_type", type)
                .tag("status", succeeded ? "completed" : "failed").register(registry).record(duration);
    }

    /**
     * Counts a poll cycle by result ({@code processed}, {@code idle}, {@code skipped}, {@code storage_unavailable},
     * {@code error}).
     */
    public void cycle(String result) {
        Counter.builder("pipeline.cycles").tag("result", result).register(registry).increment();
    }

    /**
     * Refreshes the per-status job gauges.
     */
    public void updateStatusCounts(Map<ProcessingJob.Status, Long> counts) {
        for (Map.Entry<ProcessingJob.Status, Long> entry : counts.entrySet()) {
            statusCounts.computeIfAbsent(entry.getKey(), this::registerStatusGauge).set(entry.getValue());
        }
    }

    public void tilesGenerated(int count) {
        Counter.builder("raster.tiles.generated").register(registry).increment(count);
    }

    public void imageryExport(boolean success) {
        Counter.builder("imagery.exports").tag("status", success ? "success" : "failure").register(registry)
                .increment();
    }

    private AtomicLong registerStatusGauge(ProcessingJob.Status status) {
        AtomicLong holder = new AtomicLong();
        Gauge.builder("pipeline.jobs.by_status", holder, AtomicLong::get)
                .description("Number of processing jobs in the " + status.getCode() + " state")
                .tags(List.of(Tag.of("status", status.getCode()))).register(registry);
        LOG.debugf("Registered gauge: pipeline.jobs.by_status{status=%s}", status.getCode());
        return holder;
    }
}
