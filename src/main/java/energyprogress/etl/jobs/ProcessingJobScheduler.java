package energyprogress.etl.jobs;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import energyprogress.etl.data.models.ProcessingJob;
import energyprogress.etl.data.stores.JobStore;
import energyprogress.etl.observability.PipelineMetrics;
import energyprogress.etl.services.JobDispatchService;
import energyprogress.etl.services.StorageGateway;
import io.quarkus.scheduler.Scheduled;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Polls {@code processing_jobs} and drives pending jobs to a terminal state.
 *
 * <p>
 * <b>Poll cycle:</b>
 * <ol>
 * <li>List up to {@code batch-size} pending jobs, oldest first</li>
 * <li>If there are any, make sure storage buckets exist; while the object store is unreachable the jobs stay pending
 * and the next cycle tries again</li>
 * <li>Claim each job in creation order ({@code pending -> running}); a lost claim means another worker or instance
 * owns the job</li>
 * <li>Run claimed jobs on a bounded worker pool through {@link JobDispatchService}, each limited to
 * {@code job-timeout}</li>
 * <li>Record every outcome ({@code running -> completed | failed})</li>
 * </ol>
 *
 * <p>
 * Only one cycle runs at a time: the Quarkus trigger skips overlapping executions and {@link #runCycle()} guards
 * itself with an in-flight flag. Failed jobs are never retried here; an operator resubmits a new job. Jobs left
 * {@code running} by a crashed process are not reclaimed and show up in the {@code pipeline.jobs.by_status} gauge.
 */
@ApplicationScoped
public class ProcessingJobScheduler {

    private static final Logger LOG = Logger.getLogger(ProcessingJobScheduler.class);

    @Inject
    JobStore jobStore;

    @Inject
    JobDispatchService dispatchService;

    @Inject
    StorageGateway storageGateway;

    @Inject
    PipelineMetrics metrics;

    @ConfigProperty(
            name = "energyprogress.scheduler.enabled",
            defaultValue = "true")
    boolean enabled;

    @ConfigProperty(
            name = "energyprogress.scheduler.batch-size",
            defaultValue = "10")
    int batchSize;

    @ConfigProperty(
            name = "energyprogress.scheduler.worker-threads",
            defaultValue = "2")
    int workerThreads;

    @ConfigProperty(
            name = "energyprogress.scheduler.job-timeout",
            defaultValue = "PT30M")
    Duration jobTimeout;

    private final AtomicBoolean cycleInProgress = new AtomicBoolean(false);

    private ExecutorService workers;

    /**
     * How a poll cycle ended.
     */
    public enum CycleResult {
        /** Another cycle was still running. */
        SKIPPED,
        /** No pending jobs. */
        IDLE,
        /** Pending jobs exist but storage could not be initialized; they stay pending. */
        STORAGE_UNAVAILABLE,
        /** The cycle failed before processing jobs, e.g. the job store was unreachable. */
        ERROR,
        /** Jobs were claimed and finalized. */
        PROCESSED
    }

    /**
     * Summary of one poll cycle.
     *
     * @param result
     *            how the cycle ended
     * @param candidates
     *            pending jobs returned by the poll
     * @param claimed
     *            jobs this cycle won the claim for
     * @param completed
     *            claimed jobs recorded as completed
     * @param failed
     *            claimed jobs recorded as failed
     */
    public record CycleReport(CycleResult result, int candidates, int claimed, int completed, int failed) {

        static CycleReport of(CycleResult result, int candidates) {
            return new CycleReport(result, candidates, 0, 0, 0);
        }
    }

    @PostConstruct
    void init() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "etl-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        workers = Executors.newFixedThreadPool(Math.max(1, workerThreads), factory);
        LOG.infof("Processing job scheduler ready: enabled=%s, batchSize=%d, workers=%d, jobTimeout=%s", enabled,
                batchSize, workerThreads, jobTimeout);
    }

    @PreDestroy
    void shutdown() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    /**
     * Timer entry point. Fires once shortly after startup and then every {@code poll-interval}.
     */
    @Scheduled(
            every = "${energyprogress.scheduler.poll-interval:5m}",
            identity = "processing-job-poll",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void poll() {
        if (!enabled) {
            LOG.trace("Processing job scheduler disabled, skipping poll");
            return;
        }
        runCycle();
    }

    /**
     * Runs one poll cycle. Never throws: job failures are recorded on the jobs, scheduler failures are logged and end
     * the cycle early.
     */
    public CycleReport runCycle() {
        if (!cycleInProgress.compareAndSet(false, true)) {
            LOG.debug("Previous poll cycle still running, skipping");
            metrics.cycle("skipped");
            return CycleReport.of(CycleResult.SKIPPED, 0);
        }
        try {
            CycleReport report = doCycle();
            metrics.cycle(report.result().name().toLowerCase());
            return report;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Poll cycle aborted by an unexpected error");
            metrics.cycle("error");
            return CycleReport.of(CycleResult.ERROR, 0);
        } finally {
            refreshStatusGauges();
            cycleInProgress.set(false);
        }
    }

    private CycleReport doCycle() {
        List<ProcessingJob> pending;
        try {
            pending = jobStore.listPending(batchSize);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to list pending jobs, ending cycle");
            return CycleReport.of(CycleResult.ERROR, 0);
        }

        if (pending.isEmpty()) {
            LOG.debug("No pending jobs");
            return CycleReport.of(CycleResult.IDLE, 0);
        }

        try {
            storageGateway.ensureBuckets();
        } catch (RuntimeException e) {
            LOG.warnf("Object storage unavailable, leaving %d job(s) pending until next cycle: %s", pending.size(),
                    e.getMessage());
            return CycleReport.of(CycleResult.STORAGE_UNAVAILABLE, pending.size());
        }

        LOG.infof("Found %d pending job(s)", pending.size());

        List<RunningJob> running = new ArrayList<>();
        for (ProcessingJob job : pending) {
            boolean claimed;
            try {
                claimed = jobStore.claim(job.id);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to claim job %s, leaving it pending", job.id);
                continue;
            }
            if (!claimed) {
                LOG.debugf("Job %s was claimed elsewhere, skipping", job.id);
                continue;
            }
            metrics.jobClaimed();
            job.status = ProcessingJob.Status.RUNNING;
            running.add(submit(job));
        }

        int completed = 0;
        int failed = 0;
        for (int i = 0; i < running.size(); i++) {
            RunningJob task = running.get(i);
            JobOutcome outcome = await(task, i);
            if (finish(task.job(), outcome)) {
                if (outcome.succeeded()) {
                    completed++;
                } else {
                    failed++;
                }
            }
        }

        LOG.infof("Poll cycle finished: %d claimed, %d completed, %d failed", running.size(), completed, failed);
        return new CycleReport(CycleResult.PROCESSED, pending.size(), running.size(), completed, failed);
    }

    private RunningJob submit(ProcessingJob job) {
        CountDownLatch started = new CountDownLatch(1);
        AtomicLong startNanos = new AtomicLong();
        Future<JobOutcome> future = workers.submit(() -> {
            startNanos.set(System.nanoTime());
            started.countDown();
            return dispatchService.execute(job);
        });
        return new RunningJob(job, future, started, startNanos);
    }

    /**
     * Waits for a job's outcome, bounding its run time by {@code job-timeout} from the moment a worker picked it up.
     * A job queued behind others may wait for a free worker for as long as the jobs ahead of it could run.
     */
    private JobOutcome await(RunningJob task, int position) {
        long timeoutNanos = jobTimeout.toNanos();
        long queueWaitNanos = timeoutNanos * (position / Math.max(1, workerThreads) + 1);
        try {
            if (!task.started().await(queueWaitNanos, TimeUnit.NANOSECONDS)) {
                task.future().cancel(true);
                return JobOutcome.failure(FailureCategory.TIMEOUT.message("no worker became available within "
                        + Duration.ofNanos(queueWaitNanos)));
            }
            long remaining = timeoutNanos - (System.nanoTime() - task.startNanos().get());
            return task.future().get(Math.max(0, remaining), TimeUnit.NANOSECONDS);

        } catch (TimeoutException e) {
            task.future().cancel(true);
            LOG.errorf("Job %s exceeded timeout of %s, cancelling", task.job().id, jobTimeout);
            return JobOutcome.failure(FailureCategory.TIMEOUT.message("job exceeded " + jobTimeout));

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.errorf(cause, "Job %s crashed its worker", task.job().id);
            return JobOutcome.failure(FailureCategory.describe(cause));

        } catch (CancellationException e) {
            return JobOutcome.failure(FailureCategory.TIMEOUT.message("job cancelled"));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.future().cancel(true);
            return JobOutcome.failure(FailureCategory.INTERNAL.message("scheduler interrupted while waiting for job"));
        }
    }

    private boolean finish(ProcessingJob job, JobOutcome outcome) {
        try {
            if (jobStore.finish(job.id, outcome)) {
                return true;
            }
            LOG.warnf("Job %s was no longer running when its outcome was recorded", job.id);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record outcome of job %s; it stays running", job.id);
        }
        return false;
    }

    private void refreshStatusGauges() {
        try {
            metrics.updateStatusCounts(jobStore.countByStatus());
        } catch (RuntimeException e) {
            LOG.debugf("Could not refresh job status gauges: %s", e.getMessage());
        }
    }

    /**
     * A claimed job handed to the worker pool.
     */
    private record RunningJob(ProcessingJob job, Future<JobOutcome> future, CountDownLatch started,
            AtomicLong startNanos) {
    }
}
