package energyprogress.etl.data.stores;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import energyprogress.etl.data.models.ProcessingJob;
import energyprogress.etl.jobs.EtlJobPayload;
import energyprogress.etl.jobs.JobOutcome;

/**
 * Durable work queue of {@link ProcessingJob} records.
 *
 * <p>
 * {@link #claim(UUID)} is the only synchronization primitive between scheduler workers and scheduler instances: it is
 * an atomic compare-and-set from {@code pending} to {@code running}, so under any number of concurrent attempts on the
 * same job exactly one returns {@code true}.
 */
public interface JobStore {

    /**
     * Pending jobs, oldest {@code created_at} first, ties broken by job id.
     *
     * @param limit
     *            maximum number of jobs to return
     */
    List<ProcessingJob> listPending(int limit);

    /**
     * Atomically transitions a job from {@code pending} to {@code running}.
     *
     * @return true if this caller won the claim; false if the job is missing or no longer pending
     */
    boolean claim(UUID jobId);

    /**
     * Finalizes a running job: {@code completed} with a cleared error, or {@code failed} with the outcome's error
     * message. Outcome metadata is merged into the stored metadata.
     *
     * @return false if the job is missing or not running (nothing is written)
     */
    boolean finish(UUID jobId, JobOutcome outcome);

    /**
     * Persists a new pending job.
     */
    ProcessingJob enqueue(ProcessingJob job);

    /**
     * Creates a pending {@code etl_processing} job for the payload's (area, month) unless a job that has not failed
     * already exists for that key.
     */
    EnqueueResult enqueueEtl(EtlJobPayload payload);

    /**
     * Oldest {@code etl_processing} job for (area, month) whose status is not {@code failed}.
     */
    Optional<ProcessingJob> findActiveEtlJob(Long areaId, LocalDate month);

    Optional<ProcessingJob> findById(UUID jobId);

    /**
     * Jobs matching every non-null filter field, newest first.
     */
    List<ProcessingJob> list(JobFilter filter);

    /**
     * Number of jobs per status; statuses with no jobs are reported as zero.
     */
    Map<ProcessingJob.Status, Long> countByStatus();

    /**
     * Result of an idempotent enqueue.
     *
     * @param jobId
     *            the new job, or the existing one when {@code created} is false
     * @param created
     *            whether a new row was inserted
     */
    record EnqueueResult(UUID jobId, boolean created) {
    }

    /**
     * Listing filter; null fields match everything.
     */
    record JobFilter(Long areaId, ProcessingJob.Status status, String jobType, int limit) {

        public static JobFilter all(int limit) {
            return new JobFilter(null, null, null, limit);
        }
    }
}
