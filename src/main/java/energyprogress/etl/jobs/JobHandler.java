package energyprogress.etl.jobs;

import energyprogress.etl.data.models.ProcessingJob;

/**
 * Contract for pipeline job handler implementations.
 *
 * <p>
 * Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped} and implement this interface. The
 * {@code JobDispatchService} discovers handlers at startup and routes claimed jobs based on their {@link JobType}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>Handlers execute on the scheduler's bounded worker pool, one job per call</li>
 * <li>The job is already {@code running} when the handler is invoked; the scheduler finalizes it</li>
 * <li>Failed jobs are not retried; an operator resubmits a new job</li>
 * <li>OpenTelemetry spans and MDC fields wrap handler execution</li>
 * </ul>
 *
 * <p>
 * <b>Example Implementation:</b>
 *
 * <pre>{@code
 * @ApplicationScoped
 * public class RasterProcessingJobHandler implements JobHandler {
 *     @Override
 *     public JobType handlesType() {
 *         return JobType.ETL_PROCESSING;
 *     }
 *
 *     @Override
 *     public JobOutcome execute(ProcessingJob job) {
 *         EtlJobPayload payload = EtlJobPayload.from(job);
 *         // Download raster, compute statistics, upload tiles...
 *     }
 * }
 * }</pre>
 *
 * @see JobType for supported job types
 */
public interface JobHandler {

    /**
     * Returns the job type this handler processes.
     *
     * @return the job type enum value
     */
    JobType handlesType();

    /**
     * Executes the job.
     *
     * <p>
     * <b>Thread Safety:</b> This method may be called concurrently for different jobs by multiple worker threads.
     *
     * <p>
     * <b>Error Handling:</b> Thrown exceptions are converted by the dispatcher into a {@code failed} outcome whose
     * error message carries the exception category. A handler may also return {@link JobOutcome#failure} directly
     * when it has partial results worth recording in metadata.
     *
     * @param job
     *            the claimed job; metadata is validated by the handler through its payload type
     * @return outcome with output metadata to merge into the job row
     * @throws Exception
     *             any error during execution; fails the job
     */
    JobOutcome execute(ProcessingJob job) throws Exception;
}
