package energyprogress.etl.services;

import java.time.LocalDate;
import java.time.YearMonth;

import org.jboss.logging.Logger;

import energyprogress.etl.data.models.ProcessingJob;
import energyprogress.etl.data.stores.AreaStore;
import energyprogress.etl.data.stores.JobStore;
import energyprogress.etl.exceptions.ResourceNotFoundException;
import energyprogress.etl.exceptions.ValidationException;
import energyprogress.etl.jobs.EtlJobPayload;
import energyprogress.etl.jobs.JobType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Creates pending jobs on behalf of the API layer.
 *
 * <p>
 * Jobs are only inserted here; the scheduler picks them up on its next poll.
 */
@ApplicationScoped
public class JobSubmissionService {

    private static final Logger LOG = Logger.getLogger(JobSubmissionService.class);

    @Inject
    JobStore jobStore;

    @Inject
    AreaStore areaStore;

    /**
     * Queues an imagery export for every month in the range.
     *
     * @param areaId
     *            registered area
     * @param startDate
     *            range start, required
     * @param endDate
     *            range end; null exports only the month of {@code startDate}
     * @return the pending job
     * @throws ValidationException
     *             if the range is missing or inverted
     * @throws ResourceNotFoundException
     *             if the area does not exist
     */
    public ProcessingJob createExportJob(Long areaId, LocalDate startDate, LocalDate endDate) {
        if (startDate == null) {
            throw new ValidationException("start_date is required");
        }
        LocalDate end = endDate == null ? startDate : endDate;
        if (end.isBefore(startDate)) {
            throw new ValidationException("end_date " + end + " is before start_date " + startDate);
        }
        requireArea(areaId);

        ProcessingJob job = jobStore
                .enqueue(ProcessingJob.newPending(areaId, JobType.EARTH_ENGINE_EXPORT, startDate, end, null));
        LOG.infof("Queued export job %s for area %d (%s to %s)", job.id, areaId, startDate, end);
        return job;
    }

    /**
     * Queues processing of a raster that is already in the rasters bucket. Returns the existing job when a non-failed
     * job already covers the same area and month.
     */
    public JobStore.EnqueueResult createEtlJob(Long areaId, YearMonth month, String rasterKey) {
        if (month == null) {
            throw new ValidationException("month is required");
        }
        if (rasterKey == null || rasterKey.isBlank()) {
            throw new ValidationException("raster_key is required");
        }
        requireArea(areaId);
        return jobStore.enqueueEtl(new EtlJobPayload(areaId, month, rasterKey, null, null));
    }

    private void requireArea(Long areaId) {
        if (areaId == null) {
            throw new ValidationException("area_id is required");
        }
        if (areaStore.findById(areaId).isEmpty()) {
            throw new ResourceNotFoundException("Area " + areaId + " not found");
        }
    }
}
