package energyprogress.etl.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.time.YearMonth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import energyprogress.etl.data.models.ProcessingJob;
import energyprogress.etl.data.models.ProcessingJob.Status;
import energyprogress.etl.data.stores.JobStore.EnqueueResult;
import energyprogress.etl.exceptions.ResourceNotFoundException;
import energyprogress.etl.exceptions.ValidationException;
import energyprogress.etl.jobs.JobOutcome;
import energyprogress.etl.jobs.JobType;
import energyprogress.etl.testing.Fixtures;
import energyprogress.etl.testing.InMemoryAreaStore;
import energyprogress.etl.testing.InMemoryJobStore;
import energyprogress.etl.testing.TestBeans;

/**
 * Tests for {@link JobSubmissionService}.
 */
class JobSubmissionServiceTest {

    private InMemoryJobStore jobStore;
    private JobSubmissionService service;

    @BeforeEach
    void setUp() {
        InMemoryAreaStore areaStore = new InMemoryAreaStore();
        areaStore.add(1L, "lagos", Fixtures.AREA_RING);
        jobStore = new InMemoryJobStore();

        service = new JobSubmissionService();
        TestBeans.setField(service, "jobStore", jobStore);
        TestBeans.setField(service, "areaStore", areaStore);
    }

    @Test
    void testCreateExportJob() {
        ProcessingJob job = service.createExportJob(1L, LocalDate.of(2023, 1, 1), LocalDate.of(2023, 3, 31));

        ProcessingJob stored = jobStore.get(job.id);
        assertEquals(Status.PENDING, stored.status);
        assertEquals(JobType.EARTH_ENGINE_EXPORT.getCode(), stored.jobType);
        assertEquals(LocalDate.of(2023, 3, 31), stored.endDate);
    }

    /**
     * Test: A missing end date exports only the start month.
     */
    @Test
    void testCreateExportJob_defaultsEndToStart() {
        ProcessingJob job = service.createExportJob(1L, LocalDate.of(2023, 6, 1), null);

        assertEquals(LocalDate.of(2023, 6, 1), jobStore.get(job.id).endDate);
    }

    @Test
    void testCreateExportJob_rejectsBadInput() {
        assertThrows(ValidationException.class, () -> service.createExportJob(1L, null, null));
        assertThrows(ValidationException.class,
                () -> service.createExportJob(1L, LocalDate.of(2023, 3, 1), LocalDate.of(2023, 1, 1)));
        assertThrows(ValidationException.class, () -> service.createExportJob(null, LocalDate.of(2023, 1, 1), null));
        assertThrows(ResourceNotFoundException.class,
                () -> service.createExportJob(42L, LocalDate.of(2023, 1, 1), null));
        assertTrue(jobStore.all().isEmpty());
    }

    /**
     * Test: A second ETL request for the same area and month returns the existing job until that job fails.
     */
    @Test
    void testCreateEtlJob_deduplicatesUntilFailed() {
        EnqueueResult first = service.createEtlJob(1L, YearMonth.of(2023, 1), "1/rasters/viirs/2023_01.tif");
        EnqueueResult again = service.createEtlJob(1L, YearMonth.of(2023, 1), "1/rasters/viirs/2023_01.tif");

        assertTrue(first.created());
        assertFalse(again.created());
        assertEquals(first.jobId(), again.jobId());

        jobStore.claim(first.jobId());
        jobStore.finish(first.jobId(), JobOutcome.failure("Storage error: missing raster"));
        EnqueueResult retry = service.createEtlJob(1L, YearMonth.of(2023, 1), "1/rasters/viirs/2023_01.tif");

        assertTrue(retry.created());
        assertEquals(LocalDate.of(2023, 1, 1), jobStore.get(retry.jobId()).startDate);
        assertEquals("2023-01", jobStore.get(retry.jobId()).metadata.get("month"));
    }

    @Test
    void testCreateEtlJob_rejectsBadInput() {
        assertThrows(ValidationException.class, () -> service.createEtlJob(1L, null, "key.tif"));
        assertThrows(ValidationException.class, () -> service.createEtlJob(1L, YearMonth.of(2023, 1), " "));
        assertThrows(ResourceNotFoundException.class,
                () -> service.createEtlJob(42L, YearMonth.of(2023, 1), "key.tif"));
    }
}
