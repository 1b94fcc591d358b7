package energyprogress.etl.data.stores;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.UUID;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import energyprogress.etl.data.models.ProcessingJob;
import energyprogress.etl.data.models.ProcessingJob.Status;
import energyprogress.etl.jobs.EtlJobPayload;
import energyprogress.etl.jobs.JobOutcome;
import energyprogress.etl.jobs.JobType;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.LockModeType;
import jakarta.persistence.Query;
import jakarta.transaction.Transactional;

/**
 * {@link JobStore} over the {@code processing_jobs} table using Panache.
 *
 * <p>
 * Claiming is a single conditional {@code UPDATE ... WHERE status = 'pending'}; finishing locks the row
 * ({@code SELECT ... FOR UPDATE}) and only moves it out of {@code running}. ETL jobs are inserted with
 * {@code ON CONFLICT DO NOTHING} against the {@code processing_jobs_active_etl_uniq} partial index, so concurrent
 * exports cannot create two live jobs for one (area, month).
 */
@ApplicationScoped
public class PanacheJobStore implements JobStore {

    private static final Logger LOG = Logger.getLogger(PanacheJobStore.class);

    private static final String INSERT_ETL_SQL = """
            INSERT INTO processing_jobs (job_id, area_id, job_type, status, start_date, created_at, updated_at,
                meta_data)
            VALUES (:jobId, :areaId, :jobType, :status, :startDate, :createdAt, :updatedAt, CAST(:metadata AS JSONB))
            ON CONFLICT (area_id, start_date) WHERE job_type = 'etl_processing' AND status <> 'failed'
            DO NOTHING
            """;

    @Inject
    ObjectMapper objectMapper;

    @Override
    @Transactional
    public List<ProcessingJob> listPending(int limit) {
        return ProcessingJob.<ProcessingJob> find("status = ?1", Sort.ascending("createdAt", "id"), Status.PENDING)
                .page(0, limit).list();
    }

    @Override
    @Transactional
    public boolean claim(UUID jobId) {
        Optional<ProcessingJob> current = ProcessingJob.findByIdOptional(jobId);
        if (current.isEmpty() || current.get().status != Status.PENDING) {
            return false;
        }
        Instant updatedAt = ProcessingJob.nextUpdatedAt(current.get().updatedAt);
        int changed = ProcessingJob.update("status = ?1, updatedAt = ?2 where id = ?3 and status = ?4", Status.RUNNING,
                updatedAt, jobId, Status.PENDING);
        if (changed == 1) {
            LOG.debugf("Claimed job %s", jobId);
            return true;
        }
        return false;
    }

    @Override
    @Transactional
    public boolean finish(UUID jobId, JobOutcome outcome) {
        ProcessingJob job = ProcessingJob.findById(jobId, LockModeType.PESSIMISTIC_WRITE);
        if (job == null) {
            LOG.warnf("Cannot finish job %s: not found", jobId);
            return false;
        }
        if (job.status != Status.RUNNING) {
            LOG.warnf("Cannot finish job %s: status is %s, expected running", jobId, job.status.getCode());
            return false;
        }

        Map<String, Object> merged = job.metadata == null ? new HashMap<>() : new HashMap<>(job.metadata);
        merged.putAll(outcome.metadata());
        job.metadata = merged;
        job.errorMessage = outcome.succeeded() ? null : outcome.errorMessage();
        job.transitionTo(outcome.succeeded() ? Status.COMPLETED : Status.FAILED);
        return true;
    }

    @Override
    @Transactional
    public ProcessingJob enqueue(ProcessingJob job) {
        job.persist();
        LOG.infof("Created job %s (type: %s, area: %d)", job.id, job.jobType, job.areaId);
        return job;
    }

    @Override
    @Transactional
    public EnqueueResult enqueueEtl(EtlJobPayload payload) {
        Optional<ProcessingJob> existing = findActiveEtlJob(payload.areaId(), payload.monthStart());
        if (existing.isPresent()) {
            LOG.debugf("ETL job %s already covers area %d month %s", existing.get().id, payload.areaId(),
                    payload.month());
            return new EnqueueResult(existing.get().id, false);
        }

        ProcessingJob job = ProcessingJob.newPending(payload.areaId(), JobType.ETL_PROCESSING, payload.monthStart(),
                null, payload.toMetadata());
        Query insert = ProcessingJob.getEntityManager().createNativeQuery(INSERT_ETL_SQL);
        insert.setParameter("jobId", job.id);
        insert.setParameter("areaId", job.areaId);
        insert.setParameter("jobType", job.jobType);
        insert.setParameter("status", job.status.getCode());
        insert.setParameter("startDate", job.startDate);
        insert.setParameter("createdAt", job.createdAt);
        insert.setParameter("updatedAt", job.updatedAt);
        insert.setParameter("metadata", toJson(job.metadata));
        if (insert.executeUpdate() == 1) {
            LOG.infof("Created job %s (type: %s, area: %d)", job.id, job.jobType, job.areaId);
            return new EnqueueResult(job.id, true);
        }

        // lost the race; the insert waited for the winner to commit, so its row is visible now
        ProcessingJob winner = findActiveEtlJob(payload.areaId(), payload.monthStart())
                .orElseThrow(() -> new IllegalStateException("ETL job for area " + payload.areaId() + " month "
                        + payload.month() + " conflicted but no active job was found"));
        LOG.debugf("ETL job %s was created concurrently for area %d month %s", winner.id, payload.areaId(),
                payload.month());
        return new EnqueueResult(winner.id, false);
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job metadata", e);
        }
    }

    @Override
    @Transactional
    public Optional<ProcessingJob> findActiveEtlJob(Long areaId, LocalDate month) {
        return ProcessingJob
                .<ProcessingJob> find("areaId = ?1 and jobType = ?2 and startDate = ?3 and status <> ?4",
                        Sort.ascending("createdAt"), areaId, JobType.ETL_PROCESSING.getCode(), month, Status.FAILED)
                .firstResultOptional();
    }

    @Override
    @Transactional
    public Optional<ProcessingJob> findById(UUID jobId) {
        return ProcessingJob.findByIdOptional(jobId);
    }

    @Override
    @Transactional
    public List<ProcessingJob> list(JobFilter filter) {
        StringJoiner where = new StringJoiner(" and ");
        Parameters params = new Parameters();
        if (filter.areaId() != null) {
            where.add("areaId = :areaId");
            params.and("areaId", filter.areaId());
        }
        if (filter.status() != null) {
            where.add("status = :status");
            params.and("status", filter.status());
        }
        if (filter.jobType() != null) {
            where.add("jobType = :jobType");
            params.and("jobType", filter.jobType());
        }

        Sort sort = Sort.descending("createdAt");
        if (where.length() == 0) {
            return ProcessingJob.<ProcessingJob> findAll(sort).page(0, filter.limit()).list();
        }
        return ProcessingJob.<ProcessingJob> find(where.toString(), sort, params).page(0, filter.limit()).list();
    }

    @Override
    @Transactional
    public Map<Status, Long> countByStatus() {
        Map<Status, Long> counts = new EnumMap<>(Status.class);
        for (Status status : Status.values()) {
            counts.put(status, 0L);
        }
        List<Object[]> rows = ProcessingJob.getEntityManager()
                .createQuery("select p.status, count(p) from ProcessingJob p group by p.status", Object[].class)
                .getResultList();
        for (Object[] row : rows) {
            counts.put((Status) row[0], (Long) row[1]);
        }
        return counts;
    }
}
