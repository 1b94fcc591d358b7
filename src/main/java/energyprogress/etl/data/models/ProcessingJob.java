package energyprogress.etl.data.models;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import energyprogress.etl.jobs.JobType;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Converter;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Panache entity for the durable pipeline work queue ({@code processing_jobs}).
 *
 * <p>
 * Jobs are created {@link Status#PENDING} by the API or by an imagery export, claimed by the scheduler
 * ({@code pending -> running}) and finalized exactly once ({@code running -> completed | failed}). Rows are never
 * deleted by the pipeline; they form the audit trail.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code job_id} (UUID, PK) - Opaque job identifier</li>
 * <li>{@code area_id} (INT) - Area of interest</li>
 * <li>{@code job_type} (TEXT) - {@link JobType} code</li>
 * <li>{@code status} (TEXT) - pending, running, completed, failed</li>
 * <li>{@code start_date} / {@code end_date} (DATE) - Export range, or processed month for ETL jobs</li>
 * <li>{@code error_message} (TEXT) - Non-null iff status is failed</li>
 * <li>{@code meta_data} (JSONB) - Job-type-specific payload and outputs</li>
 * </ul>
 *
 * <p>
 * State transitions are performed by {@code PanacheJobStore}; this class only guards them via
 * {@link Status#canTransitionTo(Status)}.
 */
@Entity
@Table(
        name = "processing_jobs")
public class ProcessingJob extends PanacheEntityBase {

    @Id
    @Column(
            name = "job_id",
            nullable = false)
    public UUID id;

    @Column(
            name = "area_id",
            nullable = false)
    public Long areaId;

    @Column(
            name = "job_type",
            nullable = false)
    public String jobType;

    @Column(
            name = "status",
            nullable = false)
    @Convert(
            converter = StatusConverter.class)
    public Status status;

    @Column(
            name = "start_date")
    public LocalDate startDate;

    @Column(
            name = "end_date")
    public LocalDate endDate;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    @Column(
            name = "error_message")
    public String errorMessage;

    @Column(
            name = "meta_data",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> metadata;

    /**
     * Job lifecycle statuses. {@code COMPLETED} and {@code FAILED} are terminal.
     */
    public enum Status {
        PENDING("pending"), RUNNING("running"), COMPLETED("completed"), FAILED("failed");

        private final String code;

        Status(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }

        public boolean canTransitionTo(Status next) {
            return switch (this) {
                case PENDING -> next == RUNNING;
                case RUNNING -> next == COMPLETED || next == FAILED;
                case COMPLETED, FAILED -> false;
            };
        }

        public static Status fromCode(String code) {
            for (Status status : values()) {
                if (status.code.equalsIgnoreCase(code)) {
                    return status;
                }
            }
            throw new IllegalArgumentException("Unknown job status: " + code);
        }
    }

    /**
     * Stores {@link Status} as its lowercase code so rows written by the API and by the pipeline agree.
     */
    @Converter
    public static class StatusConverter implements AttributeConverter<Status, String> {

        @Override
        public String convertToDatabaseColumn(Status status) {
            return status == null ? null : status.getCode();
        }

        @Override
        public Status convertToEntityAttribute(String code) {
            return code == null ? null : Status.fromCode(code);
        }
    }

    /**
     * Builds a new pending job (not persisted).
     *
     * @param areaId
     *            area of interest
     * @param type
     *            job type
     * @param startDate
     *            export range start or processed month
     * @param endDate
     *            export range end, null for ETL jobs
     * @param metadata
     *            job-type-specific payload
     * @return unsaved entity with id and timestamps assigned
     */
    public static ProcessingJob newPending(Long areaId, JobType type, LocalDate startDate, LocalDate endDate,
            Map<String, Object> metadata) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        ProcessingJob job = new ProcessingJob();
        job.id = UUID.randomUUID();
        job.areaId = areaId;
        job.jobType = type.getCode();
        job.status = Status.PENDING;
        job.startDate = startDate;
        job.endDate = endDate;
        job.createdAt = now;
        job.updatedAt = now;
        job.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        return job;
    }

    /**
     * Resolves {@link #jobType} to a known type.
     */
    public Optional<JobType> type() {
        return JobType.fromCode(jobType);
    }

    /**
     * Moves this job to {@code next}, advancing {@code updated_at}.
     *
     * @throws IllegalStateException
     *             if the transition is not allowed by the job state machine
     */
    public void transitionTo(Status next) {
        if (status == null || !status.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
        updatedAt = nextUpdatedAt(updatedAt);
    }

    /**
     * Returns a timestamp strictly after {@code previous}, at the microsecond precision PostgreSQL stores.
     */
    public static Instant nextUpdatedAt(Instant previous) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        if (previous != null && !now.isAfter(previous)) {
            return previous.truncatedTo(ChronoUnit.MICROS).plus(1, ChronoUnit.MICROS);
        }
        return now;
    }
}
