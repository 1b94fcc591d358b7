package energyprogress.etl.api.types;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

import energyprogress.etl.data.models.ProcessingJob;

/**
 * Job listing row for operators.
 */
public record JobSummaryType(@JsonProperty("job_id") UUID jobId,

        @JsonProperty("area_id") Long areaId,

        @JsonProperty("job_type") String jobType,

        @JsonProperty("status") String status,

        @JsonProperty("start_date") LocalDate startDate,

        @JsonProperty("end_date") LocalDate endDate,

        @JsonProperty("created_at") Instant createdAt,

        @JsonProperty("updated_at") Instant updatedAt,

        @JsonProperty("error_message") String errorMessage,

        @JsonProperty("metadata") Map<String, Object> metadata) {

    /**
     * Converts a job entity to its API type.
     *
     * @param job
     *            the job entity
     * @return job API type
     */
    public static JobSummaryType from(ProcessingJob job) {
        return new JobSummaryType(job.id, job.areaId, job.jobType, job.status == null ? null : job.status.getCode(),
                job.startDate, job.endDate, job.createdAt, job.updatedAt, job.errorMessage, job.metadata);
    }
}
