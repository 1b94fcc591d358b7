package energyprogress.etl.jobs;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import energyprogress.etl.data.models.ProcessingJob;
import energyprogress.etl.exceptions.ValidationException;

/**
 * Typed view of an {@code etl_processing} job's metadata.
 *
 * <p>
 * Required: {@code raster_key} (object key in the rasters bucket) and a month, taken from {@code month} in metadata
 * ({@code YYYY-MM}) or else from the job's {@code start_date}. Optional: {@code parent_job_id}, {@code source}.
 *
 * <p>
 * The legacy {@code raster_path} is written bucket-qualified ({@code rasters/42/2023_01/viirs_ntl.tif}); the bucket
 * segment is dropped to get the object key.
 */
public record EtlJobPayload(Long areaId, YearMonth month, String rasterKey, UUID parentJobId, String source) {

    public static final String RASTER_KEY = "raster_key";
    public static final String LEGACY_RASTER_PATH = "raster_path";
    public static final String MONTH = "month";
    public static final String PARENT_JOB_ID = "parent_job_id";
    public static final String SOURCE = "source";

    /**
     * Validates and extracts the payload, taking {@code raster_path} as a bare object key.
     *
     * @throws ValidationException
     *             if a required field is missing or malformed
     */
    public static EtlJobPayload from(ProcessingJob job) {
        return from(job, null);
    }

    /**
     * Validates and extracts the payload.
     *
     * @param rastersBucket
     *            name of the rasters bucket, stripped from the front of a legacy {@code raster_path}; may be null
     * @throws ValidationException
     *             if a required field is missing or malformed
     */
    public static EtlJobPayload from(ProcessingJob job, String rastersBucket) {
        Map<String, Object> meta = job.metadata == null ? Map.of() : job.metadata;
        if (job.areaId == null) {
            throw new ValidationException("Job " + job.id + " has no area_id");
        }

        boolean legacy = !meta.containsKey(RASTER_KEY);
        Object rawKey = legacy ? meta.get(LEGACY_RASTER_PATH) : meta.get(RASTER_KEY);
        if (!(rawKey instanceof String) || ((String) rawKey).isBlank()) {
            throw new ValidationException("No raster key in job metadata");
        }
        String rasterKey = (String) rawKey;
        if (legacy && rastersBucket != null && rasterKey.startsWith(rastersBucket + "/")) {
            rasterKey = rasterKey.substring(rastersBucket.length() + 1);
            if (rasterKey.isBlank()) {
                throw new ValidationException("raster_path names only the bucket: " + rawKey);
            }
        }

        YearMonth month;
        Object rawMonth = meta.get(MONTH);
        if (rawMonth != null) {
            try {
                month = YearMonth.parse(rawMonth.toString());
            } catch (DateTimeParseException e) {
                throw new ValidationException("Invalid month in job metadata: " + rawMonth, e);
            }
        } else if (job.startDate != null) {
            month = YearMonth.from(job.startDate);
        } else {
            throw new ValidationException("No month in job metadata and no start_date");
        }

        UUID parent = null;
        Object rawParent = meta.get(PARENT_JOB_ID);
        if (rawParent != null) {
            try {
                parent = UUID.fromString(rawParent.toString());
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Invalid parent_job_id in job metadata: " + rawParent, e);
            }
        }

        Object rawSource = meta.get(SOURCE);
        return new EtlJobPayload(job.areaId, month, rasterKey, parent,
                rawSource == null ? null : rawSource.toString());
    }

    /**
     * Metadata map written when the job is enqueued.
     */
    public Map<String, Object> toMetadata() {
        Map<String, Object> meta = new HashMap<>();
        meta.put(RASTER_KEY, rasterKey);
        meta.put(MONTH, month.toString());
        if (parentJobId != null) {
            meta.put(PARENT_JOB_ID, parentJobId.toString());
        }
        if (source != null) {
            meta.put(SOURCE, source);
        }
        return meta;
    }

    public LocalDate monthStart() {
        return month.atDay(1);
    }
}
