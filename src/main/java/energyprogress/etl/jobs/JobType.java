package energyprogress.etl.jobs;

import java.util.Optional;

/**
 * Enumeration of all pipeline job types.
 *
 * <p>
 * The {@code code} is the value stored in {@code processing_jobs.job_type}. Jobs are inserted by the API layer as well
 * as by the pipeline itself, so the column is kept as free text and parsed at dispatch time through
 * {@link #fromCode(String)}; an unrecognized code fails the job instead of breaking the poll query.
 *
 * @see JobHandler for handler contract
 */
public enum JobType {

    /**
     * Requests monthly nightlight composites for an area from Earth Engine, stores each raster in the rasters bucket
     * and enqueues one {@link #ETL_PROCESSING} job per month.
     * <p>
     * <b>Cadence:</b> On-demand (created by the API)
     * <p>
     * <b>Handler:</b> ImageryExportJobHandler
     */
    EARTH_ENGINE_EXPORT("earth_engine_export", "Imagery export (on-demand, one raster per month)"),

    /**
     * Computes zonal brightness statistics and a tile pyramid for one (area, month) raster, then upserts the area
     * timeseries entry.
     * <p>
     * <b>Cadence:</b> On-demand (spawned by exports or created by the API)
     * <p>
     * <b>Handler:</b> RasterProcessingJobHandler
     */
    ETL_PROCESSING("etl_processing", "Raster processing (on-demand)");

    private final String code;
    private final String description;

    JobType(String code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * Returns the persisted representation ({@code earth_engine_export}, {@code etl_processing}).
     */
    public String getCode() {
        return code;
    }

    /**
     * Returns a human-readable description including cadence notes.
     */
    public String getDescription() {
        return description;
    }

    /**
     * Resolves a persisted job type code.
     *
     * @param code
     *            value from {@code processing_jobs.job_type}, may be null
     * @return the matching type, or empty when the code is unknown
     */
    public static Optional<JobType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (JobType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
