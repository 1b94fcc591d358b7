package energyprogress.etl.jobs;

import java.util.HashMap;
import java.util.Map;

import org.jboss.logging.Logger;

import energyprogress.etl.data.models.AreaTimeseries;
import energyprogress.etl.data.models.ProcessingJob;
import energyprogress.etl.services.RasterProcessingService;
import energyprogress.etl.services.RasterProcessingService.RasterProcessingResult;
import energyprogress.etl.services.StorageGateway;
import energyprogress.etl.services.StorageGateway.BucketType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Job handler for {@code etl_processing} jobs: one raster, one (area, month) timeseries row.
 *
 * <p>
 * Required metadata: {@code raster_key} (or the legacy, bucket-qualified {@code raster_path}); the month comes from
 * {@code month} or the job's {@code start_date}. On success the job metadata records {@code tile_path_pattern},
 * {@code tile_count} and the headline statistics.
 *
 * @see RasterProcessingService for the processing pipeline
 */
@ApplicationScoped
public class RasterProcessingJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(RasterProcessingJobHandler.class);

    @Inject
    RasterProcessingService rasterProcessingService;

    @Inject
    StorageGateway storageGateway;

    @Override
    public JobType handlesType() {
        return JobType.ETL_PROCESSING;
    }

    @Override
    public JobOutcome execute(ProcessingJob job) throws Exception {
        EtlJobPayload payload = EtlJobPayload.from(job, storageGateway.bucketName(BucketType.RASTERS));
        LOG.infof("Processing raster %s for area %d month %s", payload.rasterKey(), payload.areaId(),
                payload.month());

        RasterProcessingResult result = rasterProcessingService.process(payload);
        AreaTimeseries entry = result.entry();

        Map<String, Object> output = new HashMap<>();
        output.put("tile_path_pattern", entry.tilePathPattern);
        output.put("tile_count", result.tileCount());
        output.put("mean_brightness", entry.meanBrightness);
        output.put("lit_percentage", entry.litPercentage);
        return JobOutcome.success(output);
    }
}
