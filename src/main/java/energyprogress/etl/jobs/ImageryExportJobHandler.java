package energyprogress.etl.jobs;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

import energyprogress.etl.data.models.Area;
import energyprogress.etl.data.models.ProcessingJob;
import energyprogress.etl.data.stores.AreaStore;
import energyprogress.etl.data.stores.JobStore;
import energyprogress.etl.data.stores.JobStore.EnqueueResult;
import energyprogress.etl.exceptions.ResourceNotFoundException;
import energyprogress.etl.integration.earthengine.ImageryProvider;
import energyprogress.etl.observability.PipelineMetrics;
import energyprogress.etl.services.StorageGateway;
import energyprogress.etl.services.StorageGateway.BucketType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Job handler for {@code earth_engine_export} jobs.
 *
 * <p>
 * Workflow, for each month covered by the job (see {@link ExportJobPayload#months()}):
 * <ol>
 * <li>Skip the month if an {@code etl_processing} job that has not failed already exists for it</li>
 * <li>Fetch the monthly composite from the {@link ImageryProvider}</li>
 * <li>Upload it to {@code {rasters}/{area_id}/rasters/{source}/{year}_{MM}.tif}, overwriting any earlier export</li>
 * <li>Enqueue a pending {@code etl_processing} job referencing the object key</li>
 * </ol>
 *
 * <p>
 * A failing month is recorded and the remaining months are still attempted. The job completes only when every month
 * was created or skipped; otherwise it fails with the per-month causes. Either way the metadata carries
 * {@code months_requested}, {@code created_job_ids}, {@code skipped_months} and {@code failed_months}.
 */
@ApplicationScoped
public class ImageryExportJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(ImageryExportJobHandler.class);

    @Inject
    ImageryProvider imageryProvider;

    @Inject
    StorageGateway storageGateway;

    @Inject
    AreaStore areaStore;

    @Inject
    JobStore jobStore;

    @Inject
    PipelineMetrics metrics;

    @Override
    public JobType handlesType() {
        return JobType.EARTH_ENGINE_EXPORT;
    }

    @Override
    public JobOutcome execute(ProcessingJob job) {
        ExportJobPayload payload = ExportJobPayload.from(job);
        Area area = areaStore.findById(payload.areaId())
                .orElseThrow(() -> new ResourceNotFoundException("Area " + payload.areaId() + " not found"));
        storageGateway.ensureBuckets();

        List<YearMonth> months = payload.months();
        String source = imageryProvider.source();
        Map<String, Object> createdJobIds = new LinkedHashMap<>();
        List<String> skippedMonths = new ArrayList<>();
        Map<String, Object> failedMonths = new LinkedHashMap<>();

        LOG.infof("Exporting %d month(s) of %s imagery for area %d (%s)", months.size(), source, area.id, area.name);

        for (YearMonth month : months) {
            Optional<ProcessingJob> existing = jobStore.findActiveEtlJob(area.id, month.atDay(1));
            if (existing.isPresent()) {
                LOG.infof("Skipping %s for area %d: job %s already exists", month, area.id, existing.get().id);
                skippedMonths.add(month.toString());
                continue;
            }

            try {
                String key = rasterKey(area.id, source, month);
                byte[] raster = imageryProvider.fetchMonthlyComposite(area.geom, month);
                storageGateway.put(BucketType.RASTERS, key, raster, "image/tiff");

                EnqueueResult result = jobStore
                        .enqueueEtl(new EtlJobPayload(area.id, month, key, job.id, source));
                if (result.created()) {
                    createdJobIds.put(month.toString(), result.jobId().toString());
                } else {
                    skippedMonths.add(month.toString());
                }
                metrics.imageryExport(true);
                LOG.infof("Exported %s for area %d to %s (etl job %s)", month, area.id, key, result.jobId());

            } catch (RuntimeException e) {
                metrics.imageryExport(false);
                String cause = FailureCategory.describe(e);
                failedMonths.put(month.toString(), cause);
                LOG.warnf("Export of %s for area %d failed, continuing with remaining months: %s", month, area.id,
                        cause);
            }
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("source", source);
        output.put("months_requested", months.stream().map(YearMonth::toString).collect(Collectors.toList()));
        output.put("created_job_ids", createdJobIds);
        output.put("skipped_months", skippedMonths);
        output.put("failed_months", failedMonths);

        if (failedMonths.isEmpty()) {
            return JobOutcome.success(output);
        }
        String summary = failedMonths.entrySet().stream().map(e -> e.getKey() + " (" + e.getValue() + ")")
                .collect(Collectors.joining("; "));
        return JobOutcome.failure(
                "Export failed for " + failedMonths.size() + " of " + months.size() + " month(s): " + summary, output);
    }

    /**
     * Deterministic raster object key, e.g. {@code 42/rasters/viirs/2023_01.tif}.
     */
    public static String rasterKey(Long areaId, String source, YearMonth month) {
        return String.format("%d/rasters/%s/%d_%02d.tif", areaId, source, month.getYear(), month.getMonthValue());
    }
}
