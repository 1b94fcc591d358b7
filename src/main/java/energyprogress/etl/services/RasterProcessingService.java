package energyprogress.etl.services;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import energyprogress.etl.data.models.Area;
import energyprogress.etl.data.models.AreaTimeseries;
import energyprogress.etl.data.stores.AreaStore;
import energyprogress.etl.data.stores.TimeseriesStore;
import energyprogress.etl.exceptions.ResourceNotFoundException;
import energyprogress.etl.jobs.EtlJobPayload;
import energyprogress.etl.observability.PipelineMetrics;
import energyprogress.etl.raster.GeoRaster;
import energyprogress.etl.raster.GeoTiffDecoder;
import energyprogress.etl.raster.PolygonMask;
import energyprogress.etl.raster.RenderedTile;
import energyprogress.etl.raster.TilePyramidRenderer;
import energyprogress.etl.raster.ZonalStatistics;
import energyprogress.etl.raster.ZonalStatisticsCalculator;
import energyprogress.etl.services.StorageGateway.BucketType;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Turns one monthly raster into an {@link AreaTimeseries} row and a tile pyramid.
 *
 * <p>
 * <b>Pipeline:</b>
 * <ol>
 * <li>Download the raster from the rasters bucket and decode it</li>
 * <li>Mask it with the area polygon and compute zonal statistics</li>
 * <li>Render tiles for the configured zoom range into a private work directory</li>
 * <li>Upload every tile to {@code {tiles}/{area_id}/{YYYY_MM}/{z}/{x}/{y}.png}</li>
 * <li>Upsert the timeseries row</li>
 * </ol>
 *
 * <p>
 * The row is written only after every tile upload succeeded, so a failed run leaves any previous row for the same
 * (area, month) untouched. The work directory is deleted on every exit path.
 */
@ApplicationScoped
public class RasterProcessingService {

    private static final Logger LOG = Logger.getLogger(RasterProcessingService.class);

    @Inject
    StorageGateway storageGateway;

    @Inject
    AreaStore areaStore;

    @Inject
    TimeseriesStore timeseriesStore;

    @Inject
    TilePyramidRenderer tileRenderer;

    @Inject
    PipelineMetrics metrics;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "energyprogress.raster.lit-threshold",
            defaultValue = "1.0")
    double litThreshold;

    @ConfigProperty(
            name = "energyprogress.raster.default-nodata",
            defaultValue = "0.0")
    double defaultNodata;

    @ConfigProperty(
            name = "energyprogress.raster.all-touched",
            defaultValue = "true")
    boolean allTouched;

    @ConfigProperty(
            name = "energyprogress.raster.min-zoom",
            defaultValue = "8")
    int minZoom;

    @ConfigProperty(
            name = "energyprogress.raster.max-zoom",
            defaultValue = "14")
    int maxZoom;

    @ConfigProperty(
            name = "energyprogress.raster.work-dir")
    Optional<String> workDir;

    /**
     * Output of a successful run.
     *
     * @param entry
     *            the row that was upserted
     * @param tileCount
     *            number of tiles uploaded
     */
    public record RasterProcessingResult(AreaTimeseries entry, int tileCount) {
    }

    /**
     * Processes the raster referenced by an ETL job.
     *
     * @throws ResourceNotFoundException
     *             if the area does not exist
     * @throws energyprogress.etl.exceptions.ObjectNotFoundException
     *             if the raster object is missing
     * @throws energyprogress.etl.exceptions.RasterDecodingException
     *             if the raster cannot be decoded
     * @throws energyprogress.etl.exceptions.DataQualityException
     *             if no valid pixel falls inside the polygon
     * @throws energyprogress.etl.exceptions.StorageException
     *             if a download or tile upload fails
     * @throws IOException
     *             if local work files cannot be written
     * @throws InterruptedException
     *             if the worker was cancelled; nothing is written after the flag is seen
     */
    public RasterProcessingResult process(EtlJobPayload payload) throws IOException, InterruptedException {
        Span span = tracer.spanBuilder("raster.process").setAttribute("area_id", payload.areaId())
                .setAttribute("month", payload.month().toString()).setAttribute("raster_key", payload.rasterKey())
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            storageGateway.ensureBuckets();

            Area area = areaStore.findById(payload.areaId())
                    .orElseThrow(() -> new ResourceNotFoundException("Area " + payload.areaId() + " not found"));

            Path work = createWorkDirectory(payload);
            try {
                byte[] bytes = storageGateway.get(BucketType.RASTERS, payload.rasterKey());
                GeoRaster raster = GeoTiffDecoder.decode(bytes, defaultNodata);

                boolean[] mask = PolygonMask.build(raster, area.geom, allTouched);
                ZonalStatistics stats = ZonalStatisticsCalculator.compute(raster, mask, litThreshold);
                LOG.infof("Area %d %s: %d valid pixels, mean=%.4f, lit=%.2f%%", payload.areaId(), payload.month(),
                        stats.validPixelCount(), stats.mean(), stats.litPercentage());

                checkCancelled(payload);
                List<RenderedTile> tiles = tileRenderer.render(raster, mask, stats.min(), stats.max(), minZoom,
                        maxZoom, work.resolve("tiles"));

                String prefix = tilePrefix(payload.areaId(), payload.month());
                for (RenderedTile tile : tiles) {
                    checkCancelled(payload);
                    storageGateway.put(BucketType.TILES, prefix + "/" + tile.coordinate().path(),
                            Files.readAllBytes(tile.file()), "image/png");
                }
                metrics.tilesGenerated(tiles.size());
                LOG.infof("Uploaded %d tiles under %s/%s", tiles.size(),
                        storageGateway.bucketName(BucketType.TILES), prefix);

                AreaTimeseries entry = buildEntry(payload, raster, stats, tiles.size());
                checkCancelled(payload);
                timeseriesStore.upsert(entry);

                span.setAttribute("tile_count", tiles.size());
                return new RasterProcessingResult(entry, tiles.size());
            } finally {
                deleteRecursively(work);
            }

        } catch (RuntimeException | IOException | InterruptedException e) {
            span.recordException(e);
            throw e;

        } finally {
            span.end();
        }
    }

    /**
     * Object key prefix for one (area, month) tile set, e.g. {@code 42/2023_01}.
     */
    public static String tilePrefix(Long areaId, YearMonth month) {
        return String.format("%d/%d_%02d", areaId, month.getYear(), month.getMonthValue());
    }

    // a timed-out worker is cancelled with an interrupt; stop before the next write
    private static void checkCancelled(EtlJobPayload payload) throws InterruptedException {
        if (Thread.interrupted()) {
            LOG.warnf("Processing of area %d %s cancelled", payload.areaId(), payload.month());
            throw new InterruptedException("processing of area " + payload.areaId() + " " + payload.month()
                    + " cancelled");
        }
    }

    private AreaTimeseries buildEntry(EtlJobPayload payload, GeoRaster raster, ZonalStatistics stats,
            int tileCount) {
        AreaTimeseries entry = new AreaTimeseries();
        entry.areaId = payload.areaId();
        entry.month = payload.monthStart();
        entry.meanBrightness = stats.mean();
        entry.medianBrightness = stats.median();
        entry.sumBrightness = stats.sum();
        entry.litPixelCount = stats.litPixelCount();
        entry.litPercentage = stats.litPercentage();
        entry.tilePathPattern = storageGateway.bucketName(BucketType.TILES) + "/"
                + tilePrefix(payload.areaId(), payload.month()) + "/{z}/{x}/{y}.png";
        entry.rasterPath = storageGateway.bucketName(BucketType.RASTERS) + "/" + payload.rasterKey();
        entry.minZoom = minZoom;
        entry.maxZoom = maxZoom;
        entry.boundingBox = raster.bounds().toMap();

        Map<String, Object> meta = new HashMap<>();
        meta.put("processed_at", Instant.now().toString());
        meta.put("threshold", litThreshold);
        meta.put("total_pixel_count", stats.validPixelCount());
        meta.put("tile_count", tileCount);
        entry.metadata = meta;
        return entry;
    }

    private Path createWorkDirectory(EtlJobPayload payload) throws IOException {
        String prefix = "etl-" + payload.areaId() + "-" + payload.month() + "-";
        if (workDir.isPresent()) {
            Path base = Paths.get(workDir.get());
            Files.createDirectories(base);
            return Files.createTempDirectory(base, prefix);
        }
        return Files.createTempDirectory(prefix);
    }

    private static void deleteRecursively(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    LOG.warnf(e, "Failed to delete work file %s", path);
                }
            });
        } catch (IOException e) {
            LOG.warnf(e, "Failed to clean up work directory %s", root);
        }
    }
}
