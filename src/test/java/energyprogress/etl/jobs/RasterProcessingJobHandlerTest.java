package energyprogress.etl.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import energyprogress.etl.data.models.AreaTimeseries;
import energyprogress.etl.data.models.ProcessingJob;
import energyprogress.etl.raster.TilePyramidRenderer;
import energyprogress.etl.services.JobDispatchService;
import energyprogress.etl.services.RasterProcessingService;
import energyprogress.etl.services.StorageGateway;
import energyprogress.etl.testing.Fixtures;
import energyprogress.etl.testing.GeoTiffFixtures;
import energyprogress.etl.testing.InMemoryAreaStore;
import energyprogress.etl.testing.InMemoryObjectStore;
import energyprogress.etl.testing.InMemoryTimeseriesStore;
import energyprogress.etl.testing.TestBeans;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Runs {@code etl_processing} jobs through the dispatcher and checks the recorded outcome and the timeseries table.
 */
class RasterProcessingJobHandlerTest {

    private static final LocalDate JANUARY = LocalDate.of(2023, 1, 1);

    @TempDir
    Path workDir;

    private InMemoryObjectStore objectStore;
    private InMemoryTimeseriesStore timeseriesStore;
    private JobDispatchService dispatcher;

    @BeforeEach
    void setUp() {
        objectStore = new InMemoryObjectStore();
        timeseriesStore = new InMemoryTimeseriesStore();
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        StorageGateway storageGateway = TestBeans.storageGateway(objectStore.client(), meterRegistry);
        InMemoryAreaStore areaStore = new InMemoryAreaStore();
        areaStore.add(42L, "test-area", Fixtures.AREA_RING);

        TilePyramidRenderer renderer = new TilePyramidRenderer();
        TestBeans.setField(renderer, "tileSize", 16);

        RasterProcessingService service = new RasterProcessingService();
        TestBeans.setField(service, "storageGateway", storageGateway);
        TestBeans.setField(service, "areaStore", areaStore);
        TestBeans.setField(service, "timeseriesStore", timeseriesStore);
        TestBeans.setField(service, "tileRenderer", renderer);
        TestBeans.setField(service, "metrics", TestBeans.metrics(meterRegistry));
        TestBeans.setField(service, "tracer", TestBeans.TRACER);
        TestBeans.setField(service, "litThreshold", 1.0);
        TestBeans.setField(service, "defaultNodata", 0.0);
        TestBeans.setField(service, "allTouched", true);
        TestBeans.setField(service, "minZoom", 2);
        TestBeans.setField(service, "maxZoom", 2);
        TestBeans.setField(service, "workDir", Optional.of(workDir.toString()));

        RasterProcessingJobHandler handler = new RasterProcessingJobHandler();
        TestBeans.setField(handler, "rasterProcessingService", service);
        TestBeans.setField(handler, "storageGateway", storageGateway);

        dispatcher = new JobDispatchService(List.of(handler), TestBeans.TRACER, TestBeans.metrics(meterRegistry));
    }

    /**
     * Test: A bucket-qualified raster_path is resolved to the object key inside the rasters bucket.
     */
    @Test
    void testExecute_bucketQualifiedRasterPath() {
        objectStore.putObject("rasters", "42/2023_01/viirs_ntl.tif", Fixtures.areaGeoTiff());

        JobOutcome outcome = dispatcher.execute(job(Map.of("raster_path", "rasters/42/2023_01/viirs_ntl.tif")));

        assertTrue(outcome.succeeded(), outcome.errorMessage());
        assertEquals("tiles/42/2023_01/{z}/{x}/{y}.png", outcome.metadata().get("tile_path_pattern"));
        AreaTimeseries row = timeseriesStore.find(42L, JANUARY).orElseThrow();
        assertEquals("rasters/42/2023_01/viirs_ntl.tif", row.rasterPath);
    }

    /**
     * Test: A month whose raster has no valid pixel in the area fails as a data quality error and keeps the old row.
     */
    @Test
    void testExecute_noValidPixelsFailsJob() {
        timeseriesStore.upsert(previousRow());
        objectStore.putObject("rasters", "42/2023_01/viirs_ntl.tif",
                GeoTiffFixtures.geoTiff(GeoTiffFixtures.uniform(30, 30, 10, 10, 40, 40, 0f)));

        JobOutcome outcome = dispatcher.execute(job(Map.of("raster_key", "42/2023_01/viirs_ntl.tif")));

        assertFalse(outcome.succeeded());
        assertEquals("Data quality error: No valid pixels inside the area polygon", outcome.errorMessage());
        assertPreviousRowIntact();
    }

    /**
     * Test: A failed tile upload fails the job as a storage error and keeps the old row.
     */
    @Test
    void testExecute_tileUploadFailureFailsJob() {
        timeseriesStore.upsert(previousRow());
        objectStore.putObject("rasters", "42/2023_01/viirs_ntl.tif", Fixtures.areaGeoTiff());
        objectStore.createBucket("tiles");
        objectStore.rejectUploads("tiles");

        JobOutcome outcome = dispatcher.execute(job(Map.of("raster_key", "42/2023_01/viirs_ntl.tif")));

        assertFalse(outcome.succeeded());
        assertTrue(outcome.errorMessage().startsWith("Storage error: Upload of 42/2023_01/"), outcome.errorMessage());
        assertPreviousRowIntact();
    }

    /**
     * Test: An undecodable raster fails the job as a data quality error and keeps the old row.
     */
    @Test
    void testExecute_corruptRasterFailsJob() {
        timeseriesStore.upsert(previousRow());
        objectStore.putObject("rasters", "42/2023_01/viirs_ntl.tif", "not a tiff".getBytes());

        JobOutcome outcome = dispatcher.execute(job(Map.of("raster_key", "42/2023_01/viirs_ntl.tif")));

        assertFalse(outcome.succeeded());
        assertTrue(outcome.errorMessage().startsWith("Data quality error: "), outcome.errorMessage());
        assertPreviousRowIntact();
    }

    private static ProcessingJob job(Map<String, Object> metadata) {
        return ProcessingJob.newPending(42L, JobType.ETL_PROCESSING, JANUARY, null, new HashMap<>(metadata));
    }

    private static AreaTimeseries previousRow() {
        AreaTimeseries row = new AreaTimeseries();
        row.areaId = 42L;
        row.month = JANUARY;
        row.meanBrightness = 7.5;
        row.litPixelCount = 200;
        row.litPercentage = 50.0;
        row.tilePathPattern = "tiles/42/2023_01/{z}/{x}/{y}.png";
        return row;
    }

    private void assertPreviousRowIntact() {
        assertEquals(1, timeseriesStore.countRecords());
        AreaTimeseries row = timeseriesStore.find(42L, JANUARY).orElseThrow();
        assertEquals(7.5, row.meanBrightness);
        assertEquals(200, row.litPixelCount);
        assertEquals(50.0, row.litPercentage);
    }
}
