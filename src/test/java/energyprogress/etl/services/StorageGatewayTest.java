package energyprogress.etl.services;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import energyprogress.etl.api.types.StorageUploadResultType;
import energyprogress.etl.exceptions.ObjectNotFoundException;
import energyprogress.etl.exceptions.StorageException;
import energyprogress.etl.services.StorageGateway.BucketType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.CreateBucketResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutBucketPolicyRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Unit tests for StorageGateway covering bucket initialization, put/get and error mapping.
 */
class StorageGatewayTest {

    private StorageGateway storageGateway;
    private S3Client s3Client;
    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() throws Exception {
        s3Client = mock(S3Client.class);
        meterRegistry = new SimpleMeterRegistry();
        Tracer tracer = OpenTelemetry.noop().getTracer("test");

        storageGateway = new StorageGateway();

        // Use reflection to inject mocked dependencies
        setField(storageGateway, "s3Client", s3Client);
        setField(storageGateway, "tracer", tracer);
        setField(storageGateway, "meterRegistry", meterRegistry);

        // Inject config properties
        setField(storageGateway, "rastersBucket", "rasters");
        setField(storageGateway, "tilesBucket", "tiles");
        setField(storageGateway, "tilesPublicRead", true);
    }

    /**
     * Test: Successful upload returns expected result with metadata.
     */
    @Test
    void testPut_success() {
        byte[] data = "raster-bytes".getBytes();
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());

        StorageUploadResultType result = storageGateway.put(BucketType.RASTERS, "42/rasters/viirs/2023_01.tif", data,
                "image/tiff");

        assertEquals("rasters", result.bucket());
        assertEquals("42/rasters/viirs/2023_01.tif", result.objectKey());
        assertEquals("image/tiff", result.contentType());
        assertEquals((long) data.length, result.sizeBytes());
        assertNotNull(result.uploadedAt());

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
        assertEquals("rasters", captor.getValue().bucket());
        assertEquals("image/tiff", captor.getValue().contentType());
        assertEquals(1.0, meterRegistry.get("storage.uploads.total").tag("status", "success").counter().count());
    }

    /**
     * Test: Upload failure is raised as a StorageException carrying the HTTP status.
     */
    @Test
    void testPut_failure() {
        S3Exception denied = (S3Exception) S3Exception.builder().message("Access Denied").statusCode(403).build();
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class))).thenThrow(denied);

        StorageException exception = assertThrows(StorageException.class,
                () -> storageGateway.put(BucketType.TILES, "42/2023_01/8/1/2.png", new byte[] {1}, "image/png"));

        assertEquals(403, exception.getStatusCode());
        assertTrue(exception.getMessage().contains("42/2023_01/8/1/2.png"));
        assertEquals(1.0, meterRegistry.get("storage.uploads.total").tag("status", "failure").counter().count());
    }

    /**
     * Test: Successful download returns raw bytes.
     */
    @Test
    void testGet_success() {
        byte[] data = "raster-bytes".getBytes();
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), data));

        assertArrayEquals(data, storageGateway.get(BucketType.RASTERS, "42/rasters/viirs/2023_01.tif"));
    }

    /**
     * Test: A missing object maps to ObjectNotFoundException.
     */
    @Test
    void testGet_missingObject() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("no such key").statusCode(404).build());

        StorageException exception = assertThrows(StorageException.class,
                () -> storageGateway.get(BucketType.RASTERS, "missing.tif"));

        assertInstanceOf(ObjectNotFoundException.class, exception);
        assertEquals(404, exception.getStatusCode());
    }

    /**
     * Test: Transport failures map to StorageException.
     */
    @Test
    void testGet_transportFailure() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(SdkClientException.create("Connection refused"));

        StorageException exception = assertThrows(StorageException.class,
                () -> storageGateway.get(BucketType.TILES, "8/1/2.png"));

        assertFalse(exception instanceof ObjectNotFoundException);
        assertTrue(exception.getMessage().contains("Connection refused"));
    }

    /**
     * Test: Missing buckets are created and the tiles bucket gets a public read policy.
     */
    @Test
    void testEnsureBuckets_createsMissingBuckets() {
        when(s3Client.headBucket(any(HeadBucketRequest.class)))
                .thenThrow(NoSuchBucketException.builder().message("missing").statusCode(404).build());
        when(s3Client.createBucket(any(CreateBucketRequest.class))).thenReturn(CreateBucketResponse.builder().build());

        storageGateway.ensureBuckets();

        assertTrue(storageGateway.bucketsReady());
        verify(s3Client, times(2)).createBucket(any(CreateBucketRequest.class));
        ArgumentCaptor<PutBucketPolicyRequest> policy = ArgumentCaptor.forClass(PutBucketPolicyRequest.class);
        verify(s3Client).putBucketPolicy(policy.capture());
        assertEquals("tiles", policy.getValue().bucket());
        assertTrue(policy.getValue().policy().contains("arn:aws:s3:::tiles/*"));
    }

    /**
     * Test: Once buckets exist, later calls do not touch the store.
     */
    @Test
    void testEnsureBuckets_cachedAfterSuccess() {
        when(s3Client.headBucket(any(HeadBucketRequest.class))).thenReturn(HeadBucketResponse.builder().build());

        storageGateway.ensureBuckets();
        storageGateway.ensureBuckets();

        verify(s3Client, times(2)).headBucket(any(HeadBucketRequest.class));
        verify(s3Client, never()).createBucket(any(CreateBucketRequest.class));
    }

    /**
     * Test: An unreachable store fails initialization, and the next call tries again.
     */
    @Test
    void testEnsureBuckets_retriesAfterFailure() {
        when(s3Client.headBucket(any(HeadBucketRequest.class)))
                .thenThrow(SdkClientException.create("Connection refused"))
                .thenReturn(HeadBucketResponse.builder().build());

        assertThrows(StorageException.class, () -> storageGateway.ensureBuckets());
        assertFalse(storageGateway.bucketsReady());

        storageGateway.ensureBuckets();
        assertTrue(storageGateway.bucketsReady());
    }

    /**
     * Test: Bucket names come from configuration.
     */
    @Test
    void testBucketName() {
        assertEquals("rasters", storageGateway.bucketName(BucketType.RASTERS));
        assertEquals("tiles", storageGateway.bucketName(BucketType.TILES));
    }

    /**
     * Helper method to set private fields via reflection.
     */
    private void setField(Object target, String fieldName, Object value) throws Exception {
        java.lang.reflect.Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }
}
