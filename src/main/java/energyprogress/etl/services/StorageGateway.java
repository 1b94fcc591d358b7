package energyprogress.etl.services;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import energyprogress.etl.api.types.StorageUploadResultType;
import energyprogress.etl.exceptions.ObjectNotFoundException;
import energyprogress.etl.exceptions.StorageException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutBucketPolicyRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * StorageGateway service for the rasters and tiles buckets (MinIO for dev, any S3-compatible store in prod).
 *
 * <p>
 * This service provides:
 * <ul>
 * <li>{@link #put} and {@link #get} against the two logical buckets, with deterministic keys chosen by callers</li>
 * <li>Lazy bucket initialization via {@link #ensureBuckets()}, cheap once buckets exist and retried on every call
 * until it succeeds</li>
 * <li>An anonymous read policy on the tiles bucket so map clients can fetch tiles directly</li>
 * <li>OpenTelemetry tracing and Micrometer metrics instrumentation</li>
 * </ul>
 *
 * <p>
 * Nothing here touches the network at construction time, so the scheduler starts even while the store is down.
 *
 * <p>
 * <b>Usage Example:</b>
 *
 * <pre>
 * storageGateway.ensureBuckets();
 * StorageUploadResultType result = storageGateway.put(BucketType.RASTERS, "42/rasters/viirs/2023_01.tif", bytes,
 *         "image/tiff");
 * byte[] raster = storageGateway.get(BucketType.RASTERS, result.objectKey());
 * </pre>
 */
@ApplicationScoped
public class StorageGateway {

    private static final Logger LOG = Logger.getLogger(StorageGateway.class);

    private static final String TILES_READ_POLICY = "{\"Version\":\"2012-10-17\",\"Statement\":[{\"Effect\":\"Allow\","
            + "\"Principal\":{\"AWS\":[\"*\"]},\"Action\":[\"s3:GetObject\"],\"Resource\":[\"arn:aws:s3:::%s/*\"]}]}";

    @Inject
    S3Client s3Client;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "energyprogress.storage.buckets.rasters",
            defaultValue = "rasters")
    String rastersBucket;

    @ConfigProperty(
            name = "energyprogress.storage.buckets.tiles",
            defaultValue = "tiles")
    String tilesBucket;

    @ConfigProperty(
            name = "energyprogress.storage.tiles-public-read",
            defaultValue = "true")
    boolean tilesPublicRead;

    private final AtomicBoolean bucketsReady = new AtomicBoolean(false);

    /**
     * Logical buckets used by the pipeline.
     */
    public enum BucketType {
        RASTERS, TILES
    }

    /**
     * Makes sure both buckets exist, creating any that are missing.
     *
     * <p>
     * Safe to call before every job. After the first success it returns immediately without contacting the store;
     * after a failure the next call tries again.
     *
     * @throws StorageException
     *             if the store is unreachable or refuses bucket creation
     */
    public void ensureBuckets() {
        if (bucketsReady.get()) {
            return;
        }
        synchronized (bucketsReady) {
            if (bucketsReady.get()) {
                return;
            }
            Span span = tracer.spanBuilder("storage.ensure_buckets").startSpan();
            try (Scope scope = span.makeCurrent()) {
                for (BucketType bucket : BucketType.values()) {
                    ensureBucket(bucket);
                }
                bucketsReady.set(true);
                span.setAttribute("buckets_ready", true);
                LOG.infof("Storage buckets ready: %s, %s", rastersBucket, tilesBucket);

            } catch (S3Exception e) {
                span.recordException(e);
                span.setAttribute("buckets_ready", false);
                LOG.warnf("Storage bucket initialization failed (will retry): %s", errorMessage(e));
                throw new StorageException("Bucket initialization failed: " + errorMessage(e), e.statusCode(), e);

            } catch (SdkException e) {
                span.recordException(e);
                span.setAttribute("buckets_ready", false);
                LOG.warnf("Storage bucket initialization failed (will retry): %s", e.getMessage());
                throw new StorageException("Bucket initialization failed: " + e.getMessage(), e);

            } finally {
                span.end();
            }
        }
    }

    /**
     * Whether a previous {@link #ensureBuckets()} call succeeded.
     */
    public boolean bucketsReady() {
        return bucketsReady.get();
    }

    /**
     * Writes an object, overwriting any object with the same key.
     *
     * @param bucket
     *            target bucket
     * @param objectKey
     *            deterministic object key
     * @param bytes
     *            object content
     * @param contentType
     *            MIME type stored with the object
     * @return upload result with object key and size
     * @throws StorageException
     *             if upload fails (network error, invalid credentials, etc.)
     */
    public StorageUploadResultType put(BucketType bucket, String objectKey, byte[] bytes, String contentType) {
        Span span = tracer.spanBuilder("storage.put").setAttribute("bucket", bucket.name())
                .setAttribute("object_key", objectKey).setAttribute("size_bytes", bytes.length).startSpan();

        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            String bucketName = bucketName(bucket);

            PutObjectRequest putRequest = PutObjectRequest.builder().bucket(bucketName).key(objectKey)
                    .contentType(contentType).build();

            s3Client.putObject(putRequest, RequestBody.fromBytes(bytes));

            long latencyMs = System.currentTimeMillis() - startTime;
            LOG.debugf("Uploaded %s/%s (%d bytes, %dms)", bucketName, objectKey, bytes.length, latencyMs);

            recordUploadMetrics(bucket, bytes.length, latencyMs, true);
            span.setAttribute("upload_success", true);

            return new StorageUploadResultType(objectKey, bucketName, (long) bytes.length, contentType,
                    Instant.now().toString());

        } catch (S3Exception e) {
            recordUploadMetrics(bucket, bytes.length, System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("upload_success", false);
            LOG.errorf(e, "Failed to upload %s/%s: %s", bucket, objectKey, errorMessage(e));
            throw new StorageException("Upload of " + objectKey + " failed: " + errorMessage(e), e.statusCode(), e);

        } catch (SdkException e) {
            recordUploadMetrics(bucket, bytes.length, System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("upload_success", false);
            LOG.errorf(e, "Failed to upload %s/%s: %s", bucket, objectKey, e.getMessage());
            throw new StorageException("Upload of " + objectKey + " failed: " + e.getMessage(), e);

        } finally {
            span.end();
        }
    }

    /**
     * Reads an object.
     *
     * @param bucket
     *            source bucket
     * @param objectKey
     *            full object key
     * @return raw object bytes
     * @throws ObjectNotFoundException
     *             if no object exists under the key
     * @throws StorageException
     *             for any other storage failure
     */
    public byte[] get(BucketType bucket, String objectKey) {
        Span span = tracer.spanBuilder("storage.get").setAttribute("bucket", bucket.name())
                .setAttribute("object_key", objectKey).startSpan();

        long startTime = System.currentTimeMillis();
        String bucketName = bucketName(bucket);

        try (Scope scope = span.makeCurrent()) {
            GetObjectRequest getRequest = GetObjectRequest.builder().bucket(bucketName).key(objectKey).build();

            byte[] bytes = s3Client.getObjectAsBytes(getRequest).asByteArray();

            long latencyMs = System.currentTimeMillis() - startTime;
            LOG.debugf("Downloaded %s/%s (%d bytes, %dms)", bucketName, objectKey, bytes.length, latencyMs);

            recordDownloadMetrics(bucket, bytes.length, latencyMs, true);
            span.setAttribute("download_success", true);
            span.setAttribute("size_bytes", bytes.length);

            return bytes;

        } catch (S3Exception e) {
            recordDownloadMetrics(bucket, 0, System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("download_success", false);
            if (e instanceof NoSuchKeyException || e.statusCode() == 404) {
                LOG.warnf("Object %s/%s not found", bucketName, objectKey);
                throw new ObjectNotFoundException(bucketName, objectKey, e);
            }
            LOG.errorf(e, "Failed to download %s/%s: %s", bucketName, objectKey, errorMessage(e));
            throw new StorageException("Download of " + objectKey + " failed: " + errorMessage(e), e.statusCode(), e);

        } catch (SdkException e) {
            recordDownloadMetrics(bucket, 0, System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("download_success", false);
            LOG.errorf(e, "Failed to download %s/%s: %s", bucketName, objectKey, e.getMessage());
            throw new StorageException("Download of " + objectKey + " failed: " + e.getMessage(), e);

        } finally {
            span.end();
        }
    }

    /**
     * Resolves bucket name from configuration.
     *
     * @param bucket
     *            bucket type
     * @return configured bucket name
     */
    public String bucketName(BucketType bucket) {
        return switch (bucket) {
            case RASTERS -> rastersBucket;
            case TILES -> tilesBucket;
        };
    }

    private void ensureBucket(BucketType bucket) {
        String bucketName = bucketName(bucket);
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
            LOG.debugf("Bucket %s exists", bucketName);
            return;
        } catch (NoSuchBucketException e) {
            LOG.infof("Bucket %s missing, creating it", bucketName);
        } catch (S3Exception e) {
            if (e.statusCode() != 404) {
                throw e;
            }
            LOG.infof("Bucket %s missing, creating it", bucketName);
        }

        s3Client.createBucket(CreateBucketRequest.builder().bucket(bucketName).build());
        if (bucket == BucketType.TILES && tilesPublicRead) {
            s3Client.putBucketPolicy(PutBucketPolicyRequest.builder().bucket(bucketName)
                    .policy(String.format(TILES_READ_POLICY, bucketName)).build());
            LOG.infof("Applied public read policy to bucket %s", bucketName);
        }
        Counter.builder("storage.buckets.created").tag("bucket", bucket.name().toLowerCase())
                .register(meterRegistry).increment();
    }

    private static String errorMessage(S3Exception e) {
        if (e.awsErrorDetails() != null && e.awsErrorDetails().errorMessage() != null) {
            return e.awsErrorDetails().errorMessage();
        }
        return e.getMessage();
    }

    /**
     * Records upload metrics for monitoring and alerting.
     */
    private void recordUploadMetrics(BucketType bucket, long bytes, long latencyMs, boolean success) {
        String status = success ? "success" : "failure";

        Counter.builder("storage.uploads.total").tag("bucket", bucket.name().toLowerCase()).tag("status", status)
                .register(meterRegistry).increment();

        if (success) {
            Counter.builder("storage.bytes.uploaded").tag("bucket", bucket.name().toLowerCase()).register(meterRegistry)
                    .increment(bytes);
        }

        Timer.builder("storage.upload.duration").tag("bucket", bucket.name().toLowerCase()).tag("status", status)
                .register(meterRegistry).record(Duration.ofMillis(latencyMs));
    }

    /**
     * Records download metrics for monitoring and alerting.
     */
    private void recordDownloadMetrics(BucketType bucket, long bytes, long latencyMs, boolean success) {
        String status = success ? "success" : "failure";

        Counter.builder("storage.downloads.total").tag("bucket", bucket.name().toLowerCase()).tag("status", status)
                .register(meterRegistry).increment();

        if (success) {
            Counter.builder("storage.bytes.downloaded").tag("bucket", bucket.name().toLowerCase())
                    .register(meterRegistry).increment(bytes);
        }

        Timer.builder("storage.download.duration").tag("bucket", bucket.name().toLowerCase()).tag("status", status)
                .register(meterRegistry).record(Duration.ofMillis(latencyMs));
    }
}
