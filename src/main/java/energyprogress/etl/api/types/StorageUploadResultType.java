package energyprogress.etl.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Type representing the result of a successful storage upload operation.
 *
 * <p>
 * Returned by StorageGateway after writing a raster or a tile to the object store.
 *
 * @param objectKey
 *            deterministic object key (e.g., "42/rasters/viirs/2023_01.tif")
 * @param bucket
 *            bucket name where object was stored
 * @param sizeBytes
 *            size of uploaded object in bytes
 * @param contentType
 *            MIME type of uploaded object ("image/tiff" or "image/png")
 * @param uploadedAt
 *            ISO 8601 timestamp when upload completed
 */
public record StorageUploadResultType(@JsonProperty("object_key") String objectKey, String bucket,
        @JsonProperty("size_bytes") Long sizeBytes, @JsonProperty("content_type") String contentType,
        @JsonProperty("uploaded_at") String uploadedAt) {
}
