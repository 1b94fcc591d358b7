package energyprogress.etl.exceptions;

/**
 * Thrown by {@code StorageGateway.get} when the requested key does not exist in the bucket.
 */
public class ObjectNotFoundException extends StorageException {

    private final String bucket;
    private final String objectKey;

    public ObjectNotFoundException(String bucket, String objectKey, Throwable cause) {
        super("Object not found: " + bucket + "/" + objectKey, 404, cause);
        this.bucket = bucket;
        this.objectKey = objectKey;
    }

    public String getBucket() {
        return bucket;
    }

    public String getObjectKey() {
        return objectKey;
    }
}
