package energyprogress.etl.config;

import java.net.URI;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

/**
 * Produces the {@link S3Client} used by {@code StorageGateway} for MinIO (dev) or any S3-compatible store.
 *
 * <p>
 * Building the client opens no connection, so the application starts even when the object store is down; buckets are
 * created lazily on the first job that needs them.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code energyprogress.storage.endpoint} - Endpoint override, e.g. {@code http://minio:9000}</li>
 * <li>{@code energyprogress.storage.region} - Signing region (default: us-east-1)</li>
 * <li>{@code energyprogress.storage.access-key} / {@code secret-key} - Static credentials; when absent the AWS default
 * chain is used</li>
 * <li>{@code energyprogress.storage.path-style} - Path-style addressing, required by MinIO (default: true)</li>
 * </ul>
 */
@ApplicationScoped
public class StorageConfig {

    private static final Logger LOG = Logger.getLogger(StorageConfig.class);

    @ConfigProperty(
            name = "energyprogress.storage.endpoint")
    Optional<String> endpoint;

    @ConfigProperty(
            name = "energyprogress.storage.region",
            defaultValue = "us-east-1")
    String region;

    @ConfigProperty(
            name = "energyprogress.storage.access-key")
    Optional<String> accessKey;

    @ConfigProperty(
            name = "energyprogress.storage.secret-key")
    Optional<String> secretKey;

    @ConfigProperty(
            name = "energyprogress.storage.path-style",
            defaultValue = "true")
    boolean pathStyle;

    @ConfigProperty(
            name = "energyprogress.storage.buckets.rasters",
            defaultValue = "rasters")
    String rastersBucket;

    @ConfigProperty(
            name = "energyprogress.storage.buckets.tiles",
            defaultValue = "tiles")
    String tilesBucket;

    private S3Client client;

    @Produces
    @Singleton
    public S3Client createS3Client() {
        boolean staticCredentials = accessKey.isPresent() && secretKey.isPresent();
        LOG.infof("Creating S3Client: endpoint=%s, region=%s, pathStyle=%s, buckets=[%s, %s], staticCredentials=%s",
                endpoint.orElse("<aws default>"), region, pathStyle, rastersBucket, tilesBucket, staticCredentials);

        AwsCredentialsProvider credentials = staticCredentials
                ? StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey.get(), secretKey.get()))
                : DefaultCredentialsProvider.create();

        var builder = S3Client.builder().region(Region.of(region)).credentialsProvider(credentials)
                .httpClientBuilder(UrlConnectionHttpClient.builder())
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(pathStyle).build());
        endpoint.ifPresent(uri -> builder.endpointOverride(URI.create(uri)));

        client = builder.build();
        return client;
    }

    @PreDestroy
    void close() {
        if (client != null) {
            client.close();
        }
    }
}
