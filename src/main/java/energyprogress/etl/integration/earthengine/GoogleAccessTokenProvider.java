package energyprogress.etl.integration.earthengine;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;

import energyprogress.etl.exceptions.ExternalServiceException;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * {@link AccessTokenProvider} backed by Google service-account credentials.
 *
 * <p>
 * Credentials are read from {@code energyprogress.imagery.credentials-path} when set, otherwise from the application
 * default credentials ({@code GOOGLE_APPLICATION_CREDENTIALS}). They are loaded on first use, so a missing key file
 * only fails export jobs and never application startup.
 */
@ApplicationScoped
public class GoogleAccessTokenProvider implements AccessTokenProvider {

    private static final Logger LOG = Logger.getLogger(GoogleAccessTokenProvider.class);

    static final String EARTH_ENGINE_SCOPE = "https://www.googleapis.com/auth/earthengine";

    @ConfigProperty(
            name = "energyprogress.imagery.credentials-path")
    Optional<String> credentialsPath;

    private GoogleCredentials credentials;

    @Override
    public synchronized String accessToken() {
        try {
            if (credentials == null) {
                credentials = loadCredentials().createScoped(List.of(EARTH_ENGINE_SCOPE));
            }
            credentials.refreshIfExpired();
            AccessToken token = credentials.getAccessToken();
            if (token == null) {
                throw new ExternalServiceException("earth-engine-auth", "Credentials returned no access token");
            }
            return token.getTokenValue();
        } catch (IOException e) {
            credentials = null;
            LOG.errorf(e, "Failed to obtain Earth Engine access token");
            throw new ExternalServiceException("earth-engine-auth",
                    "Failed to obtain Earth Engine access token: " + e.getMessage(), e);
        }
    }

    private GoogleCredentials loadCredentials() throws IOException {
        if (credentialsPath.isPresent()) {
            LOG.infof("Loading Earth Engine credentials from %s", credentialsPath.get());
            try (InputStream in = new FileInputStream(credentialsPath.get())) {
                return GoogleCredentials.fromStream(in);
            }
        }
        LOG.info("Loading Earth Engine credentials from application default credentials");
        return GoogleCredentials.getApplicationDefault();
    }
}
