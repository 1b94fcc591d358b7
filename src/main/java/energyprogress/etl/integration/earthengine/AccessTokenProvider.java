package energyprogress.etl.integration.earthengine;

/**
 * Supplies OAuth2 bearer tokens for Earth Engine requests.
 */
@FunctionalInterface
public interface AccessTokenProvider {

    /**
     * Returns a currently valid access token, refreshing it when needed.
     *
     * @throws energyprogress.etl.exceptions.ExternalServiceException
     *             if credentials cannot be loaded or refreshed
     */
    String accessToken();
}
