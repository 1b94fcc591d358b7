package energyprogress.etl.integration.earthengine;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.YearMonth;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Polygon;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import energyprogress.etl.exceptions.ExternalServiceException;
import energyprogress.etl.exceptions.ValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * HTTP client for the Earth Engine REST API ({@code image:computePixels}).
 *
 * <h2>Request</h2>
 * <ul>
 * <li>Endpoint: {@code POST {base-url}/v1/projects/{project}/image:computePixels}</li>
 * <li>Authentication: OAuth 2.0 bearer token with the earthengine scope</li>
 * <li>Expression: {@code ImageCollection.load(collection)}, filtered to the month, mean-reduced, band selected and
 * clipped to the area polygon</li>
 * <li>Grid: EPSG:4326 over the polygon envelope, pixel size derived from {@code scale-meters}, each side capped at
 * {@code max-dimension} pixels</li>
 * <li>Response: raw GeoTIFF bytes</li>
 * </ul>
 *
 * <h2>Usage</h2>
 *
 * <pre>
 * {@code
 * @Inject
 * ImageryProvider imagery;
 *
 * byte[] geotiff = imagery.fetchMonthlyComposite(area.geom, YearMonth.of(2023, 1));
 * }
 * </pre>
 *
 * @see <a href="https://developers.google.com/earth-engine/reference/rest/v1/projects.image/computePixels">computePixels
 *      reference</a>
 */
@ApplicationScoped
public class EarthEngineClient implements ImageryProvider {

    private static final Logger LOG = Logger.getLogger(EarthEngineClient.class);

    static final String SERVICE = "earth-engine";

    /** Meters per degree of latitude, used to turn the export scale into a degree grid. */
    private static final double METERS_PER_DEGREE = 111_320.0;

    private static final int MAX_ERROR_BODY = 500;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AccessTokenProvider tokenProvider;

    @ConfigProperty(
            name = "energyprogress.imagery.base-url",
            defaultValue = "https://earthengine.googleapis.com")
    String baseUrl;

    @ConfigProperty(
            name = "energyprogress.imagery.project",
            defaultValue = "earthengine-legacy")
    String project;

    @ConfigProperty(
            name = "energyprogress.imagery.source",
            defaultValue = "viirs")
    String source;

    @ConfigProperty(
            name = "energyprogress.imagery.collection",
            defaultValue = "NOAA/VIIRS/DNB/MONTHLY_V1/VCMSLCFG")
    String collection;

    @ConfigProperty(
            name = "energyprogress.imagery.band",
            defaultValue = "avg_rad")
    String band;

    @ConfigProperty(
            name = "energyprogress.imagery.scale-meters",
            defaultValue = "500")
    double scaleMeters;

    @ConfigProperty(
            name = "energyprogress.imagery.max-dimension",
            defaultValue = "4096")
    int maxDimension;

    @ConfigProperty(
            name = "energyprogress.imagery.request-timeout",
            defaultValue = "PT2M")
    Duration requestTimeout;

    @Inject
    public EarthEngineClient(ObjectMapper objectMapper, AccessTokenProvider tokenProvider) {
        this.objectMapper = objectMapper;
        this.tokenProvider = tokenProvider;
        this.httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10)).build();
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public byte[] fetchMonthlyComposite(Polygon area, YearMonth month) {
        String body = buildRequestBody(area, month);
        URI uri = URI.create(baseUrl + "/v1/projects/" + project + "/image:computePixels");

        HttpRequest request = HttpRequest.newBuilder().uri(uri).timeout(requestTimeout)
                .header("Authorization", "Bearer " + tokenProvider.accessToken())
                .header("Content-Type", "application/json").header("Accept", "image/tiff")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8)).build();

        long startTime = System.currentTimeMillis();
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            LOG.errorf(e, "Earth Engine request for %s failed", month);
            throw new ExternalServiceException(SERVICE, "computePixels request for " + month + " failed: "
                    + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException(SERVICE, "computePixels request for " + month + " interrupted", e);
        }
        long latency = System.currentTimeMillis() - startTime;

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String detail = truncate(new String(response.body(), StandardCharsets.UTF_8));
            LOG.errorf("Earth Engine returned status %d for %s: %s", status, month, detail);
            throw new ExternalServiceException(SERVICE,
                    "computePixels for " + month + " returned HTTP " + status + ": " + detail, status, null);
        }
        if (response.body().length == 0) {
            throw new ExternalServiceException(SERVICE, "computePixels for " + month + " returned an empty body",
                    status, null);
        }

        LOG.infof("Fetched %s composite for %s (%d bytes, latency: %dms)", source, month, response.body().length,
                latency);
        return response.body();
    }

    /**
     * Builds the computePixels JSON body.
     */
    String buildRequestBody(Polygon area, YearMonth month) {
        if (area == null || area.isEmpty()) {
            throw new ValidationException("Area polygon is empty");
        }

        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode expression = root.putObject("expression");
        expression.put("result", "0");
        expression.putObject("values").set("0", expressionGraph(area, month));
        root.put("fileFormat", "GEO_TIFF");
        root.set("grid", grid(area.getEnvelopeInternal()));

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize computePixels request", e);
        }
    }

    private ObjectNode expressionGraph(Polygon area, YearMonth month) {
        ObjectNode load = invocation("ImageCollection.load");
        args(load).set("id", constant(collection));

        ObjectNode dateRange = invocation("DateRange");
        args(dateRange).set("start", constant(month.atDay(1).toString()));
        args(dateRange).set("end", constant(month.plusMonths(1).atDay(1).toString()));

        ObjectNode dateFilter = invocation("Filter.dateRangeContains");
        args(dateFilter).set("leftValue", dateRange);
        args(dateFilter).set("rightField", constant("system:time_start"));

        ObjectNode filtered = invocation("Collection.filter");
        args(filtered).set("collection", load);
        args(filtered).set("filter", dateFilter);

        ObjectNode mean = invocation("ImageCollection.reduce");
        args(mean).set("collection", filtered);
        args(mean).set("reducer", invocation("Reducer.mean"));

        ObjectNode select = invocation("Image.select");
        args(select).set("input", mean);
        ArrayNode selectors = objectMapper.createArrayNode().add(band + ".*");
        args(select).set("bandSelectors", objectMapper.createObjectNode().set("constantValue", selectors));

        ObjectNode polygon = invocation("GeometryConstructors.Polygon");
        args(polygon).set("coordinates", objectMapper.createObjectNode().set("constantValue", rings(area)));

        ObjectNode clip = invocation("Image.clip");
        args(clip).set("input", select);
        args(clip).set("geometry", polygon);
        return clip;
    }

    private ObjectNode grid(Envelope env) {
        double pixel = scaleMeters / METERS_PER_DEGREE;
        int width = Math.max(1, (int) Math.ceil(env.getWidth() / pixel));
        int height = Math.max(1, (int) Math.ceil(env.getHeight() / pixel));
        if (width > maxDimension || height > maxDimension) {
            pixel = Math.max(env.getWidth(), env.getHeight()) / maxDimension;
            width = Math.max(1, (int) Math.ceil(env.getWidth() / pixel));
            height = Math.max(1, (int) Math.ceil(env.getHeight() / pixel));
            LOG.debugf("Coarsened export grid to %g degrees to stay within %d pixels", pixel, maxDimension);
        }

        ObjectNode grid = objectMapper.createObjectNode();
        ObjectNode dimensions = grid.putObject("dimensions");
        dimensions.put("width", width);
        dimensions.put("height", height);
        ObjectNode transform = grid.putObject("affineTransform");
        transform.put("scaleX", pixel);
        transform.put("shearX", 0.0);
        transform.put("translateX", env.getMinX());
        transform.put("shearY", 0.0);
        transform.put("scaleY", -pixel);
        transform.put("translateY", env.getMaxY());
        grid.put("crsCode", "EPSG:4326");
        return grid;
    }

    private ArrayNode rings(Polygon area) {
        ArrayNode rings = objectMapper.createArrayNode();
        ArrayNode shell = rings.addArray();
        for (Coordinate c : area.getExteriorRing().getCoordinates()) {
            shell.addArray().add(c.getX()).add(c.getY());
        }
        return rings;
    }

    private ObjectNode invocation(String functionName) {
        ObjectNode node = objectMapper.createObjectNode();
        ObjectNode call = node.putObject("functionInvocationValue");
        call.put("functionName", functionName);
        call.putObject("arguments");
        return node;
    }

    private static ObjectNode args(ObjectNode invocation) {
        return (ObjectNode) invocation.get("functionInvocationValue").get("arguments");
    }

    private ObjectNode constant(String value) {
        return objectMapper.createObjectNode().put("constantValue", value);
    }

    private static String truncate(String body) {
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }
}
