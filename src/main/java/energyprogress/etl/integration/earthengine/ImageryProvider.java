package energyprogress.etl.integration.earthengine;

import java.time.YearMonth;

import org.locationtech.jts.geom.Polygon;

/**
 * Source of monthly nightlight composite rasters.
 */
public interface ImageryProvider {

    /**
     * Short source name used in raster object keys, e.g. {@code viirs}.
     */
    String source();

    /**
     * Builds the monthly mean composite of the nightlight band clipped to {@code area} and returns it as GeoTIFF
     * bytes in EPSG:4326.
     *
     * @throws energyprogress.etl.exceptions.ExternalServiceException
     *             if the provider is unreachable or rejects the request
     */
    byte[] fetchMonthlyComposite(Polygon area, YearMonth month);
}
