package energyprogress.etl.testing;

import energyprogress.etl.raster.GeoRaster;

/**
 * Shared test geometry.
 */
public final class Fixtures {

    /** A pentagon-like area, lon/lat pairs. */
    public static final double[][] AREA_RING = {{30, 10}, {40, 40}, {20, 40}, {10, 20}, {30, 10}};

    private Fixtures() {
    }

    /**
     * One-degree raster over the {@link #AREA_RING} envelope with values rising eastwards (1 .. 30).
     */
    public static GeoRaster areaRaster() {
        int size = 30;
        float[] values = new float[size * size];
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                values[row * size + col] = col + 1;
            }
        }
        return new GeoRaster(size, size, values, 10, 40, 1, 1, 0.0);
    }

    public static byte[] areaGeoTiff() {
        return GeoTiffFixtures.geoTiff(areaRaster());
    }
}
