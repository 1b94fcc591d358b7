package energyprogress.etl.raster;

import java.util.ArrayList;
import java.util.List;

/**
 * XYZ tile address in the Web Mercator (EPSG:3857) pyramid, y counted from the north.
 */
public record TileCoordinate(int z, int x, int y) {

    /** Latitude limit of the square Web Mercator world. */
    public static final double MAX_LATITUDE = 85.0511287798066;

    public TileCoordinate {
        int n = 1 << z;
        if (z < 0 || x < 0 || y < 0 || x >= n || y >= n) {
            throw new IllegalArgumentException("Invalid tile " + z + "/" + x + "/" + y);
        }
    }

    public static int tileX(double lon, int z) {
        int n = 1 << z;
        int x = (int) Math.floor((lon + 180.0) / 360.0 * n);
        return Math.max(0, Math.min(n - 1, x));
    }

    public static int tileY(double lat, int z) {
        int n = 1 << z;
        int y = (int) Math.floor(mercatorFraction(lat) * n);
        return Math.max(0, Math.min(n - 1, y));
    }

    /**
     * Longitude at a fractional global tile x.
     */
    public static double longitude(double tileX, int z) {
        return tileX / (1 << z) * 360.0 - 180.0;
    }

    /**
     * Latitude at a fractional global tile y.
     */
    public static double latitude(double tileY, int z) {
        double n = Math.PI * (1.0 - 2.0 * tileY / (1 << z));
        return Math.toDegrees(Math.atan(Math.sinh(n)));
    }

    /**
     * Tiles at zoom {@code z} intersecting {@code bounds}, row by row from the north-west.
     */
    public static List<TileCoordinate> covering(BoundingBox bounds, int z) {
        int minX = tileX(bounds.minX(), z);
        int maxX = tileX(Math.nextDown(bounds.maxX()), z);
        int minY = tileY(bounds.maxY(), z);
        int maxY = tileY(Math.nextUp(bounds.minY()), z);
        List<TileCoordinate> tiles = new ArrayList<>((maxX - minX + 1) * (maxY - minY + 1));
        for (int ty = minY; ty <= maxY; ty++) {
            for (int tx = minX; tx <= maxX; tx++) {
                tiles.add(new TileCoordinate(z, tx, ty));
            }
        }
        return tiles;
    }

    public double west() {
        return longitude(x, z);
    }

    public double east() {
        return longitude(x + 1, z);
    }

    public double north() {
        return latitude(y, z);
    }

    public double south() {
        return latitude(y + 1, z);
    }

    /**
     * Relative path {@code z/x/y.png}.
     */
    public String path() {
        return z + "/" + x + "/" + y + ".png";
    }

    private static double mercatorFraction(double lat) {
        double clamped = Math.max(-MAX_LATITUDE, Math.min(MAX_LATITUDE, lat));
        double rad = Math.toRadians(clamped);
        return (1.0 - Math.log(Math.tan(rad) + 1.0 / Math.cos(rad)) / Math.PI) / 2.0;
    }
}
