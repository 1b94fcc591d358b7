package energyprogress.etl.raster;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Axis-aligned extent in EPSG:4326 degrees.
 */
public record BoundingBox(double minX, double minY, double maxX, double maxY) {

    public BoundingBox {
        if (minX > maxX || minY > maxY) {
            throw new IllegalArgumentException(
                    "Inverted bounding box: [" + minX + ", " + minY + ", " + maxX + ", " + maxY + "]");
        }
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }

    /**
     * JSON shape stored in {@code area_timeseries.bounding_box}.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("minx", minX);
        map.put("miny", minY);
        map.put("maxx", maxX);
        map.put("maxy", maxY);
        return map;
    }
}
