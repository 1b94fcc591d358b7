package energyprogress.etl.raster;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

/**
 * Rasterizes an area polygon onto a raster's pixel grid.
 *
 * <p>
 * With {@code allTouched} a pixel is inside when its footprint intersects the polygon; otherwise only when its center
 * does. Only the window covered by the polygon envelope is tested.
 */
public final class PolygonMask {

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    private PolygonMask() {
    }

    /**
     * @return row-major flags, one per raster pixel
     */
    public static boolean[] build(GeoRaster raster, Polygon polygon, boolean allTouched) {
        boolean[] mask = new boolean[raster.pixelCount()];
        PreparedGeometry prepared = PreparedGeometryFactory.prepare(polygon);
        Envelope env = polygon.getEnvelopeInternal();

        int colStart = clamp((int) Math.floor((env.getMinX() - raster.originX()) / raster.pixelWidth()),
                raster.width());
        int colEnd = clamp((int) Math.floor((env.getMaxX() - raster.originX()) / raster.pixelWidth()), raster.width());
        int rowStart = clamp((int) Math.floor((raster.originY() - env.getMaxY()) / raster.pixelHeight()),
                raster.height());
        int rowEnd = clamp((int) Math.floor((raster.originY() - env.getMinY()) / raster.pixelHeight()),
                raster.height());

        for (int row = rowStart; row <= rowEnd; row++) {
            double maxY = raster.pixelMaxY(row);
            double minY = maxY - raster.pixelHeight();
            for (int col = colStart; col <= colEnd; col++) {
                double minX = raster.pixelMinX(col);
                double maxX = minX + raster.pixelWidth();
                boolean inside;
                if (allTouched) {
                    inside = prepared.intersects(GEOMETRY_FACTORY.toGeometry(new Envelope(minX, maxX, minY, maxY)));
                } else {
                    inside = prepared.intersects(
                            GEOMETRY_FACTORY.createPoint(new Coordinate((minX + maxX) / 2, (minY + maxY) / 2)));
                }
                mask[row * raster.width() + col] = inside;
            }
        }
        return mask;
    }

    private static int clamp(int index, int size) {
        return Math.max(0, Math.min(size - 1, index));
    }
}
