package energyprogress.etl.raster;

/**
 * Single-band, north-up raster in EPSG:4326.
 *
 * <p>
 * Values are stored row-major starting at the upper-left pixel. {@code originX}/{@code originY} are the coordinates of
 * the upper-left corner of that pixel; pixel sizes are positive degrees.
 */
public final class GeoRaster {

    private final int width;
    private final int height;
    private final float[] values;
    private final double originX;
    private final double originY;
    private final double pixelWidth;
    private final double pixelHeight;
    private final double nodata;

    public GeoRaster(int width, int height, float[] values, double originX, double originY, double pixelWidth,
            double pixelHeight, double nodata) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster dimensions must be positive: " + width + "x" + height);
        }
        if (values.length != width * height) {
            throw new IllegalArgumentException(
                    "Expected " + (width * height) + " samples for " + width + "x" + height + ", got " + values.length);
        }
        if (!(pixelWidth > 0) || !(pixelHeight > 0)) {
            throw new IllegalArgumentException("Pixel size must be positive: " + pixelWidth + "x" + pixelHeight);
        }
        this.width = width;
        this.height = height;
        this.values = values;
        this.originX = originX;
        this.originY = originY;
        this.pixelWidth = pixelWidth;
        this.pixelHeight = pixelHeight;
        this.nodata = nodata;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int pixelCount() {
        return width * height;
    }

    public double originX() {
        return originX;
    }

    public double originY() {
        return originY;
    }

    public double pixelWidth() {
        return pixelWidth;
    }

    public double pixelHeight() {
        return pixelHeight;
    }

    public double nodata() {
        return nodata;
    }

    public float value(int col, int row) {
        return values[row * width + col];
    }

    public float valueAt(int index) {
        return values[index];
    }

    /**
     * True when the sample carries data: not NaN and not equal to the nodata value.
     */
    public boolean isValid(int index) {
        float v = values[index];
        return !Float.isNaN(v) && (Double.isNaN(nodata) || v != nodata);
    }

    public double pixelMinX(int col) {
        return originX + col * pixelWidth;
    }

    public double pixelMaxY(int row) {
        return originY - row * pixelHeight;
    }

    /**
     * Column containing longitude {@code x}, or -1 outside the raster.
     */
    public int columnOf(double x) {
        double col = Math.floor((x - originX) / pixelWidth);
        return col < 0 || col >= width ? -1 : (int) col;
    }

    /**
     * Row containing latitude {@code y}, or -1 outside the raster.
     */
    public int rowOf(double y) {
        double row = Math.floor((originY - y) / pixelHeight);
        return row < 0 || row >= height ? -1 : (int) row;
    }

    public BoundingBox bounds() {
        return new BoundingBox(originX, originY - height * pixelHeight, originX + width * pixelWidth, originY);
    }
}
