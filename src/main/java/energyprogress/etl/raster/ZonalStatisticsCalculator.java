package energyprogress.etl.raster;

import java.util.Arrays;

import energyprogress.etl.exceptions.DataQualityException;

/**
 * Zonal statistics restricted to masked, valid pixels.
 */
public final class ZonalStatisticsCalculator {

    private ZonalStatisticsCalculator() {
    }

    /**
     * @param raster
     *            decoded raster
     * @param mask
     *            polygon mask from {@link PolygonMask#build}
     * @param litThreshold
     *            radiance above which a pixel counts as lit
     * @throws DataQualityException
     *             if no pixel inside the polygon carries data
     */
    public static ZonalStatistics compute(GeoRaster raster, boolean[] mask, double litThreshold) {
        if (mask.length != raster.pixelCount()) {
            throw new IllegalArgumentException("Mask size " + mask.length + " does not match raster size "
                    + raster.pixelCount());
        }

        float[] valid = new float[raster.pixelCount()];
        int count = 0;
        int lit = 0;
        double sum = 0.0;
        for (int i = 0; i < mask.length; i++) {
            if (!mask[i] || !raster.isValid(i)) {
                continue;
            }
            float v = raster.valueAt(i);
            valid[count++] = v;
            sum += v;
            if (v > litThreshold) {
                lit++;
            }
        }

        if (count == 0) {
            throw new DataQualityException("No valid pixels inside the area polygon");
        }

        float[] sorted = Arrays.copyOf(valid, count);
        Arrays.sort(sorted);
        double median = count % 2 == 1 ? sorted[count / 2]
                : (sorted[count / 2 - 1] + (double) sorted[count / 2]) / 2.0;

        return new ZonalStatistics(sum / count, median, sum, lit, lit * 100.0 / count, count, sorted[0],
                sorted[count - 1]);
    }
}
