package energyprogress.etl.raster;

/**
 * Brightness summary over the valid pixels inside an area.
 *
 * @param mean
 *            mean radiance
 * @param median
 *            median radiance (mean of the two middle values for an even count)
 * @param sum
 *            total radiance
 * @param litPixelCount
 *            pixels strictly above the lit threshold
 * @param litPercentage
 *            {@code litPixelCount / validPixelCount * 100}
 * @param validPixelCount
 *            pixels inside the polygon that are not nodata
 * @param min
 *            smallest valid value
 * @param max
 *            largest valid value
 */
public record ZonalStatistics(double mean, double median, double sum, int litPixelCount, double litPercentage,
        int validPixelCount, double min, double max) {
}
