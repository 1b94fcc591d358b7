package energyprogress.etl.exceptions;

/**
 * Raster bytes could not be decoded as a georeferenced single-band GeoTIFF.
 */
public class RasterDecodingException extends DataQualityException {

    public RasterDecodingException(String message) {
        super("Raster decoding failed: " + message);
    }

    public RasterDecodingException(String message, Throwable cause) {
        super("Raster decoding failed: " + message, cause);
    }
}
