package energyprogress.etl.raster;

import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFImageReadParam;
import javax.imageio.stream.ImageInputStream;

import org.jboss.logging.Logger;

import energyprogress.etl.exceptions.RasterDecodingException;

/**
 * Decodes single-band GeoTIFF bytes into a {@link GeoRaster} using the JDK ImageIO TIFF plugin.
 *
 * <p>
 * Georeferencing is read from ModelPixelScale + ModelTiepoint, or from ModelTransformation when present. Only
 * north-up rasters are accepted. Nodata comes from the GDAL_NODATA tag when the file carries one, otherwise from the
 * caller's default.
 */
public final class GeoTiffDecoder {

    private static final Logger LOG = Logger.getLogger(GeoTiffDecoder.class);

    /** Private GDAL tag holding the nodata value as ASCII. */
    static final int TAG_GDAL_NODATA = 42113;

    private GeoTiffDecoder() {
    }

    /**
     * Decodes the first image of a GeoTIFF.
     *
     * @param bytes
     *            GeoTIFF file content
     * @param defaultNodata
     *            nodata value when the file has no GDAL_NODATA tag
     * @return decoded raster, band 1 only
     * @throws RasterDecodingException
     *             if the bytes are not a readable TIFF or carry no usable georeferencing
     */
    public static GeoRaster decode(byte[] bytes, double defaultNodata) {
        if (bytes == null || bytes.length == 0) {
            throw new RasterDecodingException("raster is empty");
        }

        Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName("tiff");
        if (!readers.hasNext()) {
            throw new IllegalStateException("No TIFF ImageReader registered");
        }
        ImageReader reader = readers.next();

        TIFFDirectory directory;
        Raster raster;
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            reader.setInput(in, false, false);
            TIFFImageReadParam param = new TIFFImageReadParam();
            param.addAllowedTagSet(GeoTIFFTagSet.getInstance());
            param.setReadUnknownTags(true);
            // metadata is parsed with the tag sets of the first read, so read pixels before asking for it;
            // the TIFF plugin does not support readRaster, so go through the image
            raster = reader.read(0, param).getRaster();
            IIOMetadata metadata = reader.getImageMetadata(0);
            directory = TIFFDirectory.createFromMetadata(metadata);
        } catch (IOException | RuntimeException e) {
            throw new RasterDecodingException("not a readable TIFF (" + e.getMessage() + ")", e);
        } finally {
            reader.dispose();
        }

        int width = raster.getWidth();
        int height = raster.getHeight();
        float[] values = new float[width * height];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                values[row * width + col] = raster.getSampleFloat(raster.getMinX() + col, raster.getMinY() + row, 0);
            }
        }

        double[] georef = readGeoreferencing(directory);
        double nodata = readNodata(directory, defaultNodata);

        LOG.debugf("Decoded GeoTIFF %dx%d, %d band(s), origin=(%f, %f), pixel=(%g, %g), nodata=%s", width, height,
                raster.getNumBands(), georef[0], georef[1], georef[2], georef[3], nodata);

        return new GeoRaster(width, height, values, georef[0], georef[1], georef[2], georef[3], nodata);
    }

    /**
     * Returns {originX, originY, pixelWidth, pixelHeight}.
     */
    private static double[] readGeoreferencing(TIFFDirectory directory) {
        TIFFField scale = directory.getTIFFField(GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE);
        TIFFField tiepoint = directory.getTIFFField(GeoTIFFTagSet.TAG_MODEL_TIE_POINT);
        if (scale != null && tiepoint != null) {
            double[] s = doubles(scale);
            double[] t = doubles(tiepoint);
            if (s.length < 2 || t.length < 6) {
                throw new RasterDecodingException("malformed ModelPixelScale/ModelTiepoint tags");
            }
            double originX = t[3] - t[0] * s[0];
            double originY = t[4] + t[1] * s[1];
            return new double[]{originX, originY, s[0], s[1]};
        }

        TIFFField transformation = directory.getTIFFField(GeoTIFFTagSet.TAG_MODEL_TRANSFORMATION);
        if (transformation != null) {
            double[] m = doubles(transformation);
            if (m.length < 16) {
                throw new RasterDecodingException("malformed ModelTransformation tag");
            }
            if (m[1] != 0.0 || m[4] != 0.0) {
                throw new RasterDecodingException("rotated rasters are not supported");
            }
            return new double[]{m[3], m[7], m[0], -m[5]};
        }

        throw new RasterDecodingException("no georeferencing tags (ModelPixelScale/ModelTiepoint)");
    }

    private static double readNodata(TIFFDirectory directory, double defaultNodata) {
        TIFFField field = directory.getTIFFField(TAG_GDAL_NODATA);
        if (field == null || field.getCount() == 0) {
            return defaultNodata;
        }
        String text = field.getValueAsString(0).replace("\u0000", "").trim();
        if (text.isEmpty()) {
            return defaultNodata;
        }
        try {
            return "nan".equalsIgnoreCase(text) ? Double.NaN : Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new RasterDecodingException("invalid GDAL_NODATA value '" + text + "'", e);
        }
    }

    private static double[] doubles(TIFFField field) {
        double[] out = new double[field.getCount()];
        for (int i = 0; i < out.length; i++) {
            out[i] = field.getAsDouble(i);
        }
        return out;
    }
}
