package energyprogress.etl.raster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import energyprogress.etl.exceptions.DataQualityException;
import energyprogress.etl.exceptions.RasterDecodingException;
import energyprogress.etl.testing.Fixtures;
import energyprogress.etl.testing.GeoTiffFixtures;

class GeoTiffDecoderTest {

    private static final float[] VALUES = {1.5f, 2.5f, 0f, 4f, 5f, 6f};

    /**
     * Test: Pixel values and georeferencing are read from a GDAL-style float GeoTIFF.
     */
    @Test
    void testDecode_floatGeoTiff() {
        byte[] tiff = GeoTiffFixtures.geoTiff(3, 2, VALUES, 10.0, 40.0, 0.5, 0.25, null);

        GeoRaster raster = GeoTiffDecoder.decode(tiff, 0.0);

        assertEquals(3, raster.width());
        assertEquals(2, raster.height());
        assertEquals(1.5f, raster.value(0, 0));
        assertEquals(6f, raster.value(2, 1));
        assertEquals(10.0, raster.originX(), 1e-12);
        assertEquals(40.0, raster.originY(), 1e-12);
        assertEquals(0.5, raster.pixelWidth(), 1e-12);
        assertEquals(0.25, raster.pixelHeight(), 1e-12);

        BoundingBox bounds = raster.bounds();
        assertEquals(11.5, bounds.maxX(), 1e-12);
        assertEquals(39.5, bounds.minY(), 1e-12);
    }

    /**
     * Test: A full-size raster decodes pixel for pixel, with its nodata tag and bounds intact.
     */
    @Test
    void testDecode_areaRasterPixelForPixel() {
        GeoRaster expected = Fixtures.areaRaster();

        GeoRaster decoded = GeoTiffDecoder.decode(Fixtures.areaGeoTiff(), -1.0);

        assertEquals(expected.width(), decoded.width());
        assertEquals(expected.height(), decoded.height());
        for (int i = 0; i < expected.pixelCount(); i++) {
            assertEquals(expected.valueAt(i), decoded.valueAt(i), "pixel " + i);
        }
        assertEquals(0.0, decoded.nodata());
        assertEquals(expected.bounds(), decoded.bounds());
    }

    /**
     * Test: Without a GDAL_NODATA tag the caller default applies.
     */
    @Test
    void testDecode_defaultNodata() {
        GeoRaster raster = GeoTiffDecoder.decode(GeoTiffFixtures.geoTiff(3, 2, VALUES, 0, 0, 1, 1, null), 0.0);

        assertEquals(0.0, raster.nodata());
        assertFalse(raster.isValid(2));
        assertTrue(raster.isValid(0));
    }

    /**
     * Test: GDAL_NODATA overrides the default.
     */
    @Test
    void testDecode_nodataTag() {
        float[] values = {-9999f, 1f, 2f, 3f};
        GeoRaster raster = GeoTiffDecoder.decode(GeoTiffFixtures.geoTiff(2, 2, values, 0, 0, 1, 1, "-9999"), 0.0);

        assertEquals(-9999.0, raster.nodata());
        assertFalse(raster.isValid(0));
        assertTrue(raster.isValid(1));
    }

    /**
     * Test: A NaN nodata tag leaves zero-valued pixels valid.
     */
    @Test
    void testDecode_nanNodata() {
        float[] values = {Float.NaN, 0f, 2f, 3f};
        GeoRaster raster = GeoTiffDecoder.decode(GeoTiffFixtures.geoTiff(2, 2, values, 0, 0, 1, 1, "nan"), 0.0);

        assertTrue(Double.isNaN(raster.nodata()));
        assertFalse(raster.isValid(0));
        assertTrue(raster.isValid(1));
    }

    /**
     * Test: Garbage bytes are a data quality failure, not a crash.
     */
    @Test
    void testDecode_notATiff() {
        DataQualityException e = assertThrows(RasterDecodingException.class,
                () -> GeoTiffDecoder.decode("<html>quota exceeded</html>".getBytes(), 0.0));

        assertTrue(e.getMessage().startsWith("Raster decoding failed"));
    }

    /**
     * Test: Empty input is rejected.
     */
    @Test
    void testDecode_empty() {
        assertThrows(RasterDecodingException.class, () -> GeoTiffDecoder.decode(new byte[0], 0.0));
    }

    /**
     * Test: A TIFF without georeferencing cannot be masked and is rejected.
     */
    @Test
    void testDecode_missingGeoreferencing() {
        RasterDecodingException e = assertThrows(RasterDecodingException.class,
                () -> GeoTiffDecoder.decode(GeoTiffFixtures.plainTiff(3, 2, VALUES), 0.0));

        assertTrue(e.getMessage().contains("georeferencing"));
    }
}
