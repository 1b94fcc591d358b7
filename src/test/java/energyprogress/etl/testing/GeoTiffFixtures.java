package energyprogress.etl.testing;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import energyprogress.etl.raster.GeoRaster;

/**
 * Builds small uncompressed little-endian float32 GeoTIFFs in memory, laid out the way GDAL writes them: one strip,
 * ModelPixelScale + ModelTiepoint georeferencing and an optional GDAL_NODATA tag.
 */
public final class GeoTiffFixtures {

    private static final short SHORT = 3;
    private static final short LONG = 4;
    private static final short ASCII = 2;
    private static final short DOUBLE = 12;

    private GeoTiffFixtures() {
    }

    /**
     * A georeferenced raster. {@code nodata} may be null to leave out the GDAL_NODATA tag.
     */
    public static byte[] geoTiff(int width, int height, float[] values, double originX, double originY,
            double pixelWidth, double pixelHeight, String nodata) {
        return build(width, height, values, new double[]{pixelWidth, pixelHeight, 0.0},
                new double[]{0.0, 0.0, 0.0, originX, originY, 0.0}, nodata);
    }

    /**
     * Serializes an in-memory raster, carrying its nodata value in the GDAL_NODATA tag.
     */
    public static byte[] geoTiff(GeoRaster raster) {
        float[] values = new float[raster.pixelCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = raster.valueAt(i);
        }
        String nodata = Double.isNaN(raster.nodata()) ? "nan" : Double.toString(raster.nodata());
        return geoTiff(raster.width(), raster.height(), values, raster.originX(), raster.originY(),
                raster.pixelWidth(), raster.pixelHeight(), nodata);
    }

    /**
     * A plain TIFF without any georeferencing tags.
     */
    public static byte[] plainTiff(int width, int height, float[] values) {
        return build(width, height, values, null, null, null);
    }

    /**
     * A raster of {@code width x height} pixels covering {@code [minX, maxX] x [minY, maxY]}, every pixel set to
     * {@code value}.
     */
    public static GeoRaster uniform(int width, int height, double minX, double minY, double maxX, double maxY,
            float value) {
        float[] values = new float[width * height];
        Arrays.fill(values, value);
        return new GeoRaster(width, height, values, minX, maxY, (maxX - minX) / width, (maxY - minY) / height, 0.0);
    }

    private static byte[] build(int width, int height, float[] values, double[] scale, double[] tiepoint,
            String nodata) {
        List<Entry> entries = new ArrayList<>();
        int pixelBytes = width * height * 4;
        entries.add(Entry.ofInt(256, LONG, width));
        entries.add(Entry.ofInt(257, LONG, height));
        entries.add(Entry.ofInt(258, SHORT, 32));
        entries.add(Entry.ofInt(259, SHORT, 1));
        entries.add(Entry.ofInt(262, SHORT, 1));
        Entry stripOffsets = Entry.ofInt(273, LONG, 0);
        entries.add(stripOffsets);
        entries.add(Entry.ofInt(277, SHORT, 1));
        entries.add(Entry.ofInt(278, LONG, height));
        entries.add(Entry.ofInt(279, LONG, pixelBytes));
        entries.add(Entry.ofInt(284, SHORT, 1));
        entries.add(Entry.ofInt(339, SHORT, 3));
        if (scale != null) {
            entries.add(Entry.ofDoubles(33550, scale));
            entries.add(Entry.ofDoubles(33922, tiepoint));
        }
        if (nodata != null) {
            byte[] text = (nodata + "\0").getBytes(StandardCharsets.US_ASCII);
            entries.add(new Entry(42113, ASCII, text.length, text));
        }

        int ifdSize = 2 + entries.size() * 12 + 4;
        int extraOffset = 8 + ifdSize;
        for (Entry entry : entries) {
            if (entry.data.length > 4) {
                entry.offset = extraOffset;
                extraOffset += entry.data.length + (entry.data.length % 2);
            }
        }
        int pixelOffset = extraOffset;
        stripOffsets.data = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(pixelOffset).array();

        ByteBuffer out = ByteBuffer.allocate(pixelOffset + pixelBytes).order(ByteOrder.LITTLE_ENDIAN);
        out.put((byte) 'I').put((byte) 'I').putShort((short) 42).putInt(8);
        out.putShort((short) entries.size());
        for (Entry entry : entries) {
            out.putShort((short) entry.tag).putShort(entry.type).putInt(entry.count);
            if (entry.data.length > 4) {
                out.putInt(entry.offset);
            } else {
                byte[] inline = new byte[4];
                System.arraycopy(entry.data, 0, inline, 0, entry.data.length);
                out.put(inline);
            }
        }
        out.putInt(0);
        for (Entry entry : entries) {
            if (entry.data.length > 4) {
                out.position(entry.offset);
                out.put(entry.data);
            }
        }
        out.position(pixelOffset);
        for (float value : values) {
            out.putFloat(value);
        }
        return out.array();
    }

    private static final class Entry {
        final int tag;
        final short type;
        final int count;
        byte[] data;
        int offset;

        Entry(int tag, short type, int count, byte[] data) {
            this.tag = tag;
            this.type = type;
            this.count = count;
            this.data = data;
        }

        static Entry ofInt(int tag, short type, int value) {
            ByteBuffer buffer = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
            if (type == SHORT) {
                buffer.putShort((short) value);
                return new Entry(tag, type, 1, Arrays.copyOf(buffer.array(), 2));
            }
            buffer.putInt(value);
            return new Entry(tag, type, 1, buffer.array());
        }

        static Entry ofDoubles(int tag, double[] values) {
            ByteBuffer buffer = ByteBuffer.allocate(values.length * 8).order(ByteOrder.LITTLE_ENDIAN);
            for (double value : values) {
                buffer.putDouble(value);
            }
            return new Entry(tag, DOUBLE, values.length, buffer.array());
        }
    }
}
