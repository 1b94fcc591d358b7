package energyprogress.etl.raster;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import javax.imageio.ImageIO;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Renders a raster into XYZ PNG tiles under {@code outputDir/{z}/{x}/{y}.png}.
 *
 * <p>
 * Each tile pixel samples the raster at its center (nearest neighbour). Values are stretched linearly to 8-bit gray
 * between {@code min} and {@code max}; pixels outside the mask, nodata and outside the raster are transparent. Tiles
 * with no opaque pixel are not written.
 */
@ApplicationScoped
public class TilePyramidRenderer {

    private static final Logger LOG = Logger.getLogger(TilePyramidRenderer.class);

    @ConfigProperty(
            name = "energyprogress.raster.tile-size",
            defaultValue = "256")
    int tileSize = 256;

    /**
     * @param raster
     *            source raster
     * @param mask
     *            polygon mask, one flag per raster pixel
     * @param min
     *            value rendered black
     * @param max
     *            value rendered white
     * @param minZoom
     *            lowest zoom level, inclusive
     * @param maxZoom
     *            highest zoom level, inclusive
     * @param outputDir
     *            existing directory receiving the pyramid
     * @return tiles written, lowest zoom first
     * @throws IOException
     *             if a tile cannot be written
     */
    public List<RenderedTile> render(GeoRaster raster, boolean[] mask, double min, double max, int minZoom,
            int maxZoom, Path outputDir) throws IOException {
        if (minZoom < 0 || maxZoom < minZoom) {
            throw new IllegalArgumentException("Invalid zoom range " + minZoom + ".." + maxZoom);
        }

        List<RenderedTile> written = new ArrayList<>();
        BoundingBox bounds = raster.bounds();
        for (int z = minZoom; z <= maxZoom; z++) {
            int before = written.size();
            for (TileCoordinate tile : TileCoordinate.covering(bounds, z)) {
                BufferedImage image = renderTile(raster, mask, min, max, tile);
                if (image == null) {
                    continue;
                }
                Path file = outputDir.resolve(tile.path());
                Files.createDirectories(file.getParent());
                if (!ImageIO.write(image, "png", file.toFile())) {
                    throw new IOException("No PNG writer available for " + file);
                }
                written.add(new RenderedTile(tile, file));
            }
            LOG.debugf("Rendered %d tiles at zoom %d", written.size() - before, z);
        }
        return written;
    }

    /**
     * @return the tile image, or null when every pixel is transparent
     */
    BufferedImage renderTile(GeoRaster raster, boolean[] mask, double min, double max, TileCoordinate tile) {
        int[] cols = new int[tileSize];
        int[] rows = new int[tileSize];
        for (int i = 0; i < tileSize; i++) {
            double fraction = (i + 0.5) / tileSize;
            cols[i] = raster.columnOf(TileCoordinate.longitude(tile.x() + fraction, tile.z()));
            rows[i] = raster.rowOf(TileCoordinate.latitude(tile.y() + fraction, tile.z()));
        }

        double range = max - min;
        BufferedImage image = null;
        for (int py = 0; py < tileSize; py++) {
            if (rows[py] < 0) {
                continue;
            }
            for (int px = 0; px < tileSize; px++) {
                if (cols[px] < 0) {
                    continue;
                }
                int index = rows[py] * raster.width() + cols[px];
                if (!mask[index] || !raster.isValid(index)) {
                    continue;
                }
                int gray = range <= 0 ? 255 : (int) Math.round((raster.valueAt(index) - min) / range * 255.0);
                gray = Math.max(0, Math.min(255, gray));
                if (image == null) {
                    image = new BufferedImage(tileSize, tileSize, BufferedImage.TYPE_INT_ARGB);
                }
                image.setRGB(px, py, 0xFF000000 | gray << 16 | gray << 8 | gray);
            }
        }
        return image;
    }
}
