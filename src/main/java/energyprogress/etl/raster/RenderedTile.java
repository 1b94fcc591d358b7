package energyprogress.etl.raster;

import java.nio.file.Path;

/**
 * A tile written to local disk, awaiting upload.
 */
public record RenderedTile(TileCoordinate coordinate, Path file) {
}
