package energyprogress.etl.raster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

class TileCoordinateTest {

    /**
     * Test: Well-known tile addresses.
     */
    @Test
    void testTileIndices() {
        assertEquals(0, TileCoordinate.tileX(-180, 0));
        assertEquals(0, TileCoordinate.tileY(0, 0));
        assertEquals(1, TileCoordinate.tileX(0, 1));
        assertEquals(0, TileCoordinate.tileY(45, 1));
        assertEquals(1, TileCoordinate.tileY(-45, 1));
        // clamped at the antimeridian and the poles
        assertEquals(1, TileCoordinate.tileX(180, 1));
        assertEquals(0, TileCoordinate.tileY(89.9, 1));
    }

    /**
     * Test: Tile edges invert the index functions.
     */
    @Test
    void testEdges() {
        TileCoordinate tile = new TileCoordinate(1, 1, 0);

        assertEquals(0.0, tile.west(), 1e-9);
        assertEquals(180.0, tile.east(), 1e-9);
        assertEquals(TileCoordinate.MAX_LATITUDE, tile.north(), 1e-9);
        assertEquals(0.0, tile.south(), 1e-9);
        assertEquals("1/1/0.png", tile.path());
    }

    /**
     * Test: Covering returns every tile touching the bounds, north-west first.
     */
    @Test
    void testCovering() {
        List<TileCoordinate> tiles = TileCoordinate.covering(new BoundingBox(-10, -10, 10, 10), 1);

        assertEquals(List.of(new TileCoordinate(1, 0, 0), new TileCoordinate(1, 1, 0), new TileCoordinate(1, 0, 1),
                new TileCoordinate(1, 1, 1)), tiles);
    }

    /**
     * Test: Bounds ending exactly on a tile edge do not pull in the neighbour.
     */
    @Test
    void testCovering_edgeAligned() {
        List<TileCoordinate> tiles = TileCoordinate.covering(new BoundingBox(0, 0, 180, 80), 1);

        assertEquals(List.of(new TileCoordinate(1, 1, 0)), tiles);
    }

    /**
     * Test: Out-of-range addresses are rejected.
     */
    @Test
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> new TileCoordinate(1, 2, 0));
        assertThrows(IllegalArgumentException.class, () -> new TileCoordinate(-1, 0, 0));
        assertEquals(1, TileCoordinate.covering(new BoundingBox(1, 1, 2, 2), 0).size());
    }
}
