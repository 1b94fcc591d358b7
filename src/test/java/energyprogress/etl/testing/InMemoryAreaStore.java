package energyprogress.etl.testing;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;

import energyprogress.etl.data.models.Area;
import energyprogress.etl.data.stores.AreaStore;

public class InMemoryAreaStore implements AreaStore {

    private static final GeometryFactory WGS84 = new GeometryFactory(new PrecisionModel(), 4326);

    private final Map<Long, Area> areas = new ConcurrentHashMap<>();

    /**
     * Registers an area whose polygon ring is given as {@code {lon, lat}} pairs, closed by repeating the first one.
     */
    public Area add(long id, String name, double[]... ring) {
        Coordinate[] coordinates = new Coordinate[ring.length];
        for (int i = 0; i < ring.length; i++) {
            coordinates[i] = new Coordinate(ring[i][0], ring[i][1]);
        }
        Area area = new Area();
        area.id = id;
        area.name = name;
        area.geom = WGS84.createPolygon(coordinates);
        area.createdAt = Instant.now();
        areas.put(id, area);
        return area;
    }

    @Override
    public Optional<Area> findById(Long areaId) {
        return areaId == null ? Optional.empty() : Optional.ofNullable(areas.get(areaId));
    }

    @Override
    public long count() {
        return areas.size();
    }
}
