package energyprogress.etl.data.stores;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import energyprogress.etl.data.models.AreaTimeseries;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.Query;
import jakarta.transaction.Transactional;

/**
 * {@link TimeseriesStore} over {@code area_timeseries}. Writes are a single {@code INSERT ... ON CONFLICT DO UPDATE},
 * so concurrent runs for the same (area, month) resolve to the last writer.
 */
@ApplicationScoped
public class PanacheTimeseriesStore implements TimeseriesStore {

    private static final Logger LOG = Logger.getLogger(PanacheTimeseriesStore.class);

    // casts give nullable parameters a type
    private static final String UPSERT_SQL = """
            INSERT INTO area_timeseries (area_id, month, mean_brightness, median_brightness, sum_brightness,
                lit_pixel_count, lit_percentage, tile_path_pattern, raster_path, min_zoom, max_zoom,
                bounding_box, meta_data)
            VALUES (:areaId, :month, CAST(:mean AS DOUBLE PRECISION), CAST(:median AS DOUBLE PRECISION),
                CAST(:sum AS DOUBLE PRECISION), CAST(:litCount AS INTEGER), CAST(:litPercentage AS DOUBLE PRECISION),
                CAST(:tilePathPattern AS TEXT), CAST(:rasterPath AS TEXT), CAST(:minZoom AS INTEGER),
                CAST(:maxZoom AS INTEGER), CAST(:boundingBox AS JSONB), CAST(:metadata AS JSONB))
            ON CONFLICT (area_id, month) DO UPDATE SET
                mean_brightness = EXCLUDED.mean_brightness,
                median_brightness = EXCLUDED.median_brightness,
                sum_brightness = EXCLUDED.sum_brightness,
                lit_pixel_count = EXCLUDED.lit_pixel_count,
                lit_percentage = EXCLUDED.lit_percentage,
                tile_path_pattern = EXCLUDED.tile_path_pattern,
                raster_path = EXCLUDED.raster_path,
                min_zoom = EXCLUDED.min_zoom,
                max_zoom = EXCLUDED.max_zoom,
                bounding_box = EXCLUDED.bounding_box,
                meta_data = EXCLUDED.meta_data
            """;

    @Inject
    ObjectMapper objectMapper;

    @Override
    @Transactional
    public void upsert(AreaTimeseries entry) {
        Query query = AreaTimeseries.getEntityManager().createNativeQuery(UPSERT_SQL);
        query.setParameter("areaId", entry.areaId);
        query.setParameter("month", entry.month);
        query.setParameter("mean", entry.meanBrightness);
        query.setParameter("median", entry.medianBrightness);
        query.setParameter("sum", entry.sumBrightness);
        query.setParameter("litCount", entry.litPixelCount);
        query.setParameter("litPercentage", entry.litPercentage);
        query.setParameter("tilePathPattern", entry.tilePathPattern);
        query.setParameter("rasterPath", entry.rasterPath);
        query.setParameter("minZoom", entry.minZoom);
        query.setParameter("maxZoom", entry.maxZoom);
        query.setParameter("boundingBox", toJson(entry.boundingBox));
        query.setParameter("metadata", toJson(entry.metadata));
        query.executeUpdate();
        LOG.infof("Upserted timeseries entry for area %d month %s", entry.areaId, entry.month);
    }

    private String toJson(Map<String, Object> value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize timeseries JSON column", e);
        }
    }

    @Override
    @Transactional
    public List<AreaTimeseries> findByArea(Long areaId, LocalDate from, LocalDate to) {
        StringJoiner where = new StringJoiner(" and ");
        Parameters params = Parameters.with("areaId", areaId);
        where.add("areaId = :areaId");
        if (from != null) {
            where.add("month >= :from");
            params.and("from", from);
        }
        if (to != null) {
            where.add("month <= :to");
            params.and("to", to);
        }
        return AreaTimeseries.<AreaTimeseries> find(where.toString(), Sort.ascending("month"), params).list();
    }

    @Override
    @Transactional
    public Optional<AreaTimeseries> find(Long areaId, LocalDate month) {
        return AreaTimeseries.findByIdOptional(new AreaTimeseries.Key(areaId, month));
    }

    @Override
    @Transactional
    public long countRecords() {
        return AreaTimeseries.count();
    }

    @Override
    @Transactional
    public long countDistinctMonths() {
        return AreaTimeseries.getEntityManager()
                .createQuery("select count(distinct t.month) from AreaTimeseries t", Long.class).getSingleResult();
    }

    @Override
    @Transactional
    public Optional<LocalDate> latestMonth() {
        return Optional.ofNullable(AreaTimeseries.getEntityManager()
                .createQuery("select max(t.month) from AreaTimeseries t", LocalDate.class).getSingleResult());
    }
}
