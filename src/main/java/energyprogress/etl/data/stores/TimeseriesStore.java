package energyprogress.etl.data.stores;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import energyprogress.etl.data.models.AreaTimeseries;

/**
 * Monthly metric rows keyed by (area_id, month).
 */
public interface TimeseriesStore {

    /**
     * Inserts the row, or overwrites every value column of the existing row with the same key.
     */
    void upsert(AreaTimeseries entry);

    /**
     * Rows for one area ordered by month; both bounds inclusive and optional.
     */
    List<AreaTimeseries> findByArea(Long areaId, LocalDate from, LocalDate to);

    Optional<AreaTimeseries> find(Long areaId, LocalDate month);

    long countRecords();

    long countDistinctMonths();

    Optional<LocalDate> latestMonth();
}
