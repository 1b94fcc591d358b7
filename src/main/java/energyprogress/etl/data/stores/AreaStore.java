package energyprogress.etl.data.stores;

import java.util.Optional;

import energyprogress.etl.data.models.Area;

/**
 * Read access to registered areas. Areas are created by the API, never by the pipeline.
 */
public interface AreaStore {

    Optional<Area> findById(Long areaId);

    long count();
}
