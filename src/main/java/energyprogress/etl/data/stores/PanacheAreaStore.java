package energyprogress.etl.data.stores;

import java.util.Optional;

import energyprogress.etl.data.models.Area;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

@ApplicationScoped
public class PanacheAreaStore implements AreaStore {

    @Override
    @Transactional
    public Optional<Area> findById(Long areaId) {
        return Area.findByIdOptional(areaId);
    }

    @Override
    @Transactional
    public long count() {
        return Area.count();
    }
}
