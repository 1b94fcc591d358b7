package energyprogress.etl.data.models;

import java.time.Instant;
import java.util.Map;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.locationtech.jts.geom.Polygon;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Registered area of interest ({@code areas}). Owned by the API; the pipeline only reads it.
 *
 * <p>
 * {@code geom} is a single-ring WGS84 polygon ({@code GEOMETRY(Polygon, 4326)}) mapped through Hibernate Spatial.
 */
@Entity
@Table(
        name = "areas")
public class Area extends PanacheEntityBase {

    @Id
    @Column(
            name = "area_id",
            nullable = false)
    public Long id;

    @Column(
            name = "name",
            nullable = false,
            unique = true)
    public String name;

    @Column(
            name = "geom",
            nullable = false,
            columnDefinition = "geometry(Polygon,4326)")
    public Polygon geom;

    @Column(
            name = "created_at")
    public Instant createdAt;

    @Column(
            name = "meta_data",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> metadata;
}
