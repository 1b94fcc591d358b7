package energyprogress.etl.data.models;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

/**
 * Monthly nightlight metrics for one area ({@code area_timeseries}), keyed by (area_id, month).
 *
 * <p>
 * Written only by the raster processor, as an upsert: re-processing the same month overwrites the row. {@code month}
 * is always the first day of the month.
 */
@Entity
@Table(
        name = "area_timeseries")
@IdClass(AreaTimeseries.Key.class)
public class AreaTimeseries extends PanacheEntityBase {

    @Id
    @Column(
            name = "area_id",
            nullable = false)
    public Long areaId;

    @Id
    @Column(
            name = "month",
            nullable = false)
    public LocalDate month;

    @Column(
            name = "mean_brightness")
    public Double meanBrightness;

    @Column(
            name = "median_brightness")
    public Double medianBrightness;

    @Column(
            name = "sum_brightness")
    public Double sumBrightness;

    @Column(
            name = "lit_pixel_count")
    public Integer litPixelCount;

    @Column(
            name = "lit_percentage")
    public Double litPercentage;

    /** Pattern like {@code tiles/42/2023_01/{z}/{x}/{y}.png}. */
    @Column(
            name = "tile_path_pattern")
    public String tilePathPattern;

    @Column(
            name = "raster_path")
    public String rasterPath;

    @Column(
            name = "min_zoom")
    public Integer minZoom;

    @Column(
            name = "max_zoom")
    public Integer maxZoom;

    /** {@code {"minx":..,"miny":..,"maxx":..,"maxy":..}} in EPSG:4326. */
    @Column(
            name = "bounding_box",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> boundingBox;

    @Column(
            name = "meta_data",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> metadata;

    /**
     * Composite primary key.
     */
    public static class Key implements Serializable {

        public Long areaId;
        public LocalDate month;

        public Key() {
        }

        public Key(Long areaId, LocalDate month) {
            this.areaId = areaId;
            this.month = month;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Key)) {
                return false;
            }
            Key other = (Key) o;
            return Objects.equals(areaId, other.areaId) && Objects.equals(month, other.month);
        }

        @Override
        public int hashCode() {
            return Objects.hash(areaId, month);
        }
    }

    /**
     * Copies every value column from {@code source} onto this row, keeping the key.
     */
    public void overwriteWith(AreaTimeseries source) {
        this.meanBrightness = source.meanBrightness;
        this.medianBrightness = source.medianBrightness;
        this.sumBrightness = source.sumBrightness;
        this.litPixelCount = source.litPixelCount;
        this.litPercentage = source.litPercentage;
        this.tilePathPattern = source.tilePathPattern;
        this.rasterPath = source.rasterPath;
        this.minZoom = source.minZoom;
        this.maxZoom = source.maxZoom;
        this.boundingBox = source.boundingBox;
        this.metadata = source.metadata;
    }
}
