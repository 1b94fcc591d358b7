package energyprogress.etl.api.types;

import java.time.LocalDate;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import energyprogress.etl.data.models.AreaTimeseries;

/**
 * One month of nightlight metrics for an area, as returned to map clients.
 *
 * @param tileUrlTemplate
 *            browser-reachable XYZ template, e.g. {@code http://minio:9000/tiles/42/2023_01/{z}/{x}/{y}.png}; null
 *            when the month has no tiles
 */
public record TimeseriesEntryType(@JsonProperty("area_id") Long areaId,

        @JsonProperty("month") LocalDate month,

        @JsonProperty("mean_brightness") Double meanBrightness,

        @JsonProperty("median_brightness") Double medianBrightness,

        @JsonProperty("sum_brightness") Double sumBrightness,

        @JsonProperty("lit_pixel_count") Integer litPixelCount,

        @JsonProperty("lit_percentage") Double litPercentage,

        @JsonProperty("tile_url_template") String tileUrlTemplate,

        @JsonProperty("min_zoom") Integer minZoom,

        @JsonProperty("max_zoom") Integer maxZoom,

        @JsonProperty("bounding_box") Map<String, Object> boundingBox) {

    public static TimeseriesEntryType from(AreaTimeseries entry, String tileUrlTemplate) {
        return new TimeseriesEntryType(entry.areaId, entry.month, entry.meanBrightness, entry.medianBrightness,
                entry.sumBrightness, entry.litPixelCount, entry.litPercentage, tileUrlTemplate, entry.minZoom,
                entry.maxZoom, entry.boundingBox);
    }
}
