package energyprogress.etl.api.types;

import java.time.LocalDate;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pipeline-wide counters.
 *
 * @param areaCount
 *            registered areas
 * @param monthCount
 *            distinct months with at least one timeseries row
 * @param recordCount
 *            timeseries rows
 * @param latestMonth
 *            most recent processed month, null when nothing has been processed
 * @param jobCounts
 *            job count per status code, every status present
 */
public record PipelineStatisticsType(@JsonProperty("area_count") long areaCount,

        @JsonProperty("month_count") long monthCount,

        @JsonProperty("record_count") long recordCount,

        @JsonProperty("latest_month") LocalDate latestMonth,

        @JsonProperty("job_counts") Map<String, Long> jobCounts) {
}
