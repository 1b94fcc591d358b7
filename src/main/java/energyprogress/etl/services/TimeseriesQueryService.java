package energyprogress.etl.services;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import energyprogress.etl.api.types.JobSummaryType;
import energyprogress.etl.api.types.PipelineStatisticsType;
import energyprogress.etl.api.types.TimeseriesEntryType;
import energyprogress.etl.data.models.ProcessingJob;
import energyprogress.etl.data.stores.AreaStore;
import energyprogress.etl.data.stores.JobStore;
import energyprogress.etl.data.stores.TimeseriesStore;
import energyprogress.etl.exceptions.ResourceNotFoundException;
import energyprogress.etl.exceptions.ValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Read side of the pipeline: area timeseries, job listings and overall statistics.
 */
@ApplicationScoped
public class TimeseriesQueryService {

    static final int MAX_JOB_PAGE = 500;

    @Inject
    TimeseriesStore timeseriesStore;

    @Inject
    AreaStore areaStore;

    @Inject
    JobStore jobStore;

    @ConfigProperty(
            name = "energyprogress.storage.public-endpoint")
    Optional<String> publicEndpoint;

    @ConfigProperty(
            name = "energyprogress.storage.buckets.tiles",
            defaultValue = "tiles")
    String tilesBucket;

    /**
     * Returns an area's monthly entries ordered by month.
     *
     * @param from
     *            first month, inclusive; null for no lower bound
     * @param to
     *            last month, inclusive; null for no upper bound
     * @throws ResourceNotFoundException
     *             if the area does not exist
     */
    public List<TimeseriesEntryType> findTimeseries(Long areaId, LocalDate from, LocalDate to) {
        if (from != null && to != null && to.isBefore(from)) {
            throw new ValidationException("Range end " + to + " is before start " + from);
        }
        if (areaStore.findById(areaId).isEmpty()) {
            throw new ResourceNotFoundException("Area " + areaId + " not found");
        }
        return timeseriesStore.findByArea(areaId, from, to).stream()
                .map(entry -> TimeseriesEntryType.from(entry, tileUrlTemplate(entry.tilePathPattern))).toList();
    }

    public List<JobSummaryType> listJobs(JobStore.JobFilter filter) {
        int limit = filter.limit() <= 0 ? 100 : Math.min(filter.limit(), MAX_JOB_PAGE);
        JobStore.JobFilter bounded = new JobStore.JobFilter(filter.areaId(), filter.status(), filter.jobType(), limit);
        return jobStore.list(bounded).stream().map(JobSummaryType::from).toList();
    }

    public PipelineStatisticsType statistics() {
        Map<String, Long> jobCounts = new LinkedHashMap<>();
        jobStore.countByStatus().forEach((status, count) -> jobCounts.put(status.getCode(), count));
        for (ProcessingJob.Status status : ProcessingJob.Status.values()) {
            jobCounts.putIfAbsent(status.getCode(), 0L);
        }
        return new PipelineStatisticsType(areaStore.count(), timeseriesStore.countDistinctMonths(),
                timeseriesStore.countRecords(), timeseriesStore.latestMonth().orElse(null), jobCounts);
    }

    /**
     * Turns a stored pattern ({@code tiles/42/2023_01/{z}/{x}/{y}.png}) into a browser URL by prefixing the public
     * object store endpoint. Without a public endpoint the pattern is returned as-is.
     */
    String tileUrlTemplate(String tilePathPattern) {
        if (tilePathPattern == null || publicEndpoint.isEmpty()) {
            return tilePathPattern;
        }
        String endpoint = publicEndpoint.get();
        if (endpoint.endsWith("/")) {
            endpoint = endpoint.substring(0, endpoint.length() - 1);
        }
        String prefix = tilesBucket + "/";
        if (tilePathPattern.startsWith(prefix)) {
            return endpoint + "/" + tilePathPattern;
        }
        return endpoint + "/" + prefix + tilePathPattern;
    }
}
