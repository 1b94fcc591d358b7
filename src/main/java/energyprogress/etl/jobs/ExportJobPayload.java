package energyprogress.etl.jobs;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

import energyprogress.etl.data.models.ProcessingJob;
import energyprogress.etl.exceptions.ValidationException;

/**
 * Typed view of an {@code earth_engine_export} job.
 *
 * <p>
 * The range comes from the job's {@code start_date} / {@code end_date} columns. Months covered are those whose first
 * day falls in {@code [start, end)}, and the month containing {@code start} is always included, so a missing or equal
 * end date exports a single month.
 */
public record ExportJobPayload(Long areaId, LocalDate startDate, LocalDate endDate) {

    /**
     * Validates and extracts the payload.
     *
     * @throws ValidationException
     *             if the area or start date is missing, or the range is inverted
     */
    public static ExportJobPayload from(ProcessingJob job) {
        if (job.areaId == null) {
            throw new ValidationException("Job " + job.id + " has no area_id");
        }
        if (job.startDate == null) {
            throw new ValidationException("Export job " + job.id + " has no start_date");
        }
        if (job.endDate != null && job.endDate.isBefore(job.startDate)) {
            throw new ValidationException(
                    "Export job end_date " + job.endDate + " is before start_date " + job.startDate);
        }
        return new ExportJobPayload(job.areaId, job.startDate, job.endDate);
    }

    /**
     * Calendar months covered by this export, oldest first.
     */
    public List<YearMonth> months() {
        List<YearMonth> months = new ArrayList<>();
        YearMonth first = YearMonth.from(startDate);
        months.add(first);
        if (endDate == null) {
            return months;
        }
        YearMonth next = first.plusMonths(1);
        while (next.atDay(1).isBefore(endDate)) {
            months.add(next);
            next = next.plusMonths(1);
        }
        return months;
    }
}
