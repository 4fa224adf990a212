package net.bookharvest.application.backfill;

import com.fasterxml.jackson.annotation.JsonProperty;
import net.bookharvest.domain.backfill.BackfillMonthRecord;

import java.util.List;
import java.util.Map;

public record BackfillScheduleResponse(@JsonProperty("dry_run") boolean dryRun,
                                       @JsonProperty("batch_size") int batchSize,
                                       @JsonProperty("months_selected") int monthsSelected,
                                       @JsonProperty("months") List<ScheduledMonth> months,
                                       @JsonProperty("totals") Map<String, Long> totals,
                                       @JsonProperty("execution_summary") ExecutionSummary executionSummary) {

    public BackfillScheduleResponse {
        months = months == null ? List.of() : List.copyOf(months);
        totals = totals == null ? Map.of() : Map.copyOf(totals);
    }

    /**
     * @param jobId set only when a job was published for the month
     */
    public record ScheduledMonth(@JsonProperty("year") int year,
                                 @JsonProperty("month") int month,
                                 @JsonProperty("status") String status,
                                 @JsonProperty("retry_count") int retryCount,
                                 @JsonProperty("prompt_variant") String promptVariant,
                                 @JsonProperty("job_id") String jobId) {

        static ScheduledMonth of(BackfillMonthRecord record, String jobId) {
            return new ScheduledMonth(record.year(), record.month(), record.status().dbValue(),
                record.retryCount(), record.promptVariant(), jobId);
        }
    }

    public record ExecutionSummary(@JsonProperty("triggered") int triggered,
                                   @JsonProperty("skipped") int skipped,
                                   @JsonProperty("errors") int errors) {
    }
}
