package net.bookharvest.application.backfill;

import com.fasterxml.jackson.annotation.JsonProperty;
import net.bookharvest.domain.backfill.BackfillMonthRecord;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record BackfillStats(@JsonProperty("total_months") long totalMonths,
                            @JsonProperty("by_status") Map<String, Long> byStatus,
                            @JsonProperty("total_books_generated") long totalBooksGenerated,
                            @JsonProperty("total_isbns_resolved") long totalIsbnsResolved,
                            @JsonProperty("total_isbns_queued") long totalIsbnsQueued,
                            @JsonProperty("total_synthetic_created") long totalSyntheticCreated,
                            @JsonProperty("total_api_calls") long totalApiCalls,
                            @JsonProperty("overall_resolution_rate") BigDecimal overallResolutionRate,
                            @JsonProperty("pending_synthetic_works") long pendingSyntheticWorks,
                            @JsonProperty("recent") List<BackfillMonthRecord> recent) {

    public BackfillStats {
        byStatus = byStatus == null ? Map.of() : Map.copyOf(byStatus);
        recent = recent == null ? List.of() : List.copyOf(recent);
    }
}
