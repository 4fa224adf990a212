package net.bookharvest.domain.backfill;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row of {@code backfill_log}.
 */
public record BackfillMonthRecord(int year,
                                  int month,
                                  BackfillStatus status,
                                  @JsonProperty("retry_count") int retryCount,
                                  @JsonProperty("started_at") Instant startedAt,
                                  @JsonProperty("completed_at") Instant completedAt,
                                  @JsonProperty("last_retry_at") Instant lastRetryAt,
                                  @JsonProperty("error_message") String errorMessage,
                                  @JsonProperty("books_generated") int booksGenerated,
                                  @JsonProperty("isbns_resolved") int isbnsResolved,
                                  @JsonProperty("resolution_rate") BigDecimal resolutionRate,
                                  @JsonProperty("isbns_queued") int isbnsQueued,
                                  @JsonProperty("synthetic_created") int syntheticCreated,
                                  @JsonProperty("prompt_variant") String promptVariant,
                                  @JsonProperty("batch_size") int batchSize,
                                  @JsonProperty("gemini_calls") int geminiCalls,
                                  @JsonProperty("xai_calls") int xaiCalls,
                                  @JsonProperty("isbndb_calls") int isbndbCalls,
                                  @JsonProperty("total_api_calls") int totalApiCalls) {

    public String label() {
        return "%d-%02d".formatted(year, month);
    }
}
