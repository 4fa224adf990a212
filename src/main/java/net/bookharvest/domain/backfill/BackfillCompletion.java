package net.bookharvest.domain.backfill;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Counters written when a month completes.
 */
public record BackfillCompletion(int booksGenerated,
                                 int isbnsResolved,
                                 int isbnsQueued,
                                 int syntheticCreated,
                                 int geminiCalls,
                                 int xaiCalls,
                                 int isbndbCalls) {

    /**
     * Resolved share of generated books in percent, two decimals.
     */
    public BigDecimal resolutionRate() {
        if (booksGenerated == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(isbnsResolved)
            .multiply(BigDecimal.valueOf(100))
            .divide(BigDecimal.valueOf(booksGenerated), 2, RoundingMode.HALF_UP);
    }

    public int totalApiCalls() {
        return geminiCalls + xaiCalls + isbndbCalls;
    }
}
