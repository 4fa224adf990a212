package net.bookharvest.application.backfill;

import net.bookharvest.domain.backfill.BackfillStatus;
import net.bookharvest.repository.BackfillLogRepository;
import net.bookharvest.repository.SyntheticWorkRepository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only progress view over {@code backfill_log}.
 */
@Service
public class BackfillStatsService {

    static final int RECENT_LIMIT = 20;

    private final BackfillLogRepository backfillLogRepository;
    private final SyntheticWorkRepository syntheticWorkRepository;

    public BackfillStatsService(BackfillLogRepository backfillLogRepository,
                                SyntheticWorkRepository syntheticWorkRepository) {
        this.backfillLogRepository = backfillLogRepository;
        this.syntheticWorkRepository = syntheticWorkRepository;
    }

    public BackfillStats stats() {
        BackfillLogRepository.BackfillTotals totals = backfillLogRepository.totals();
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (Map.Entry<BackfillStatus, Long> entry : backfillLogRepository.countByStatus().entrySet()) {
            byStatus.put(entry.getKey().dbValue(), entry.getValue());
        }
        return new BackfillStats(
            totals.months(),
            byStatus,
            totals.booksGenerated(),
            totals.isbnsResolved(),
            totals.isbnsQueued(),
            totals.syntheticCreated(),
            totals.totalApiCalls(),
            resolutionRate(totals.isbnsResolved(), totals.booksGenerated()),
            syntheticWorkRepository.countSynthetic(),
            backfillLogRepository.findRecentlyCompleted(RECENT_LIMIT));
    }

    static BigDecimal resolutionRate(long resolved, long generated) {
        if (generated == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(resolved)
            .multiply(BigDecimal.valueOf(100))
            .divide(BigDecimal.valueOf(generated), 2, RoundingMode.HALF_UP);
    }
}
