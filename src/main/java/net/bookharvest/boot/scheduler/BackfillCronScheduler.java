package net.bookharvest.boot.scheduler;

import java.time.Duration;
import net.bookharvest.application.backfill.BackfillScheduleRequest;
import net.bookharvest.application.backfill.BackfillScheduleResponse;
import net.bookharvest.application.backfill.BackfillSchedulerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cron entry points for month scheduling and stale-processing reclaim.
 *
 * <p>Both passes are disabled unless {@code app.backfill.cron.enabled} is set, so a fresh
 * deployment never spends quota before an operator opts in.</p>
 */
@Component
public class BackfillCronScheduler {

    private static final Logger log = LoggerFactory.getLogger(BackfillCronScheduler.class);

    private final BackfillSchedulerService schedulerService;
    private final CronConfiguration config;

    public BackfillCronScheduler(BackfillSchedulerService schedulerService, CronConfiguration config) {
        this.schedulerService = schedulerService;
        this.config = config;
    }

    @Component
    public static class ConfigLoader {
        @Bean
        public CronConfiguration backfillCronConfiguration(
            @Value("${app.backfill.cron.enabled:false}") boolean enabled,
            @Value("${app.backfill.cron.batch-size:10}") int batchSize,
            @Value("${app.backfill.cron.year-start:2000}") int yearStart,
            @Value("${app.backfill.cron.year-end:2024}") int yearEnd,
            @Value("${app.backfill.stale-after:PT1H}") Duration staleAfter
        ) {
            return new CronConfiguration(enabled, batchSize, yearStart, yearEnd, staleAfter);
        }
    }

    public record CronConfiguration(boolean enabled, int batchSize, int yearStart, int yearEnd, Duration staleAfter) {}

    @Scheduled(cron = "${app.backfill.cron.expression:0 0 */6 * * *}")
    public void scheduleBatch() {
        if (!config.enabled()) {
            log.debug("Backfill cron is disabled via configuration.");
            return;
        }
        BackfillScheduleRequest request = new BackfillScheduleRequest(config.batchSize(), false, false,
            new BackfillScheduleRequest.YearRange(config.yearStart(), config.yearEnd()));
        try {
            BackfillScheduleResponse response = schedulerService.schedule(request);
            BackfillScheduleResponse.ExecutionSummary summary = response.executionSummary();
            log.info("Backfill cron scheduled {} months (skipped={}, errors={})",
                summary.triggered(), summary.skipped(), summary.errors());
        } catch (RuntimeException exception) {
            log.error("Backfill cron run failed.", exception);
            throw exception;
        }
    }

    @Scheduled(fixedDelayString = "${app.backfill.reclaim-interval:PT15M}", initialDelayString = "${app.backfill.reclaim-initial-delay:PT2M}")
    public void reclaimStaleMonths() {
        if (!config.enabled()) {
            return;
        }
        int reclaimed = schedulerService.reclaimStale(config.staleAfter());
        if (reclaimed > 0) {
            log.info("Stale reclaim returned {} months to the eligible pool.", reclaimed);
        }
    }
}
