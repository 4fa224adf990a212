package net.bookharvest.boot.scheduler;

import net.bookharvest.application.backfill.SyntheticEnhancementResult;
import net.bookharvest.application.backfill.SyntheticEnhancementService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily pass over synthetic works, timed shortly after the UTC quota reset.
 */
@Component
public class SyntheticEnhancementScheduler {

    private static final Logger log = LoggerFactory.getLogger(SyntheticEnhancementScheduler.class);

    private final SyntheticEnhancementService enhancementService;
    private final boolean enabled;

    public SyntheticEnhancementScheduler(SyntheticEnhancementService enhancementService,
                                         @Value("${app.backfill.enhancement.enabled:false}") boolean enabled) {
        this.enhancementService = enhancementService;
        this.enabled = enabled;
    }

    @Scheduled(cron = "${app.backfill.enhancement.cron:0 30 0 * * *}", zone = "UTC")
    public void enhanceSyntheticWorks() {
        if (!enabled) {
            log.debug("Synthetic enhancement scheduler is disabled via configuration.");
            return;
        }
        SyntheticEnhancementResult result = enhancementService.enhance();
        log.info("Synthetic enhancement finished: enhanced={} of attempted={} (quotaStopped={})",
            result.enhanced(), result.attempted(), result.quotaStopped());
    }
}
