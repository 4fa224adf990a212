package net.bookharvest.boot.scheduler;

import java.util.List;
import net.bookharvest.application.backfill.BackfillJobProcessor;
import net.bookharvest.application.backfill.BackfillJobResult;
import net.bookharvest.support.kv.KeyValueStoreException;
import net.bookharvest.support.queue.BackfillJobMessage;
import net.bookharvest.support.queue.BackfillJobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls the job queue and runs each month job on the scheduler thread.
 *
 * <p>Jobs run one after another so a single instance never competes with itself for quota.</p>
 */
@Component
public class BackfillJobQueueConsumer {

    private static final Logger log = LoggerFactory.getLogger(BackfillJobQueueConsumer.class);

    private final BackfillJobQueue jobQueue;
    private final BackfillJobProcessor processor;
    private final boolean enabled;
    private final int maxMessagesPerPoll;

    public BackfillJobQueueConsumer(BackfillJobQueue jobQueue,
                                    BackfillJobProcessor processor,
                                    @Value("${app.backfill.consumer.enabled:true}") boolean enabled,
                                    @Value("${app.backfill.consumer.max-messages:2}") int maxMessagesPerPoll) {
        this.jobQueue = jobQueue;
        this.processor = processor;
        this.enabled = enabled;
        this.maxMessagesPerPoll = maxMessagesPerPoll;
    }

    @Scheduled(fixedDelayString = "${app.backfill.consumer.poll-interval:PT30S}", initialDelayString = "${app.backfill.consumer.initial-delay:PT1M}")
    public void poll() {
        if (!enabled) {
            return;
        }
        List<BackfillJobMessage> messages;
        try {
            messages = jobQueue.poll(maxMessagesPerPoll);
        } catch (KeyValueStoreException exception) {
            log.warn("Backfill job queue unavailable; retrying next poll: {}", exception.getMessage());
            return;
        }
        for (BackfillJobMessage message : messages) {
            BackfillJobResult result = processor.process(message);
            log.info("Backfill job {} for {}: {} ({})", message.jobId(), message.label(), result.outcome(), result.summary());
        }
    }
}
