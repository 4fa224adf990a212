package net.bookharvest.support.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import net.bookharvest.support.kv.KeyValueStore;
import net.bookharvest.support.kv.KeyValueStoreException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Hands resolved ISBNs to the enrichment pipeline in messages of at most {@link #MAX_BATCH} ISBNs.
 */
@Component
@Slf4j
public class EnrichmentQueuePublisher {

    public static final String QUEUE_KEY = "queue:enrichment";
    public static final int MAX_BATCH = 100;
    public static final String PRIORITY_LOW = "low";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    public EnrichmentQueuePublisher(KeyValueStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    /**
     * Publishes all ISBNs, one message per batch. A failed batch aborts the call so the caller can
     * treat the whole job as failed.
     *
     * @return number of ISBNs queued
     */
    public int enqueue(List<String> isbns, String source, String priority, String jobId) {
        if (isbns == null || isbns.isEmpty()) {
            return 0;
        }
        int sent = 0;
        for (int start = 0; start < isbns.size(); start += MAX_BATCH) {
            List<String> batch = isbns.subList(start, Math.min(start + MAX_BATCH, isbns.size()));
            EnrichmentMessage message = new EnrichmentMessage(new ArrayList<>(batch), source, priority, jobId);
            try {
                store.pushTail(QUEUE_KEY, List.of(objectMapper.writeValueAsString(message)));
            } catch (JsonProcessingException | KeyValueStoreException e) {
                log.error("[BACKFILL] Failed to queue enrichment batch {} ({} ISBNs) for job {}",
                    start / MAX_BATCH + 1, batch.size(), jobId, e);
                throw new QueuePublishException("Enrichment batch " + (start / MAX_BATCH + 1) + " failed after "
                    + sent + " ISBNs were queued", e);
            }
            sent += batch.size();
        }
        log.debug("[BACKFILL] Queued {} ISBNs for enrichment from {}", sent, source);
        return sent;
    }
}
