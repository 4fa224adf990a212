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
 * FIFO of month jobs backed by a store list. Any instance may publish; any instance may poll.
 */
@Component
@Slf4j
public class BackfillJobQueue {

    public static final String QUEUE_KEY = "queue:backfill-jobs";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    public BackfillJobQueue(KeyValueStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public void publish(BackfillJobMessage message) {
        try {
            long depth = store.pushTail(QUEUE_KEY, List.of(objectMapper.writeValueAsString(message)));
            log.info("[BACKFILL] Queued job {} for {} (queue depth {})", message.jobId(), message.label(), depth);
        } catch (JsonProcessingException e) {
            throw new QueuePublishException("Failed to serialize backfill job " + message.jobId(), e);
        } catch (KeyValueStoreException e) {
            throw new QueuePublishException("Failed to publish backfill job " + message.jobId(), e);
        }
    }

    /**
     * Removes up to {@code maxMessages} jobs. Entries that do not parse are logged and dropped.
     */
    public List<BackfillJobMessage> poll(int maxMessages) {
        List<String> raw = store.popHead(QUEUE_KEY, maxMessages);
        List<BackfillJobMessage> messages = new ArrayList<>(raw.size());
        for (String payload : raw) {
            try {
                messages.add(objectMapper.readValue(payload, BackfillJobMessage.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.error("[BACKFILL] Dropping unreadable job message {}: {}", payload, e.getMessage());
            }
        }
        return messages;
    }

    public long depth() {
        return store.listLength(QUEUE_KEY);
    }
}
