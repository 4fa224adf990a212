package net.bookharvest.application.backfill;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.bookharvest.support.MutableClock;
import net.bookharvest.support.kv.InMemoryKeyValueStore;
import net.bookharvest.support.kv.KeyValueStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackfillJobStatusStoreTest {

    private static final Instant START = Instant.parse("2024-06-01T10:00:00Z");

    private InMemoryKeyValueStore store;
    private MutableClock clock;
    private BackfillJobStatusStore statusStore;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        clock = new MutableClock(START);
        statusStore = new BackfillJobStatusStore(store, new ObjectMapper(), clock);
    }

    @Test
    void should_StoreQueuedDocumentForSevenDays_When_Created() {
        statusStore.create("job-1", 2023, 5, "contemporary-notable", false);

        BackfillJobStatus status = statusStore.find("job-1").orElseThrow();
        assertThat(status.status()).isEqualTo(BackfillJobState.QUEUED);
        assertThat(status.progress()).isEqualTo("Job queued for processing");
        assertThat(status.createdAt()).isEqualTo("2024-06-01T10:00:00Z");
        assertThat(status.completedAt()).isNull();
        assertThat(store.ttlOf("backfill:job:job-1")).contains(Duration.ofDays(7));
        assertThat(store.get("backfill:job:job-1")).get().asString().contains("\"status\":\"queued\"");
    }

    @Test
    void should_RecordStatsAndDuration_When_JobCompletes() {
        statusStore.create("job-1", 2023, 5, "baseline", false);
        clock.advance(Duration.ofSeconds(30));
        assertThat(statusStore.markProgress("job-1", BackfillJobState.PROCESSING, "Generating books")).isTrue();
        clock.advance(Duration.ofSeconds(15));

        statusStore.markComplete("job-1", "12 ISBNs resolved - 3 synthetic records created",
            Map.of("books_generated", 15, "isbns_resolved", 12), START);

        BackfillJobStatus status = statusStore.find("job-1").orElseThrow();
        assertThat(status.status()).isEqualTo(BackfillJobState.COMPLETE);
        assertThat(status.durationMs()).isEqualTo(45_000L);
        assertThat(status.completedAt()).isEqualTo("2024-06-01T10:00:45Z");
        assertThat(status.stats().get("isbns_resolved").intValue()).isEqualTo(12);
    }

    @Test
    void should_KeepErrorAndStats_When_JobFails() {
        statusStore.create("job-1", 2023, 5, "baseline", false);

        statusStore.markFailed("job-1", "no provider succeeded", START);

        BackfillJobStatus status = statusStore.find("job-1").orElseThrow();
        assertThat(status.status()).isEqualTo(BackfillJobState.FAILED);
        assertThat(status.error()).isEqualTo("no provider succeeded");
        assertThat(status.durationMs()).isZero();
    }

    @Test
    void should_SkipUpdate_When_DocumentMissingOrStoreDown() {
        assertThat(statusStore.markProgress("missing", BackfillJobState.PROCESSING, "x")).isFalse();

        statusStore.create("job-1", 2023, 5, "baseline", false);
        store.setAvailable(false);

        assertThat(statusStore.markProgress("job-1", BackfillJobState.PROCESSING, "x")).isFalse();
        assertThat(statusStore.find("job-1")).isEmpty();
    }

    @Test
    void should_Throw_When_CreatingWhileStoreDown() {
        store.setAvailable(false);

        assertThatThrownBy(() -> statusStore.create("job-1", 2023, 5, "baseline", false))
            .isInstanceOf(KeyValueStoreException.class);
    }
}
