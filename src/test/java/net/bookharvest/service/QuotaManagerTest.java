package net.bookharvest.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.bookharvest.support.MutableClock;
import net.bookharvest.support.kv.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuotaManagerTest {

    private static final long LIMIT = 10;
    private static final long BUFFER = 2;

    private InMemoryKeyValueStore store;
    private MutableClock clock;
    private QuotaManager quotaManager;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        clock = new MutableClock(Instant.parse("2024-03-10T22:00:00Z"));
        quotaManager = new QuotaManager(store, clock, new SimpleMeterRegistry(), LIMIT, BUFFER, 5);
    }

    @Test
    void should_DenyFurtherCalls_When_CeilingBelowSafetyBufferReached() {
        IntStream.range(0, 8).forEach(i -> assertThat(quotaManager.reserve(1)).isPresent());

        assertThat(quotaManager.checkQuota(1)).isFalse();
        assertThat(quotaManager.reserve(1)).isEmpty();
        assertThat(quotaManager.getStatus().usedToday()).isEqualTo(8);
        assertThat(quotaManager.getStatus().canMakeCalls()).isFalse();
    }

    @Test
    void should_AllowCallsAgain_When_UtcDateRollsOver() {
        IntStream.range(0, 8).forEach(i -> quotaManager.reserve(1));
        assertThat(quotaManager.checkQuota(1)).isFalse();

        clock.advance(Duration.ofHours(3));

        assertThat(quotaManager.checkQuota(1)).isTrue();
        QuotaStatus status = quotaManager.getStatus();
        assertThat(status.usedToday()).isZero();
        assertThat(status.lastReset()).isEqualTo("2024-03-11");
    }

    @Test
    void should_CountInDateScopedKeyWithExpiry_When_Reserving() {
        quotaManager.reserve(3);
        quotaManager.recordApiCall(2);

        assertThat(store.get("isbndb_daily_calls:2024-03-10")).contains("5");
        assertThat(store.ttlOf("isbndb_daily_calls:2024-03-10")).contains(QuotaManager.COUNTER_TTL);
    }

    @Test
    void should_LeavePreviousDayCounterUntouched_When_DayRollsOver() {
        quotaManager.reserve(6);
        clock.advance(Duration.ofHours(3));

        assertThat(quotaManager.getStatus().usedToday()).isZero();
        assertThat(quotaManager.reserve(2)).isPresent();

        assertThat(store.get("isbndb_daily_calls:2024-03-10")).contains("6");
        assertThat(store.get("isbndb_daily_calls:2024-03-11")).contains("2");
    }

    @Test
    void should_KeepOtherInstancesReservations_When_SeveralInstancesCrossMidnight() {
        QuotaManager otherInstance = new QuotaManager(store, clock, new SimpleMeterRegistry(), LIMIT, BUFFER, 5);
        quotaManager.reserve(5);
        clock.advance(Duration.ofHours(3));

        assertThat(otherInstance.reserve(4)).isPresent();
        assertThat(quotaManager.checkQuota(1)).isTrue();
        assertThat(quotaManager.reserve(4)).isPresent();

        assertThat(quotaManager.reserve(1)).isEmpty();
        assertThat(otherInstance.getStatus().usedToday()).isEqualTo(8);
    }

    @Test
    void should_RejectReservation_When_CostWouldCrossCeiling() {
        assertThat(quotaManager.reserve(6)).isPresent();

        assertThat(quotaManager.reserve(3)).isEmpty();
        assertThat(quotaManager.getStatus().usedToday()).isEqualTo(6);
        assertThat(quotaManager.reserve(2)).isPresent();
    }

    @Test
    void should_FailClosed_When_StoreUnavailable() {
        store.setAvailable(false);

        assertThat(quotaManager.checkQuota(1)).isFalse();
        assertThat(quotaManager.reserve(1)).isEmpty();
        assertThat(quotaManager.getStatus().canMakeCalls()).isFalse();
        assertThat(quotaManager.getSafeBatchSize(5)).isZero();
        assertThat(quotaManager.resetQuota()).isFalse();
    }

    @Test
    void should_ReturnUnits_When_ReservationReleased() {
        QuotaReservation reservation = quotaManager.reserve(3).orElseThrow();

        assertThat(quotaManager.release(reservation)).isTrue();
        assertThat(quotaManager.getStatus().usedToday()).isZero();
        assertThat(quotaManager.release(reservation)).isFalse();
        assertThat(quotaManager.commit(reservation)).isFalse();
    }

    @Test
    void should_KeepUnitsCounted_When_ReservationCommitted() {
        QuotaReservation reservation = quotaManager.reserve(2).orElseThrow();

        assertThat(quotaManager.commit(reservation)).isTrue();
        assertThat(reservation.isSettled()).isTrue();
        assertThat(quotaManager.getStatus().usedToday()).isEqualTo(2);
    }

    @Test
    void should_LeaveTodaysCounter_When_ReleasingReservationFromPreviousDay() {
        Optional<QuotaReservation> yesterday = quotaManager.reserve(4);
        clock.advance(Duration.ofHours(3));
        quotaManager.reserve(1);

        assertThat(quotaManager.release(yesterday.orElseThrow())).isTrue();
        assertThat(quotaManager.getStatus().usedToday()).isEqualTo(1);
    }

    @Test
    void should_RequireDoubledHeadroom_When_OperationIsCron() {
        quotaManager.recordApiCall(5);

        assertThat(quotaManager.shouldAllowOperation(QuotaManager.OperationKind.SINGLE, 2).allowed()).isTrue();
        assertThat(quotaManager.shouldAllowOperation(QuotaManager.OperationKind.CRON, 2).allowed()).isFalse();
        assertThat(quotaManager.shouldAllowOperation(QuotaManager.OperationKind.CRON, 1).allowed()).isTrue();
    }

    @Test
    void should_DenyBulk_When_AboveConfiguredMaximum() {
        QuotaDecision decision = quotaManager.shouldAllowOperation(QuotaManager.OperationKind.BULK, 6);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).contains("maximum of 5");
    }

    @Test
    void should_CapBatchSize_When_RemainingBudgetIsSmaller() {
        quotaManager.recordApiCall(5);

        assertThat(quotaManager.getSafeBatchSize(10)).isEqualTo(3);
        assertThat(quotaManager.getSafeBatchSize(2)).isEqualTo(2);
        assertThat(quotaManager.getSafeBatchSize(0)).isZero();
    }

    @Test
    void should_ZeroCounter_When_ManuallyReset() {
        quotaManager.recordApiCall(7);

        assertThat(quotaManager.resetQuota()).isTrue();
        assertThat(quotaManager.getStatus().usedToday()).isZero();
    }

    @Test
    void should_RejectConfiguration_When_BufferNotBelowLimit() {
        assertThatThrownBy(() -> new QuotaManager(store, clock, new SimpleMeterRegistry(), 10, 10, 5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
