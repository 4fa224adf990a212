package net.bookharvest.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import net.bookharvest.support.kv.KeyValueStore;
import net.bookharvest.support.kv.KeyValueStoreException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

/**
 * Daily budget for the paid ISBN provider, shared by every instance through the key-value store.
 *
 * <p>Contract: a call of {@code cost} units is allowed iff
 * {@code used_today + cost <= limit - safety_buffer}. Cost is per call, not per item, so callers
 * batch as much as one call allows.</p>
 *
 * <p>Reset is date driven: usage lives in one counter per UTC day, keyed
 * {@code isbndb_daily_calls:<yyyy-MM-dd>} and expiring after two days. A new day starts from a
 * missing key, so no cron or reset write is needed and no instance can erase another's reservations
 * at midnight.</p>
 *
 * <p>The manager fails closed. When the store is unreachable every check denies, every
 * reservation is rejected and the reported status has {@code can_make_calls=false}.</p>
 */
@Service
@Slf4j
public class QuotaManager {

    /**
     * {@link net.bookharvest.domain.provider.ServiceContext} metadata key set by callers that already hold
     * a reservation for the next paid call, so the provider does not reserve a second unit.
     */
    public static final String PREPAID_CONTEXT_KEY = "quota.prepaid";

    static final String CALLS_KEY_PREFIX = "isbndb_daily_calls:";
    static final Duration COUNTER_TTL = Duration.ofHours(48);

    /**
     * Caller class used by {@link #shouldAllowOperation(OperationKind, int)}.
     */
    public enum OperationKind {
        /** One interactive lookup. */
        SINGLE,
        /** Background cron work; needs twice its cost as headroom. */
        CRON,
        /** Bulk operation; capped at a configured number of calls. */
        BULK
    }

    private final KeyValueStore store;
    private final Clock clock;
    private final long dailyLimit;
    private final long safetyBuffer;
    private final int bulkMaxCalls;
    private final Counter deniedCounter;
    private final Counter storeFailureCounter;

    public QuotaManager(KeyValueStore store,
                        Clock clock,
                        MeterRegistry meterRegistry,
                        @Value("${app.quota.daily-limit:15000}") long dailyLimit,
                        @Value("${app.quota.safety-buffer:2000}") long safetyBuffer,
                        @Value("${app.quota.bulk-max-calls:100}") int bulkMaxCalls) {
        if (safetyBuffer < 0 || safetyBuffer >= dailyLimit) {
            throw new IllegalArgumentException(
                "Safety buffer must be within [0, dailyLimit): buffer=" + safetyBuffer + ", limit=" + dailyLimit);
        }
        this.store = store;
        this.clock = clock;
        this.dailyLimit = dailyLimit;
        this.safetyBuffer = safetyBuffer;
        this.bulkMaxCalls = bulkMaxCalls;
        this.deniedCounter = Counter.builder("bookharvest.quota.denied")
            .description("Quota checks or reservations that were denied")
            .register(meterRegistry);
        this.storeFailureCounter = Counter.builder("bookharvest.quota.store_failures")
            .description("Quota operations that failed closed because the store was unavailable")
            .register(meterRegistry);
    }

    /**
     * Units that may be consumed today before the safety buffer is touched.
     */
    public long allowedCeiling() {
        return dailyLimit - safetyBuffer;
    }

    /**
     * Returns whether a call of {@code cost} units fits today's budget. Does not consume anything.
     */
    public boolean checkQuota(int cost) {
        validateCost(cost);
        try {
            long used = readUsed(today());
            boolean allowed = used + cost <= allowedCeiling();
            if (!allowed) {
                deniedCounter.increment();
                log.debug("[QUOTA] Check denied: used={} cost={} ceiling={}", used, cost, allowedCeiling());
            }
            return allowed;
        } catch (KeyValueStoreException e) {
            failClosed("checkQuota", e);
            return false;
        }
    }

    /**
     * Atomically reserves {@code cost} units. The counter is incremented first and rolled back when
     * the new value crosses the ceiling, so concurrent reservations never over-allow.
     *
     * @return a reservation token, or empty when the budget is exhausted or the store is unavailable
     */
    public Optional<QuotaReservation> reserve(int cost) {
        validateCost(cost);
        try {
            LocalDate today = today();
            long newValue = increment(today, cost);
            if (newValue > allowedCeiling()) {
                rollback(today, cost);
                deniedCounter.increment();
                log.info("[QUOTA] Reservation of {} rejected: would reach {} of ceiling {}", cost, newValue, allowedCeiling());
                return Optional.empty();
            }
            return Optional.of(new QuotaReservation(UUID.randomUUID(), cost, today));
        } catch (KeyValueStoreException e) {
            failClosed("reserve", e);
            return Optional.empty();
        }
    }

    /**
     * Acknowledges that the reserved call was made. The units stay counted.
     *
     * @return {@code false} if the token was already settled
     */
    public boolean commit(QuotaReservation reservation) {
        if (!reservation.settle()) {
            log.debug("[QUOTA] Ignoring commit of already settled {}", reservation.id());
            return false;
        }
        return true;
    }

    /**
     * Returns the reserved units when the call never happened. Tokens from an earlier UTC day are
     * settled without touching any counter, since that day's budget no longer matters.
     *
     * @return {@code false} if the token was already settled
     */
    public boolean release(QuotaReservation reservation) {
        if (!reservation.settle()) {
            log.debug("[QUOTA] Ignoring release of already settled {}", reservation.id());
            return false;
        }
        LocalDate today = today();
        if (!reservation.quotaDate().equals(today)) {
            log.debug("[QUOTA] Reservation {} belongs to {}; counter already rolled over", reservation.id(), reservation.quotaDate());
            return true;
        }
        rollback(today, reservation.cost());
        return true;
    }

    /**
     * Meters calls that were made without a prior reservation.
     */
    public void recordApiCall(int count) {
        validateCost(count);
        try {
            long newValue = increment(today(), count);
            log.debug("[QUOTA] Recorded {} call(s); used today={}", count, newValue);
        } catch (KeyValueStoreException e) {
            storeFailureCounter.increment();
            log.error("[QUOTA] Failed to record {} API call(s); usage is under-reported: {}", count, e.getMessage());
        }
    }

    public QuotaStatus getStatus() {
        try {
            LocalDate today = today();
            long used = readUsed(today);
            long remaining = Math.max(0, dailyLimit - used);
            long bufferRemaining = Math.max(0, allowedCeiling() - used);
            return new QuotaStatus(used, remaining, dailyLimit, safetyBuffer, bufferRemaining,
                today.toString(), hoursUntilReset(), bufferRemaining > 0);
        } catch (KeyValueStoreException e) {
            failClosed("getStatus", e);
            return QuotaStatus.unavailable(dailyLimit, safetyBuffer, hoursUntilReset());
        }
    }

    /**
     * Zeroes today's counter. Operator action only.
     *
     * @return {@code true} when the store accepted the reset
     */
    public boolean resetQuota() {
        try {
            store.set(callsKey(today()), "0", COUNTER_TTL);
            log.warn("[QUOTA] Daily quota manually reset");
            return true;
        } catch (KeyValueStoreException e) {
            failClosed("resetQuota", e);
            return false;
        }
    }

    /**
     * Largest number of calls, up to {@code requested}, that fits the remaining budget.
     */
    public int getSafeBatchSize(int requested) {
        if (requested <= 0) {
            return 0;
        }
        QuotaStatus status = getStatus();
        if (!status.canMakeCalls()) {
            return 0;
        }
        return (int) Math.min(requested, status.bufferRemaining());
    }

    /**
     * Applies per-caller policy on top of the plain budget check.
     */
    public QuotaDecision shouldAllowOperation(OperationKind kind, int estimatedCalls) {
        QuotaStatus status = getStatus();
        if (!status.canMakeCalls()) {
            return new QuotaDecision(false, "Quota exhausted or unavailable", status);
        }
        long available = status.bufferRemaining();
        return switch (kind) {
            case CRON -> available >= 2L * estimatedCalls
                ? new QuotaDecision(true, "Cron operation within doubled headroom", status)
                : new QuotaDecision(false, "Cron operation needs " + (2L * estimatedCalls)
                    + " calls of headroom, " + available + " available", status);
            case BULK -> {
                if (estimatedCalls > bulkMaxCalls) {
                    yield new QuotaDecision(false, "Bulk operation of " + estimatedCalls
                        + " calls exceeds the per-operation maximum of " + bulkMaxCalls, status);
                }
                yield available >= estimatedCalls
                    ? new QuotaDecision(true, "Bulk operation within budget", status)
                    : new QuotaDecision(false, "Bulk operation needs " + estimatedCalls + " calls, "
                        + available + " available", status);
            }
            case SINGLE -> available >= estimatedCalls
                ? new QuotaDecision(true, "Within budget", status)
                : new QuotaDecision(false, "Needs " + estimatedCalls + " calls, " + available + " available", status);
        };
    }

    static String callsKey(LocalDate date) {
        return CALLS_KEY_PREFIX + date;
    }

    private long increment(LocalDate date, long delta) {
        String key = callsKey(date);
        long newValue = store.incrementBy(key, delta);
        if (newValue == delta) {
            // First write of the day created the key
            store.expire(key, COUNTER_TTL);
        }
        return newValue;
    }

    private long readUsed(LocalDate date) {
        String key = callsKey(date);
        return store.get(key).map(raw -> {
            try {
                return Long.parseLong(raw.trim());
            } catch (NumberFormatException e) {
                // A corrupt counter must not read as zero
                throw new KeyValueStoreException("parse " + key, e);
            }
        }).orElse(0L);
    }

    private void rollback(LocalDate date, int cost) {
        try {
            store.incrementBy(callsKey(date), -cost);
        } catch (KeyValueStoreException e) {
            storeFailureCounter.increment();
            log.error("[QUOTA] Failed to return {} unit(s); usage is over-reported until reset: {}", cost, e.getMessage());
        }
    }

    private void failClosed(String operation, KeyValueStoreException e) {
        storeFailureCounter.increment();
        deniedCounter.increment();
        log.error("[QUOTA] {} failed closed: {}", operation, e.getMessage());
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    private long hoursUntilReset() {
        LocalDateTime now = LocalDateTime.now(clock.withZone(ZoneOffset.UTC));
        LocalDateTime nextMidnight = now.toLocalDate().plusDays(1).atStartOfDay();
        long minutes = Duration.between(now, nextMidnight).toMinutes();
        return (minutes + 59) / 60;
    }

    private static void validateCost(int cost) {
        if (cost < 1) {
            throw new IllegalArgumentException("Quota cost must be at least 1, was " + cost);
        }
    }
}
