package net.bookharvest.service;

import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Token returned by {@link QuotaManager#reserve(int)}. The reserved units are already counted;
 * the holder settles the token exactly once with {@code commit} (call made) or {@code release}
 * (call never made).
 */
public final class QuotaReservation {

    private final UUID id;
    private final int cost;
    private final LocalDate quotaDate;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    QuotaReservation(UUID id, int cost, LocalDate quotaDate) {
        this.id = Objects.requireNonNull(id, "id");
        this.cost = cost;
        this.quotaDate = Objects.requireNonNull(quotaDate, "quotaDate");
    }

    public UUID id() {
        return id;
    }

    public int cost() {
        return cost;
    }

    public LocalDate quotaDate() {
        return quotaDate;
    }

    public boolean isSettled() {
        return settled.get();
    }

    boolean settle() {
        return settled.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "QuotaReservation{id=" + id + ", cost=" + cost + ", date=" + quotaDate + ", settled=" + settled.get() + "}";
    }
}
