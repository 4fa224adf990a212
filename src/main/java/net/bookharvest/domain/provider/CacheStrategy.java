package net.bookharvest.domain.provider;

/**
 * How a single provider call interacts with the shared response cache.
 */
public enum CacheStrategy {
    READ_WRITE(true, true),
    READ_ONLY(true, false),
    WRITE_ONLY(false, true),
    DISABLED(false, false);

    private final boolean reads;
    private final boolean writes;

    CacheStrategy(boolean reads, boolean writes) {
        this.reads = reads;
        this.writes = writes;
    }

    public boolean reads() {
        return reads;
    }

    public boolean writes() {
        return writes;
    }
}
