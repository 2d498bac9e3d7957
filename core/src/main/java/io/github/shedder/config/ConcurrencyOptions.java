package io.github.shedder.config;

/**
 * Enables the concurrency aggregator.
 *
 * @param lower in-flight requests where shedding begins
 * @param upper in-flight requests where every request is shed
 */
public record ConcurrencyOptions(long lower, long upper) {

    public ConcurrencyOptions {
        if (lower < 0) {
            throw new IllegalArgumentException("concurrency: lower threshold cannot be negative, got " + lower);
        }
        Thresholds.check("concurrency", lower, upper);
    }

    public static ConcurrencyOptions of(long lower, long upper) {
        return new ConcurrencyOptions(lower, upper);
    }
}
