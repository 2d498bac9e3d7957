package io.github.shedder.config;

import java.time.Duration;

/**
 * Enables the CPU aggregator.
 *
 * @param lower utilization (0-1) where shedding begins
 * @param upper utilization (0-1) where every request is shed
 * @param pollingInterval time between CPU readings, default 1s
 * @param windowSize number of readings averaged over, default 10
 */
public record CpuOptions(
    double lower,
    double upper,
    Duration pollingInterval,
    Integer windowSize
) {

    public static final Duration DEFAULT_POLLING_INTERVAL = Duration.ofSeconds(1);
    public static final int DEFAULT_WINDOW_SIZE = 10;

    public CpuOptions {
        Thresholds.check("cpu", lower, upper);
        if (pollingInterval == null) pollingInterval = DEFAULT_POLLING_INTERVAL;
        if (windowSize == null) windowSize = DEFAULT_WINDOW_SIZE;
        if (pollingInterval.toMillis() <= 0) {
            throw new IllegalArgumentException("cpu: polling interval must be at least 1ms, got " + pollingInterval);
        }
        if (windowSize <= 0) {
            throw new IllegalArgumentException("cpu: window size must be positive, got " + windowSize);
        }
    }

    public static CpuOptions of(double lower, double upper) {
        return new CpuOptions(lower, upper, null, null);
    }

    public CpuOptions withPolling(Duration pollingInterval, int windowSize) {
        return new CpuOptions(lower, upper, pollingInterval, windowSize);
    }
}
