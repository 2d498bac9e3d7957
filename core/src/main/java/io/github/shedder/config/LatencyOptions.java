package io.github.shedder.config;

import java.time.Duration;

/**
 * Enables the average latency aggregator.
 *
 * @param lower average latency where shedding begins
 * @param upper average latency where every request is shed
 * @param bucketSize width of one window bucket, default 1s
 * @param buckets number of buckets in the window, default 10
 * @param requiredPoints samples needed in the window before shedding, default 5
 * @param preallocationHint expected samples per bucket, default 0
 */
public record LatencyOptions(
    Duration lower,
    Duration upper,
    Duration bucketSize,
    Integer buckets,
    Integer requiredPoints,
    Integer preallocationHint
) {

    public static final Duration DEFAULT_BUCKET_SIZE = Duration.ofSeconds(1);
    public static final int DEFAULT_BUCKETS = 10;
    public static final int DEFAULT_REQUIRED_POINTS = 5;

    public LatencyOptions {
        Thresholds.check("averageLatency", lower, upper);
        if (bucketSize == null) bucketSize = DEFAULT_BUCKET_SIZE;
        if (buckets == null) buckets = DEFAULT_BUCKETS;
        if (requiredPoints == null) requiredPoints = DEFAULT_REQUIRED_POINTS;
        if (preallocationHint == null) preallocationHint = 0;
        Thresholds.checkWindow("averageLatency", bucketSize, buckets, requiredPoints, preallocationHint);
    }

    public static LatencyOptions of(Duration lower, Duration upper) {
        return new LatencyOptions(lower, upper, null, null, null, null);
    }

    public LatencyOptions withWindow(Duration bucketSize, int buckets, int requiredPoints) {
        return new LatencyOptions(lower, upper, bucketSize, buckets, requiredPoints, preallocationHint);
    }

    public LatencyOptions withPreallocationHint(int preallocationHint) {
        return new LatencyOptions(lower, upper, bucketSize, buckets, requiredPoints, preallocationHint);
    }
}
