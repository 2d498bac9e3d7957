package io.github.shedder.config;

import java.time.Duration;

/**
 * Enables the percentile latency aggregator. Same window settings as {@link LatencyOptions}.
 *
 * @param percentile target percentile in [0, 100], default 95
 */
public record PercentileLatencyOptions(
    Duration lower,
    Duration upper,
    Duration bucketSize,
    Integer buckets,
    Integer requiredPoints,
    Integer preallocationHint,
    Double percentile
) {

    public static final double DEFAULT_PERCENTILE = 95;

    public PercentileLatencyOptions {
        Thresholds.check("percentileLatency", lower, upper);
        if (bucketSize == null) bucketSize = LatencyOptions.DEFAULT_BUCKET_SIZE;
        if (buckets == null) buckets = LatencyOptions.DEFAULT_BUCKETS;
        if (requiredPoints == null) requiredPoints = LatencyOptions.DEFAULT_REQUIRED_POINTS;
        if (preallocationHint == null) preallocationHint = 0;
        if (percentile == null) percentile = DEFAULT_PERCENTILE;
        Thresholds.checkWindow("percentileLatency", bucketSize, buckets, requiredPoints, preallocationHint);
        if (!(percentile >= 0 && percentile <= 100)) {
            throw new IllegalArgumentException("percentileLatency: percentile must be within [0, 100], got " + percentile);
        }
    }

    public static PercentileLatencyOptions of(double percentile, Duration lower, Duration upper) {
        return new PercentileLatencyOptions(lower, upper, null, null, null, null, percentile);
    }

    public PercentileLatencyOptions withWindow(Duration bucketSize, int buckets, int requiredPoints) {
        return new PercentileLatencyOptions(lower, upper, bucketSize, buckets, requiredPoints, preallocationHint, percentile);
    }

    public PercentileLatencyOptions withPreallocationHint(int preallocationHint) {
        return new PercentileLatencyOptions(lower, upper, bucketSize, buckets, requiredPoints, preallocationHint, percentile);
    }
}
