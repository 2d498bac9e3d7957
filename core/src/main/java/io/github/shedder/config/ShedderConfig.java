package io.github.shedder.config;

/**
 * Complete configuration for a {@link io.github.shedder.LoadShedder}. A null section leaves that
 * aggregator disabled; a config with every section null sheds nothing.
 *
 * <p>Example JSON:</p>
 * <pre>{@code
 * {
 *   "cpu": { "lower": 0.6, "upper": 0.8, "pollingInterval": "PT1S", "windowSize": 10 },
 *   "averageLatency": {
 *     "lower": "PT0.5S", "upper": "PT1S",
 *     "bucketSize": "PT1S", "buckets": 10, "requiredPoints": 5
 *   },
 *   "percentileLatency": {
 *     "lower": "PT0.3S", "upper": "PT0.8S", "percentile": 99
 *   },
 *   "concurrency": { "lower": 2500, "upper": 5000 }
 * }
 * }</pre>
 */
public record ShedderConfig(
    CpuOptions cpu,
    LatencyOptions averageLatency,
    PercentileLatencyOptions percentileLatency,
    ConcurrencyOptions concurrency
) {

    public static ShedderConfig empty() {
        return new ShedderConfig(null, null, null, null);
    }
}
