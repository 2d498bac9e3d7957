package io.github.shedder.aggregator;

import io.github.shedder.window.Aggregation;

/**
 * {@link LatencyAggregator} over the mean handling time in the window.
 *
 * <pre>{@code
 * AverageLatencyAggregator latency = AverageLatencyAggregator.builder()
 *     .thresholds(Duration.ofMillis(500), Duration.ofSeconds(1))
 *     .bucketSize(Duration.ofSeconds(1))
 *     .buckets(10)
 *     .requiredPoints(5)
 *     .build();
 * }</pre>
 */
public class AverageLatencyAggregator extends LatencyAggregator {

    private AverageLatencyAggregator(Builder builder) {
        super(builder, Aggregation.average());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends Settings<Builder> {
        @Override
        protected Builder self() {
            return this;
        }

        public AverageLatencyAggregator build() {
            return new AverageLatencyAggregator(this);
        }
    }
}
