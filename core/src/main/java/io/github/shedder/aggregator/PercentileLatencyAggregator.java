package io.github.shedder.aggregator;

import io.github.shedder.window.Aggregation;

/**
 * {@link LatencyAggregator} over a percentile of handling times in the window.
 *
 * <p>Raw samples are kept for every bucket still inside the span and merged on read, so the
 * percentile is exact (inclusive method, linear interpolation between ranks).</p>
 *
 * <pre>{@code
 * PercentileLatencyAggregator p95 = PercentileLatencyAggregator.builder()
 *     .percentile(95)
 *     .thresholds(Duration.ofMillis(300), Duration.ofMillis(800))
 *     .build();
 * }</pre>
 */
public class PercentileLatencyAggregator extends LatencyAggregator {

    private final double percentile;

    private PercentileLatencyAggregator(Builder builder) {
        super(builder, Aggregation.percentile(builder.percentile));
        this.percentile = builder.percentile;
    }

    public double percentile() {
        return percentile;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends Settings<Builder> {
        private double percentile = 95;

        @Override
        protected Builder self() {
            return this;
        }

        /**
         * Target percentile in [0, 100].
         */
        public Builder percentile(double percentile) {
            this.percentile = percentile;
            return this;
        }

        public PercentileLatencyAggregator build() {
            return new PercentileLatencyAggregator(this);
        }
    }
}
