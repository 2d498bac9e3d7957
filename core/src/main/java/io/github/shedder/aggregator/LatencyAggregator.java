package io.github.shedder.aggregator;

import io.github.shedder.window.Aggregation;
import io.github.shedder.window.RollingWindow;
import io.github.shedder.window.WindowResult;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rejection probability from request handling latency over a rolling window.
 *
 * <p>Every accepted request contributes its duration, in milliseconds, once it completes. The
 * probability stays at 0 until the window holds at least {@code requiredPoints} samples, so a
 * handful of slow requests after a quiet period cannot trigger shedding.</p>
 *
 * @see AverageLatencyAggregator
 * @see PercentileLatencyAggregator
 */
public abstract class LatencyAggregator implements Aggregator, RequestObserver {

    private final ThresholdCurve curve;
    private final RollingWindow window;
    private final int requiredPoints;

    protected LatencyAggregator(Settings<?> settings, Aggregation aggregation) {
        if (settings.requiredPoints < 0) {
            throw new IllegalArgumentException("Required points cannot be negative, got " + settings.requiredPoints);
        }
        if (settings.lower == null || settings.upper == null) {
            throw new IllegalStateException("Latency thresholds are required");
        }
        this.curve = new ThresholdCurve(toMillis(settings.lower), toMillis(settings.upper));
        this.window = RollingWindow.builder()
            .clock(settings.clock)
            .bucketSize(settings.bucketSize)
            .buckets(settings.buckets)
            .aggregation(aggregation)
            .preallocationHint(settings.preallocationHint)
            .build();
        this.requiredPoints = settings.requiredPoints;
    }

    @Override
    public double aggregate() {
        WindowResult result = window.aggregate();
        if (result.pointCount() < requiredPoints || !result.hasData()) {
            return 0.0;
        }
        return curve.probability(result.value());
    }

    /**
     * Record a completed request's handling time.
     */
    public void record(Duration latency) {
        window.record(toMillis(latency));
    }

    /**
     * Record a completed request's handling time in milliseconds.
     */
    public void record(double latencyMs) {
        window.record(latencyMs);
    }

    @Override
    public Sample begin() {
        return new LatencySample(this);
    }

    public ThresholdCurve curve() {
        return curve;
    }

    public int requiredPoints() {
        return requiredPoints;
    }

    RollingWindow window() {
        return window;
    }

    private static double toMillis(Duration duration) {
        return duration.toNanos() / 1_000_000.0;
    }

    // ============ Inner Classes ============

    private static class LatencySample implements Sample {
        private final LatencyAggregator aggregator;
        private final long startNanos;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        LatencySample(LatencyAggregator aggregator) {
            this.aggregator = aggregator;
            this.startNanos = System.nanoTime();
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                aggregator.record((System.nanoTime() - startNanos) / 1_000_000.0);
            }
        }
    }

    /**
     * Settings shared by both latency aggregators.
     */
    public abstract static class Settings<B extends Settings<B>> {
        private Duration lower;
        private Duration upper;
        private Duration bucketSize = Duration.ofSeconds(1);
        private int buckets = 10;
        private int requiredPoints = 5;
        private int preallocationHint = 0;
        private Clock clock = Clock.systemUTC();

        protected abstract B self();

        /**
         * @param lower latency where shedding begins
         * @param upper latency where every request is shed
         */
        public B thresholds(Duration lower, Duration upper) {
            this.lower = lower;
            this.upper = upper;
            return self();
        }

        public B bucketSize(Duration bucketSize) {
            this.bucketSize = bucketSize;
            return self();
        }

        public B buckets(int buckets) {
            this.buckets = buckets;
            return self();
        }

        /**
         * Minimum samples in the window before the aggregator reports anything but 0.
         */
        public B requiredPoints(int requiredPoints) {
            this.requiredPoints = requiredPoints;
            return self();
        }

        public B preallocationHint(int preallocationHint) {
            this.preallocationHint = preallocationHint;
            return self();
        }

        public B clock(Clock clock) {
            this.clock = clock;
            return self();
        }
    }
}
