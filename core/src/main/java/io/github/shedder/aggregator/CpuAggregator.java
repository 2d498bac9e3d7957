package io.github.shedder.aggregator;

import io.github.shedder.window.Aggregation;
import io.github.shedder.window.RollingWindow;
import io.github.shedder.window.WindowResult;

import java.time.Clock;
import java.time.Duration;

/**
 * Rejection probability from the average host CPU utilization over a rolling window.
 *
 * <p>Owns a {@link CpuSampler} that polls every {@code pollingInterval} into a window of
 * {@code windowSize} buckets, one per poll. Until the first reading lands the probability is 0.</p>
 *
 * <pre>{@code
 * CpuAggregator cpu = CpuAggregator.builder()
 *     .thresholds(0.6, 0.8)
 *     .pollingInterval(Duration.ofSeconds(1))
 *     .windowSize(10)
 *     .build();
 * cpu.start();
 * double p = cpu.aggregate();
 * cpu.close();
 * }</pre>
 */
public class CpuAggregator implements Aggregator, AutoCloseable {

    private final ThresholdCurve curve;
    private final RollingWindow window;
    private final CpuSampler sampler;

    private CpuAggregator(ThresholdCurve curve, RollingWindow window, CpuSampler sampler) {
        this.curve = curve;
        this.window = window;
        this.sampler = sampler;
    }

    @Override
    public double aggregate() {
        WindowResult result = window.aggregate();
        if (!result.hasData()) {
            return 0.0;
        }
        return curve.probability(result.value());
    }

    public void start() {
        sampler.start();
    }

    @Override
    public void close() {
        sampler.stop();
    }

    public ThresholdCurve curve() {
        return curve;
    }

    RollingWindow window() {
        return window;
    }

    CpuSampler sampler() {
        return sampler;
    }

    // ============ Builder ============

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Double lower;
        private Double upper;
        private Duration pollingInterval = Duration.ofSeconds(1);
        private int windowSize = 10;
        private CpuUsageSource source;
        private Clock clock = Clock.systemUTC();

        /**
         * @param lower utilization (0-1) where shedding begins
         * @param upper utilization (0-1) where every request is shed
         */
        public Builder thresholds(double lower, double upper) {
            this.lower = lower;
            this.upper = upper;
            return this;
        }

        public Builder pollingInterval(Duration pollingInterval) {
            this.pollingInterval = pollingInterval;
            return this;
        }

        /**
         * Number of polls averaged over.
         */
        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public Builder source(CpuUsageSource source) {
            this.source = source;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CpuAggregator build() {
            if (lower == null || upper == null) {
                throw new IllegalStateException("CPU thresholds are required");
            }
            ThresholdCurve curve = new ThresholdCurve(lower, upper);
            RollingWindow window = RollingWindow.builder()
                .clock(clock)
                .bucketSize(pollingInterval)
                .buckets(windowSize)
                .aggregation(Aggregation.average())
                .build();
            CpuSampler sampler = new CpuSampler(source != null ? source : new SystemCpuUsage(), window, pollingInterval);
            return new CpuAggregator(curve, window, sampler);
        }
    }
}
