package io.github.shedder;

import io.github.shedder.aggregator.Aggregator;
import io.github.shedder.aggregator.AverageLatencyAggregator;
import io.github.shedder.aggregator.ConcurrencyAggregator;
import io.github.shedder.aggregator.ConcurrencyCounter;
import io.github.shedder.aggregator.CpuAggregator;
import io.github.shedder.aggregator.CpuUsageSource;
import io.github.shedder.aggregator.PercentileLatencyAggregator;
import io.github.shedder.config.ConcurrencyOptions;
import io.github.shedder.config.CpuOptions;
import io.github.shedder.config.LatencyOptions;
import io.github.shedder.config.PercentileLatencyOptions;
import io.github.shedder.config.ShedderConfig;
import io.github.shedder.engine.Admission;
import io.github.shedder.engine.Decision;
import io.github.shedder.engine.DecisionEngine;
import io.github.shedder.engine.EngineSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;

/**
 * Adaptive load shedder: rejects a share of requests proportional to how overloaded the process is.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * LoadShedder shedder = LoadShedder.builder()
 *     .cpu(CpuOptions.of(0.6, 0.8))                      // shed between 60% and 80% CPU
 *     .averageLatency(LatencyOptions.of(
 *         Duration.ofMillis(500), Duration.ofSeconds(1)))  // shed between 500ms and 1s average
 *     .concurrency(ConcurrencyOptions.of(2500, 5000))     // shed between 2500 and 5000 in flight
 *     .aggregator("queue", () -> queue.size() / 10_000.0) // any custom signal
 *     .build();
 *
 * try (Admission admission = shedder.admit()) {
 *     if (!admission.isAccepted()) {
 *         return serviceUnavailable();
 *     }
 *     return handle(request);
 * }
 *
 * shedder.close();  // stops CPU sampling
 * }</pre>
 *
 * <p>Built-in aggregators are registered under {@link #CPU}, {@link #AVERAGE_LATENCY},
 * {@link #PERCENTILE_LATENCY} and {@link #CONCURRENCY}, in that order, followed by custom ones.</p>
 */
public class LoadShedder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoadShedder.class);

    public static final String CPU = "cpu";
    public static final String AVERAGE_LATENCY = "averageLatency";
    public static final String PERCENTILE_LATENCY = "percentileLatency";
    public static final String CONCURRENCY = "concurrency";

    private final DecisionEngine engine;
    private final CpuAggregator cpuAggregator;
    private final ConcurrencyAggregator concurrencyAggregator;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private LoadShedder(DecisionEngine engine, CpuAggregator cpuAggregator, ConcurrencyAggregator concurrencyAggregator) {
        this.engine = engine;
        this.cpuAggregator = cpuAggregator;
        this.concurrencyAggregator = concurrencyAggregator;
    }

    /**
     * Build from a loaded configuration with default clock, random source and CPU source.
     */
    public static LoadShedder fromConfig(ShedderConfig config) {
        return builder().config(config).build();
    }

    // ============ Decisions ============

    /**
     * Accept or reject one request, without observing it.
     */
    public Decision decide() {
        return engine.decide();
    }

    /**
     * Accept or reject one request; on acceptance start measuring it.
     * Close the returned admission once the request completes.
     */
    public Admission admit() {
        return engine.admit();
    }

    /**
     * Combined rejection probability right now.
     */
    public double probability() {
        return engine.probability();
    }

    /**
     * Current probability with every aggregator's contribution, for diagnostics.
     */
    public EngineSnapshot snapshot() {
        return engine.snapshot();
    }

    // ============ Accessors ============

    public DecisionEngine engine() {
        return engine;
    }

    public Set<String> aggregatorNames() {
        return engine.aggregatorNames();
    }

    /**
     * In-flight counter of the concurrency aggregator, or null if it is not enabled.
     */
    public ConcurrencyCounter inFlight() {
        return concurrencyAggregator != null ? concurrencyAggregator.counter() : null;
    }

    /**
     * Stop background CPU sampling. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (cpuAggregator != null) {
            cpuAggregator.close();
        }
    }

    // ============ Builder ============

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CpuOptions cpu;
        private LatencyOptions averageLatency;
        private PercentileLatencyOptions percentileLatency;
        private ConcurrencyOptions concurrency;
        private ConcurrencyCounter counter;
        private final Map<String, Aggregator> custom = new LinkedHashMap<>();

        private Clock clock = Clock.systemUTC();
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();
        private CpuUsageSource cpuUsageSource;
        private boolean startSampling = true;

        /**
         * Apply every enabled section of a configuration. Replaces earlier settings for those sections.
         */
        public Builder config(ShedderConfig config) {
            if (config.cpu() != null) cpu(config.cpu());
            if (config.averageLatency() != null) averageLatency(config.averageLatency());
            if (config.percentileLatency() != null) percentileLatency(config.percentileLatency());
            if (config.concurrency() != null) concurrency(config.concurrency());
            return this;
        }

        public Builder cpu(CpuOptions options) {
            this.cpu = options;
            return this;
        }

        public Builder averageLatency(LatencyOptions options) {
            this.averageLatency = options;
            return this;
        }

        public Builder percentileLatency(PercentileLatencyOptions options) {
            this.percentileLatency = options;
            return this;
        }

        public Builder concurrency(ConcurrencyOptions options) {
            this.concurrency = options;
            return this;
        }

        /**
         * Use an existing counter for the concurrency aggregator, e.g. one shared with shutdown logic.
         * Requires {@link #concurrency(ConcurrencyOptions)}.
         */
        public Builder concurrencyCounter(ConcurrencyCounter counter) {
            this.counter = counter;
            return this;
        }

        /**
         * Register a custom aggregator. Its output is clamped into [0, 1].
         *
         * @param name unique name, used in snapshots and logs
         */
        public Builder aggregator(String name, Aggregator aggregator) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Aggregator name cannot be null or blank");
            }
            if (aggregator == null) {
                throw new IllegalArgumentException("Aggregator cannot be null");
            }
            if (isBuiltInName(name) || custom.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate aggregator name: " + name);
            }
            custom.put(name, aggregator);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Source of uniform draws in [0, 1) used for each decision.
         */
        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public Builder cpuUsageSource(CpuUsageSource source) {
            this.cpuUsageSource = source;
            return this;
        }

        /**
         * Whether {@link #build()} starts the CPU sampler. Defaults to true.
         */
        public Builder startSampling(boolean startSampling) {
            this.startSampling = startSampling;
            return this;
        }

        public LoadShedder build() {
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            if (random == null) {
                throw new IllegalStateException("Random source is required");
            }
            if (counter != null && concurrency == null) {
                throw new IllegalStateException("Concurrency counter given without concurrency options");
            }

            Map<String, Aggregator> aggregators = new LinkedHashMap<>();

            CpuAggregator cpuAggregator = null;
            if (cpu != null) {
                cpuAggregator = CpuAggregator.builder()
                    .thresholds(cpu.lower(), cpu.upper())
                    .pollingInterval(cpu.pollingInterval())
                    .windowSize(cpu.windowSize())
                    .source(cpuUsageSource)
                    .clock(clock)
                    .build();
                aggregators.put(CPU, cpuAggregator);
            }

            if (averageLatency != null) {
                aggregators.put(AVERAGE_LATENCY, AverageLatencyAggregator.builder()
                    .thresholds(averageLatency.lower(), averageLatency.upper())
                    .bucketSize(averageLatency.bucketSize())
                    .buckets(averageLatency.buckets())
                    .requiredPoints(averageLatency.requiredPoints())
                    .preallocationHint(averageLatency.preallocationHint())
                    .clock(clock)
                    .build());
            }

            if (percentileLatency != null) {
                aggregators.put(PERCENTILE_LATENCY, PercentileLatencyAggregator.builder()
                    .percentile(percentileLatency.percentile())
                    .thresholds(percentileLatency.lower(), percentileLatency.upper())
                    .bucketSize(percentileLatency.bucketSize())
                    .buckets(percentileLatency.buckets())
                    .requiredPoints(percentileLatency.requiredPoints())
                    .preallocationHint(percentileLatency.preallocationHint())
                    .clock(clock)
                    .build());
            }

            ConcurrencyAggregator concurrencyAggregator = null;
            if (concurrency != null) {
                concurrencyAggregator = new ConcurrencyAggregator(
                    concurrency.lower(), concurrency.upper(),
                    counter != null ? counter : new ConcurrencyCounter());
                aggregators.put(CONCURRENCY, concurrencyAggregator);
            }

            aggregators.putAll(custom);

            DecisionEngine engine = new DecisionEngine(aggregators, random, clock);
            if (cpuAggregator != null && startSampling) {
                cpuAggregator.start();
            }

            if (aggregators.isEmpty()) {
                log.info("Load shedder built with no aggregators, all requests pass through");
            } else {
                log.info("Load shedder built with aggregators: {}", aggregators.keySet());
            }
            return new LoadShedder(engine, cpuAggregator, concurrencyAggregator);
        }

        private static boolean isBuiltInName(String name) {
            return CPU.equals(name) || AVERAGE_LATENCY.equals(name)
                || PERCENTILE_LATENCY.equals(name) || CONCURRENCY.equals(name);
        }
    }
}
