package io.github.shedder.demo;

import io.github.shedder.aggregator.ConcurrencyCounter;

import java.util.Random;

/**
 * Simulated handler latency that grows with the number of requests in flight.
 *
 * <p>Models contention in a backend with a fixed number of workers:</p>
 * <ul>
 *   <li>In flight 0-19:   ~50ms</li>
 *   <li>In flight 20-39:  P95 grows from 50ms to 200ms</li>
 *   <li>In flight 40-59:  P95 grows from 200ms to 800ms</li>
 *   <li>In flight 60+:    P95 of 1600ms</li>
 * </ul>
 */
public class LatencySimulator {

    private static final int BASELINE_MS = 50;
    private static final int TIER1_P95 = 200;
    private static final int TIER2_P95 = 800;
    private static final int TIER3_P95 = 1600;

    private final Random random = new Random();
    private final ConcurrencyCounter inFlight;

    public LatencySimulator(ConcurrencyCounter inFlight) {
        this.inFlight = inFlight;
    }

    /**
     * Sleep for as long as a request would take at the current concurrency.
     */
    public long simulate() throws InterruptedException {
        long latency = calculateLatency(inFlight.current());
        Thread.sleep(latency);
        return latency;
    }

    public long calculateLatency(long concurrency) {
        if (concurrency < 20) {
            return BASELINE_MS + random.nextInt(10);
        } else if (concurrency < 40) {
            double progress = (concurrency - 20) / 20.0;
            return tieredLatency((int) lerp(BASELINE_MS, TIER1_P95, progress), 0.95);
        } else if (concurrency < 60) {
            double progress = (concurrency - 40) / 20.0;
            return tieredLatency((int) lerp(TIER1_P95, TIER2_P95, progress), 0.95);
        } else {
            return tieredLatency(TIER3_P95, 0.95);
        }
    }

    /**
     * Latency whose given percentile sits at {@code targetLatency}, with a tail up to twice that.
     */
    private long tieredLatency(int targetLatency, double percentile) {
        double u = random.nextDouble();
        if (u < percentile) {
            double shaped = Math.sqrt(u / percentile);
            return Math.round(targetLatency * 0.3 + targetLatency * 0.7 * shaped);
        }
        double excess = (u - percentile) / (1.0 - percentile);
        return Math.round(targetLatency * (1.0 + excess));
    }

    private static double lerp(double a, double b, double t) {
        return a + (b - a) * t;
    }
}
