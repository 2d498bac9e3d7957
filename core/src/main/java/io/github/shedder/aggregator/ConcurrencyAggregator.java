package io.github.shedder.aggregator;

/**
 * Rejection probability from the number of requests in flight right now.
 *
 * <p>Not windowed: the counter is read as-is on every call.</p>
 */
public class ConcurrencyAggregator implements Aggregator, RequestObserver {

    private final ThresholdCurve curve;
    private final ConcurrencyCounter counter;

    public ConcurrencyAggregator(long lower, long upper) {
        this(lower, upper, new ConcurrencyCounter());
    }

    /**
     * Share an existing counter, e.g. one also used for graceful shutdown.
     */
    public ConcurrencyAggregator(long lower, long upper, ConcurrencyCounter counter) {
        if (lower < 0) {
            throw new IllegalArgumentException("Lower concurrency threshold cannot be negative, got " + lower);
        }
        if (counter == null) {
            throw new IllegalArgumentException("Counter cannot be null");
        }
        this.curve = new ThresholdCurve(lower, upper);
        this.counter = counter;
    }

    @Override
    public double aggregate() {
        return curve.probability(counter.current());
    }

    @Override
    public Sample begin() {
        return counter.track();
    }

    public ConcurrencyCounter counter() {
        return counter;
    }

    public ThresholdCurve curve() {
        return curve;
    }
}
