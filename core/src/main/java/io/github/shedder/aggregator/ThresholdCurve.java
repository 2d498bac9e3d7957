package io.github.shedder.aggregator;

/**
 * Two-threshold proportional curve from a metric value to a rejection probability.
 *
 * <pre>
 * value &lt;= lower  →  0.0
 * value &gt;= upper  →  1.0
 * otherwise       →  (value - lower) / (upper - lower)
 * </pre>
 *
 * <p>Example for CPU utilization:</p>
 * <pre>{@code
 * ThresholdCurve curve = new ThresholdCurve(0.6, 0.8);
 * curve.probability(0.5);  // 0.0
 * curve.probability(0.7);  // 0.5
 * curve.probability(0.9);  // 1.0
 * }</pre>
 *
 * @param lower value at or below which nothing is rejected
 * @param upper value at or above which everything is rejected
 */
public record ThresholdCurve(double lower, double upper) {

    public ThresholdCurve {
        if (!Double.isFinite(lower) || !Double.isFinite(upper)) {
            throw new IllegalArgumentException("Thresholds must be finite, got lower=" + lower + ", upper=" + upper);
        }
        if (lower >= upper) {
            throw new IllegalArgumentException(
                "Lower threshold must be below upper threshold, got lower=" + lower + ", upper=" + upper);
        }
    }

    /**
     * Rejection probability for a single value.
     */
    public double probability(double value) {
        if (value <= lower) {
            return 0.0;
        }
        if (value >= upper) {
            return 1.0;
        }
        return (value - lower) / (upper - lower);
    }
}
