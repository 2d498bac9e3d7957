package io.github.shedder.aggregator;

/**
 * Turns one load signal into a rejection probability.
 *
 * <ul>
 *   <li>0.0 = signal is healthy, never reject on its account</li>
 *   <li>0.5 = reject about half of incoming requests</li>
 *   <li>1.0 = signal is saturated, reject everything</li>
 * </ul>
 *
 * <p>Implementations hold a reference to their signal internally, so {@link #aggregate()} takes no
 * parameters. Built-in and custom aggregators implement the same interface:</p>
 *
 * <pre>{@code
 * Aggregator queueDepth = () -> queue.size() > 1000 ? 1.0 : 0.0;
 * }</pre>
 */
@FunctionalInterface
public interface Aggregator {

    /**
     * Current rejection probability.
     *
     * @return probability between 0.0 (accept all) and 1.0 (reject all)
     */
    double aggregate();
}
