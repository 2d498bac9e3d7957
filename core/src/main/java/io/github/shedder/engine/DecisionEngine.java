package io.github.shedder.engine;

import io.github.shedder.aggregator.Aggregator;
import io.github.shedder.aggregator.RequestObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Combines every configured {@link Aggregator} into one accept/reject verdict per request.
 *
 * <p>The combined probability is the maximum over all aggregators, so any single overloaded
 * signal can trigger shedding on its own. A request is rejected when a uniform draw in [0, 1)
 * falls below that probability. With no aggregators every request is accepted.</p>
 *
 * <pre>
 *   cpu ──────────┐
 *   avgLatency ───┤    max    ┌──────────┐   r &lt; p ?   REJECT
 *   concurrency ──┼─────────▶ │    p     │ ──────────▶
 *   custom ───────┘           └──────────┘             ACCEPT
 * </pre>
 *
 * <p>Aggregator output is clamped into [0, 1] (NaN counts as 0). An aggregator that throws
 * contributes 0.</p>
 */
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final Map<String, Aggregator> aggregators;
    private final List<RequestObserver> observers;
    private final DoubleSupplier random;
    private final Clock clock;
    private final Set<String> reportedMisbehaving = ConcurrentHashMap.newKeySet();

    public DecisionEngine(Map<String, Aggregator> aggregators) {
        this(aggregators, () -> ThreadLocalRandom.current().nextDouble(), Clock.systemUTC());
    }

    /**
     * @param aggregators aggregators by name, iterated in map order
     * @param random source of uniform draws in [0, 1)
     * @param clock clock stamped on snapshots
     */
    public DecisionEngine(Map<String, Aggregator> aggregators, DoubleSupplier random, Clock clock) {
        if (aggregators == null || random == null || clock == null) {
            throw new IllegalArgumentException("Aggregators, random source and clock are required");
        }
        this.aggregators = Collections.unmodifiableMap(new LinkedHashMap<>(aggregators));
        this.random = random;
        this.clock = clock;

        List<RequestObserver> found = new ArrayList<>();
        for (Aggregator aggregator : this.aggregators.values()) {
            if (aggregator instanceof RequestObserver observer) {
                found.add(observer);
            }
        }
        this.observers = List.copyOf(found);
    }

    // ============ Probability ============

    /**
     * Combined rejection probability right now.
     */
    public double probability() {
        double max = 0.0;
        for (Map.Entry<String, Aggregator> entry : aggregators.entrySet()) {
            max = Math.max(max, evaluate(entry.getKey(), entry.getValue()));
            if (max >= 1.0) {
                break;
            }
        }
        return max;
    }

    /**
     * Combined probability plus each aggregator's contribution.
     */
    public EngineSnapshot snapshot() {
        Map<String, Double> contributions = new LinkedHashMap<>();
        double max = 0.0;
        for (Map.Entry<String, Aggregator> entry : aggregators.entrySet()) {
            double p = evaluate(entry.getKey(), entry.getValue());
            contributions.put(entry.getKey(), p);
            max = Math.max(max, p);
        }
        return new EngineSnapshot(clock.instant(), max, contributions);
    }

    private double evaluate(String name, Aggregator aggregator) {
        double p;
        try {
            p = aggregator.aggregate();
        } catch (RuntimeException e) {
            if (reportedMisbehaving.add(name)) {
                log.warn("Aggregator '{}' failed, treating it as 0", name, e);
            }
            return 0.0;
        }
        if (p >= 0.0 && p <= 1.0) {
            return p;
        }
        if (reportedMisbehaving.add(name)) {
            log.warn("Aggregator '{}' returned {} outside [0, 1], clamping", name, p);
        }
        return Double.isNaN(p) ? 0.0 : Math.max(0.0, Math.min(1.0, p));
    }

    // ============ Decision ============

    /**
     * Decide on one request with a fresh random draw.
     */
    public Decision decide() {
        if (aggregators.isEmpty()) {
            return Decision.ACCEPT;
        }
        double p = probability();
        if (p <= 0.0) {
            return Decision.ACCEPT;
        }
        return random.getAsDouble() < p ? Decision.REJECT : Decision.ACCEPT;
    }

    /**
     * Decide on one request with the given draw: rejected iff {@code draw < probability()}.
     *
     * @param draw value in [0, 1)
     */
    public Decision decide(double draw) {
        if (aggregators.isEmpty()) {
            return Decision.ACCEPT;
        }
        return draw < probability() ? Decision.REJECT : Decision.ACCEPT;
    }

    /**
     * Decide, and on acceptance start observing the request.
     *
     * @return an admission to close when the request completes
     */
    public Admission admit() {
        if (decide() == Decision.REJECT) {
            return Admission.rejected();
        }
        if (observers.isEmpty()) {
            return Admission.accepted(List.of());
        }
        List<RequestObserver.Sample> samples = new ArrayList<>(observers.size());
        try {
            for (RequestObserver observer : observers) {
                samples.add(observer.begin());
            }
        } catch (RuntimeException e) {
            for (RequestObserver.Sample sample : samples) {
                sample.close();
            }
            throw e;
        }
        return Admission.accepted(samples);
    }

    // ============ Accessors ============

    public Set<String> aggregatorNames() {
        return aggregators.keySet();
    }

    public Aggregator aggregator(String name) {
        return aggregators.get(name);
    }

    public boolean isPassthrough() {
        return aggregators.isEmpty();
    }
}
