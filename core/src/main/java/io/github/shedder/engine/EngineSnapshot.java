package io.github.shedder.engine;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time view of the engine: the combined probability and each aggregator's share.
 *
 * @param timestamp when the snapshot was taken
 * @param probability combined rejection probability (max over all aggregators)
 * @param contributions clamped probability per aggregator name, in registration order
 */
public record EngineSnapshot(
    Instant timestamp,
    double probability,
    Map<String, Double> contributions
) {

    public EngineSnapshot {
        contributions = Collections.unmodifiableMap(new LinkedHashMap<>(contributions));
    }

    public Status status() {
        if (probability <= 0.0) return Status.NORMAL;
        if (probability >= 1.0) return Status.SATURATED;
        return Status.SHEDDING;
    }

    public enum Status {
        /** Nothing is being rejected. */
        NORMAL,
        /** A share of requests is being rejected. */
        SHEDDING,
        /** Every request is being rejected. */
        SATURATED
    }
}
