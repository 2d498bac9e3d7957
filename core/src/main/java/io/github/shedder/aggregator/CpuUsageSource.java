package io.github.shedder.aggregator;

/**
 * Source of host CPU utilization readings, polled by {@link CpuSampler}.
 */
@FunctionalInterface
public interface CpuUsageSource {

    /**
     * Current CPU utilization.
     *
     * @return a fraction in [0, 1], or a negative value when no reading is available
     */
    double currentUsage();
}
