package io.github.shedder.aggregator;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * {@link CpuUsageSource} backed by the JVM's operating system MXBean.
 *
 * <p>Prefers the HotSpot {@code getCpuLoad()} reading of recent whole-system CPU usage. On JVMs
 * without it, falls back to the one-minute load average normalized by available processors.</p>
 */
public class SystemCpuUsage implements CpuUsageSource {

    private final OperatingSystemMXBean osMxBean;

    public SystemCpuUsage() {
        this(ManagementFactory.getOperatingSystemMXBean());
    }

    SystemCpuUsage(OperatingSystemMXBean osMxBean) {
        this.osMxBean = osMxBean;
    }

    @Override
    public double currentUsage() {
        if (osMxBean instanceof com.sun.management.OperatingSystemMXBean hotspot) {
            double load = hotspot.getCpuLoad();
            if (load >= 0) {
                return Math.min(1.0, load);
            }
        }
        double systemLoad = osMxBean.getSystemLoadAverage();
        if (systemLoad < 0) {
            return -1;
        }
        int processors = Math.max(1, osMxBean.getAvailableProcessors());
        return Math.min(1.0, systemLoad / processors);
    }
}
