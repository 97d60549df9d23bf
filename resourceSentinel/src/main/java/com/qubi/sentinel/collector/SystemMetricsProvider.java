package com.qubi.sentinel.collector;

import com.qubi.sentinel.core.model.ResourceReading;
import com.qubi.sentinel.core.spi.MetricsProvider;
import com.sun.management.OperatingSystemMXBean;

import java.io.File;
import java.lang.management.ManagementFactory;

/**
 * Utilización del host vía {@code com.sun.management.OperatingSystemMXBean}: CPU de todo el
 * sistema, memoria física usada y espacio usado del filesystem de {@code diskPath}.
 */
public class SystemMetricsProvider implements MetricsProvider {
    private final OperatingSystemMXBean osBean;
    private final File diskPath;

    public SystemMetricsProvider(String diskPath) {
        this.osBean = (OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean();
        this.diskPath = new File(diskPath);
    }

    @Override
    public ResourceReading sample() {
        return new ResourceReading(cpuPercent(), memPercent(), diskPercent());
    }

    double cpuPercent() {
        double load = osBean.getCpuLoad();
        // negativo = la plataforma todavía no tiene lectura
        if (load < 0) throw new IllegalStateException("system CPU load not available on this platform");
        return load * 100.0;
    }

    double memPercent() {
        long total = osBean.getTotalMemorySize();
        if (total <= 0) throw new IllegalStateException("total physical memory not available");
        long free = osBean.getFreeMemorySize();
        return (double) (total - free) / total * 100.0;
    }

    double diskPercent() {
        long total = diskPath.getTotalSpace();
        if (total <= 0) throw new IllegalStateException("cannot read disk usage of " + diskPath);
        long free = diskPath.getFreeSpace();
        return (double) (total - free) / total * 100.0;
    }
}
