package com.quackhouse.runtime;

import com.sun.management.OperatingSystemMXBean;

import java.lang.management.ManagementFactory;

/**
 * Detects the host resources used to size the query engine.
 *
 * <p>Explicit values in {@link EngineConfig} take precedence over these
 * recommendations.
 *
 * @see DuckDBRuntime
 */
public final class HardwareProfile {

    private static final long GB = 1024L * 1024 * 1024;
    private static final long MB = 1024L * 1024;

    private final int cpuCores;
    private final long totalMemoryBytes;

    HardwareProfile(int cpuCores, long totalMemoryBytes) {
        if (cpuCores <= 0) {
            throw new IllegalArgumentException("cpuCores must be positive: " + cpuCores);
        }
        this.cpuCores = cpuCores;
        this.totalMemoryBytes = totalMemoryBytes;
    }

    /**
     * Detects the hardware profile of the current host.
     *
     * @return the detected profile
     */
    public static HardwareProfile detect() {
        int cores = Runtime.getRuntime().availableProcessors();

        long memory;
        try {
            OperatingSystemMXBean osBean = ManagementFactory.getPlatformMXBean(OperatingSystemMXBean.class);
            memory = osBean.getTotalMemorySize();
        } catch (RuntimeException e) {
            // Not every JVM exposes the com.sun bean; estimate from the heap ceiling
            memory = Runtime.getRuntime().maxMemory() * 4;
        }

        return new HardwareProfile(cores, memory);
    }

    /**
     * Thread count for DuckDB: all cores, capped at 16.
     */
    public int recommendedThreadCount() {
        return Math.min(cpuCores, 16);
    }

    /**
     * Memory limit for DuckDB: 4GB per thread, capped at 80% of physical memory.
     *
     * @return the limit as a DuckDB size string (e.g. "8GB", "512MB")
     */
    public String recommendedMemoryLimit() {
        long limitBytes = Math.min((totalMemoryBytes * 4) / 5, recommendedThreadCount() * 4L * GB);
        return formatBytes(limitBytes);
    }

    /**
     * Default number of pooled engine connections: min(cores, 8).
     */
    public int recommendedPoolSize() {
        return Math.min(cpuCores, 8);
    }

    public int cpuCores() {
        return cpuCores;
    }

    static String formatBytes(long bytes) {
        if (bytes >= GB) {
            return (bytes / GB) + "GB";
        } else if (bytes >= MB) {
            return (bytes / MB) + "MB";
        } else if (bytes >= 1024) {
            return (bytes / 1024) + "KB";
        }
        return bytes + "B";
    }

    @Override
    public String toString() {
        return String.format("HardwareProfile(cores=%d, memory=%s)", cpuCores, formatBytes(totalMemoryBytes));
    }
}
