package com.cape.core.model;

/**
 * Resource ceilings requested for a capability's sandbox.
 *
 * @param memoryMb       memory ceiling in MiB
 * @param cpuPercent     CPU quota as a percentage of one core
 * @param networkEnabled whether the sandbox may reach the network
 */
public record ResourceLimits(int memoryMb, int cpuPercent, boolean networkEnabled) {

    public static final int DEFAULT_MEMORY_MB = 512;
    public static final int DEFAULT_CPU_PERCENT = 50;

    public ResourceLimits {
        if (memoryMb <= 0) {
            throw new IllegalArgumentException("memoryMb must be positive: " + memoryMb);
        }
        if (cpuPercent <= 0) {
            throw new IllegalArgumentException("cpuPercent must be positive: " + cpuPercent);
        }
    }

    public static ResourceLimits defaults() {
        return new ResourceLimits(DEFAULT_MEMORY_MB, DEFAULT_CPU_PERCENT, false);
    }

    public boolean isDefault() {
        return memoryMb == DEFAULT_MEMORY_MB && cpuPercent == DEFAULT_CPU_PERCENT;
    }
}
