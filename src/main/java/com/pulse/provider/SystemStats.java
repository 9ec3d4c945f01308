package com.pulse.provider;

/**
 * {@code system} konusunun veri yükü.
 */
public record SystemStats(Cpu cpu, Memory memory, Disk disk, long uptimeMillis,
                          String hostname, String osVersion, long processCount) {

    public record Cpu(double usedPercent, String arch, int cores, double loadAverage) {}

    public record Memory(long total, long used, long free, double usedPercent) {}

    public record Disk(long total, long used, long free, double usedPercent, String mountPoint) {}
}
