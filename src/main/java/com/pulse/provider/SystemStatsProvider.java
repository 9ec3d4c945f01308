package com.pulse.provider;

import com.pulse.poll.DataProvider;
import com.pulse.poll.ProviderException;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JMX işletim sistemi bean'i, kök dosya sistemi ve {@link ProcessHandle}
 * üzerinden taşınabilir sistem istatistikleri üretir. Host adı ve işletim
 * sistemi sürümü gibi değişmeyen değerler bir kez okunur.
 */
@Singleton
public class SystemStatsProvider implements DataProvider<SystemStats>
{
    private final com.sun.management.OperatingSystemMXBean os;
    private final Path mountPoint;
    private final String hostname;
    private final String osVersion;

    public SystemStatsProvider() {
        this(Path.of("/"));
    }

    public SystemStatsProvider(Path mountPoint) {
        this.os = (com.sun.management.OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean();
        this.mountPoint = mountPoint;
        this.hostname = resolveHostname();
        this.osVersion = System.getProperty("os.name", "unknown") + " " + System.getProperty("os.version", "");
    }

    @Override
    public SystemStats fetch() throws ProviderException {
        double load = os.getCpuLoad();
        var cpu = new SystemStats.Cpu(
                load < 0 ? 0.0 : round(load * 100.0),
                os.getArch(),
                os.getAvailableProcessors(),
                round(os.getSystemLoadAverage()));

        long totalMem = os.getTotalMemorySize();
        long freeMem = os.getFreeMemorySize();
        var memory = new SystemStats.Memory(totalMem, totalMem - freeMem, freeMem, percent(totalMem - freeMem, totalMem));

        SystemStats.Disk disk;
        try {
            FileStore store = Files.getFileStore(mountPoint);
            long total = store.getTotalSpace();
            long free = store.getUsableSpace();
            disk = new SystemStats.Disk(total, total - free, free, percent(total - free, total), mountPoint.toString());
        } catch (IOException e) {
            throw new ProviderException("Cannot read file store of " + mountPoint, e);
        }

        return new SystemStats(cpu, memory, disk,
                ManagementFactory.getRuntimeMXBean().getUptime(),
                hostname, osVersion.trim(), ProcessHandle.allProcesses().count());
    }

    private static String resolveHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }

    private static double percent(long part, long total) {
        return total <= 0 ? 0.0 : round(part * 100.0 / total);
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
