package com.pulse.provider;

/**
 * {@code processes} konusundaki tek süreç satırı.
 */
public record ProcessInfo(long pid, Long ppid, String user, String name, String command,
                          String args, String startTime, long cpuMillis) {}
