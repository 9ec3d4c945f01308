package com.pulse.provider;

/**
 * {@code services} konusundaki tek servis satırı.
 */
public record ServiceInfo(String label, Integer pid, Integer lastExitStatus, String status) {}
