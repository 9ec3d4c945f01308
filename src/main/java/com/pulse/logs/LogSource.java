package com.pulse.logs;

/**
 * Diskte okunabilir bir log dosyası. {@code id} dosyanın tam yoludur.
 */
public record LogSource(String id, String name, String path, long size, String modified) {}
