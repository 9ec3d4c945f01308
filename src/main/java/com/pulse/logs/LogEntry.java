package com.pulse.logs;

/**
 * Log akışından çözümlenmiş tek satır.
 */
public record LogEntry(String timestamp,
                       LogLevel level,
                       String process,
                       Integer pid,
                       String message,
                       String subsystem,
                       String category) {}
