package com.pulse.logs;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LogLevel
{
    ERROR("error"),
    WARNING("warning"),
    INFO("info"),
    DEBUG("debug"),
    DEFAULT("default");

    private final String wireName;

    LogLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Kaynağın kullandığı seviye adını beş sabit seviyeden birine indirger;
     * "fault" hata, "notice" bilgi sayılır.
     */
    public static LogLevel normalize(String raw) {
        if (raw == null) {
            return DEFAULT;
        }
        String l = raw.toLowerCase(Locale.ROOT);
        if (l.contains("error") || l.contains("fault")) return ERROR;
        if (l.contains("warn")) return WARNING;
        if (l.contains("info") || l.contains("notice")) return INFO;
        if (l.contains("debug")) return DEBUG;
        return DEFAULT;
    }
}
