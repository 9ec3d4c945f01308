package com.pulse.logs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Log takipçisinin ürettiği satırları {@link LogEntry} nesnelerine çevirir.
 * Önce NDJSON biçimi denenir, sonra {@code tarih saat tür süreç[pid] <seviye> mesaj}
 * biçimindeki sıkışık satır; ikisi de tutmazsa satırın kendisi
 * {@code system} sürecinden gelen varsayılan seviyeli kayıt olur. Boş satırlar
 * için {@code null} döner.
 */
public final class LogEntryParser
{
    private static final Pattern COMPACT = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2}\\s+\\d{2}:\\d{2}:\\d{2}\\.\\d+[+-]\\d{4})\\s+\\S+\\s+(\\S+)\\[(\\d+)\\](?:\\s+<(\\w+)>)?\\s+(.+)$");

    private final ObjectMapper mapper;

    public LogEntryParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public LogEntry parse(String line) {
        if (line == null) {
            return null;
        }
        if (line.startsWith("{")) {
            LogEntry json = parseJson(line);
            if (json != null) {
                return json;
            }
        }
        Matcher m = COMPACT.matcher(line);
        if (m.matches()) {
            return new LogEntry(m.group(1),
                    LogLevel.normalize(m.group(4)),
                    m.group(2),
                    pid(m.group(3)),
                    m.group(5),
                    null,
                    null);
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return new LogEntry(Instant.now().toString(), LogLevel.DEFAULT, "system", null, trimmed, null, null);
    }

    private LogEntry parseJson(String line) {
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            return null;
        }
        if (node == null || !node.isObject()) {
            return null;
        }
        String timestamp = text(node, "timestamp");
        String level = firstText(node, "messageType", "level");
        String process = processName(node);
        JsonNode pid = node.get("processID");
        String message = firstText(node, "eventMessage", "message");
        return new LogEntry(
                timestamp != null ? timestamp : Instant.now().toString(),
                LogLevel.normalize(level),
                process,
                pid != null && pid.canConvertToInt() ? pid.intValue() : null,
                message != null ? message : "",
                text(node, "subsystem"),
                text(node, "category"));
    }

    /**
     * {@code int} aralığına sığmayan pid {@code null} olur; tek bir satır akışı
     * sonlandırmamalıdır.
     */
    private static Integer pid(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String processName(JsonNode node) {
        String imagePath = text(node, "processImagePath");
        if (imagePath != null) {
            int slash = imagePath.lastIndexOf('/');
            String name = slash >= 0 ? imagePath.substring(slash + 1) : imagePath;
            if (!name.isEmpty()) {
                return name;
            }
        }
        String process = text(node, "process");
        return process != null ? process : "unknown";
    }

    private static String firstText(JsonNode node, String first, String second) {
        String value = text(node, first);
        return value != null ? value : text(node, second);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String s = value.asText();
        return s.isEmpty() ? null : s;
    }
}
