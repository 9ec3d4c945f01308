package com.pulse.logs;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogEntryParserTest {

    private final LogEntryParser parser = new LogEntryParser(new ObjectMapper());

    @Nested
    class Compact {

        @Test
        void parsesCompactLineWithLevel() {
            LogEntry entry = parser.parse(
                    "2024-05-01 10:11:12.123456+0300 Df WindowServer[412] <Error> display link failed");

            assertEquals("2024-05-01 10:11:12.123456+0300", entry.timestamp());
            assertEquals("WindowServer", entry.process());
            assertEquals(412, entry.pid());
            assertEquals(LogLevel.ERROR, entry.level());
            assertEquals("display link failed", entry.message());
        }

        @Test
        void missingLevelFallsBackToDefault() {
            LogEntry entry = parser.parse("2024-05-01 10:11:12.5-0700 I mds[88] indexing finished");

            assertEquals(LogLevel.DEFAULT, entry.level());
            assertEquals("mds", entry.process());
            assertEquals("indexing finished", entry.message());
        }
    }

    // int aralığını aşan pid satırı düşürmez, yalnızca pid boş kalır.
    @Test
    void oversizedPidIsLeftEmpty() {
        LogEntry entry = parser.parse("2024-05-01 10:11:12.123456+0000 Df proc[99999999999] boom");

        assertEquals("proc", entry.process());
        assertNull(entry.pid());
        assertEquals("boom", entry.message());
    }

    @Nested
    class Json {

        @Test
        void parsesNdjsonRecord() {
            LogEntry entry = parser.parse("{\"timestamp\":\"2024-05-01 10:00:00.000000+0000\","
                    + "\"messageType\":\"Fault\",\"processImagePath\":\"/usr/libexec/trustd\","
                    + "\"processID\":77,\"eventMessage\":\"cert check\",\"subsystem\":\"com.apple.trust\","
                    + "\"category\":\"eval\"}");

            assertEquals(LogLevel.ERROR, entry.level());
            assertEquals("trustd", entry.process());
            assertEquals(77, entry.pid());
            assertEquals("cert check", entry.message());
            assertEquals("com.apple.trust", entry.subsystem());
            assertEquals("eval", entry.category());
        }

        @Test
        void jsonWithoutImagePathUsesProcessField() {
            LogEntry entry = parser.parse("{\"level\":\"notice\",\"process\":\"kernel\",\"message\":\"hello\"}");

            assertEquals(LogLevel.INFO, entry.level());
            assertEquals("kernel", entry.process());
            assertNull(entry.pid());
            assertNotNull(entry.timestamp());
        }
    }

    // Tanınmayan satırlar kaybolmaz, system sürecine ait kayıt olur.
    @Test
    void unrecognisedLineBecomesSystemEntry() {
        LogEntry entry = parser.parse("  Filtering the log data using \"x\"  ");

        assertEquals("system", entry.process());
        assertEquals(LogLevel.DEFAULT, entry.level());
        assertEquals("Filtering the log data using \"x\"", entry.message());

        LogEntry brokenJson = parser.parse("{not json");
        assertEquals("{not json", brokenJson.message());
    }

    @Test
    void blankLinesAreSkipped() {
        assertNull(parser.parse(""));
        assertNull(parser.parse("   "));
        assertNull(parser.parse(null));
    }

    @Test
    void levelNamesAreNormalised() {
        assertEquals(LogLevel.WARNING, LogLevel.normalize("Warning"));
        assertEquals(LogLevel.DEBUG, LogLevel.normalize("Debug"));
        assertEquals(LogLevel.INFO, LogLevel.normalize("Info"));
        assertEquals(LogLevel.DEFAULT, LogLevel.normalize("Activity"));
        assertEquals(LogLevel.DEFAULT, LogLevel.normalize(null));
    }
}
