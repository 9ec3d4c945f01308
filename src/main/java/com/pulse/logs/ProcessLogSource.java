package com.pulse.logs;

import com.pulse.stream.RecordStream;
import com.pulse.stream.StreamSource;
import org.jboss.logging.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Yapılandırılan log takip komutunu (varsayılan {@code log stream}) ayrı bir
 * süreç olarak başlatır ve standart çıktısını satır satır {@link LogEntry}
 * kayıtlarına çevirir. Akış kapatıldığında süreç sonlandırılır.
 */
public final class ProcessLogSource implements StreamSource<LogEntry>
{
    private static final Logger LOG = Logger.getLogger(ProcessLogSource.class);

    private final List<String> command;
    private final LogEntryParser parser;

    public ProcessLogSource(List<String> command, LogEntryParser parser) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Log stream command must not be empty");
        }
        this.command = List.copyOf(command);
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    @Override
    public RecordStream<LogEntry> open() throws IOException {
        Process process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        LOG.debugf("Spawned %s (pid %d)", String.join(" ", command), process.pid());
        return new ProcessRecordStream(process, parser);
    }

    private static final class ProcessRecordStream implements RecordStream<LogEntry>
    {
        private final Process process;
        private final BufferedReader reader;
        private final LogEntryParser parser;

        private ProcessRecordStream(Process process, LogEntryParser parser) {
            this.process = process;
            this.parser = parser;
            this.reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        }

        @Override
        public LogEntry next() throws IOException {
            String line;
            while ((line = reader.readLine()) != null) {
                LogEntry entry = parser.parse(line);
                if (entry != null) {
                    return entry;
                }
            }
            return null;
        }

        /**
         * Alt süreçler ana süreçten önce sonlandırılır; yoksa stdout'u açık
         * tutarlar. Okuma thread'i {@code readLine()} içinde {@link BufferedReader}
         * kilidini tuttuğu için yalnızca ham akış kapatılır.
         */
        @Override
        public void close() throws IOException {
            List<ProcessHandle> children = process.descendants().collect(Collectors.toList());
            children.forEach(ProcessHandle::destroy);
            process.destroy();
            try {
                process.getInputStream().close();
            } finally {
                LOG.debugf("Log stream process %d terminated (%d child processes)", process.pid(), children.size());
            }
        }
    }
}
