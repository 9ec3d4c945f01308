package com.pulse.logs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.config.HubProperties;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Canlı akıştan bağımsız, tek seferlik log sorgularını yürütür. Geçmiş
 * kayıtlar yapılandırılan sorgu komutuyla ({@code log show}) okunur; sonuç
 * en yeni {@code limit} kayıtla sınırlanır. Ayrıca belirlenen dizinlerdeki
 * {@code .log} ve {@code .txt} dosyalarını listeler.
 */
@Singleton
public class LogQueryService
{
    private static final Logger LOG = Logger.getLogger(LogQueryService.class);

    private final List<String> command;
    private final int limit;
    private final List<Path> sourceDirectories;
    private final LogEntryParser parser;

    @Inject
    public LogQueryService(HubProperties properties, ObjectMapper mapper) {
        this(properties.logs().queryCommand(),
                properties.logs().queryLimit(),
                properties.logs().sourceDirectories().stream()
                        .map(LogQueryService::expandHome)
                        .collect(Collectors.toList()),
                new LogEntryParser(mapper));
    }

    public LogQueryService(List<String> command, int limit, List<Path> sourceDirectories, LogEntryParser parser) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Log query command must not be empty");
        }
        this.command = List.copyOf(command);
        this.limit = Math.max(1, limit);
        this.sourceDirectories = List.copyOf(sourceDirectories);
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * Son {@code lastMinutes} dakikanın kayıtlarını döndürür; {@code predicate}
     * verilirse sorgu komutuna filtre olarak iletilir.
     */
    public List<LogEntry> query(int lastMinutes, String predicate) throws LogQueryException {
        if (lastMinutes <= 0) {
            throw new IllegalArgumentException("minutes must be positive");
        }
        List<String> args = new ArrayList<>(command);
        args.add("--last");
        args.add(lastMinutes + "m");
        if (predicate != null && !predicate.isBlank()) {
            args.add("--predicate");
            args.add(predicate);
        }
        return parse(run(args));
    }

    public List<LogEntry> queryByProcess(String processName, int lastMinutes) throws LogQueryException {
        if (processName == null || processName.isBlank()) {
            throw new IllegalArgumentException("process name must be provided");
        }
        return query(lastMinutes, "process == \"" + escape(processName) + "\"");
    }

    /**
     * Kaynak dizinlerdeki log dosyalarını son değiştirilme zamanına göre
     * yeniden eskiye sıralar. Okunamayan dizin ve dosyalar atlanır.
     */
    public List<LogSource> sources() {
        List<LogSource> sources = new ArrayList<>();
        for (Path dir : sourceDirectories) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            try (DirectoryStream<Path> files = Files.newDirectoryStream(dir)) {
                for (Path file : files) {
                    String name = file.getFileName().toString();
                    if (!name.endsWith(".log") && !name.endsWith(".txt")) {
                        continue;
                    }
                    try {
                        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                        if (attrs.isRegularFile()) {
                            sources.add(new LogSource(file.toString(), name, file.toString(),
                                    attrs.size(), attrs.lastModifiedTime().toInstant().toString()));
                        }
                    } catch (IOException e) {
                        LOG.debugf("Skipping unreadable log file %s: %s", file, e.getMessage());
                    }
                }
            } catch (IOException e) {
                LOG.debugf("Skipping log directory %s: %s", dir, e.getMessage());
            }
        }
        sources.sort(Comparator.comparing(LogSource::modified).reversed());
        return sources;
    }

    private String run(List<String> args) throws LogQueryException {
        try {
            Process process = new ProcessBuilder(args)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            String output;
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exit = process.waitFor();
            if (exit != 0) {
                throw new LogQueryException(String.join(" ", command) + " exited with " + exit);
            }
            return output;
        } catch (IOException e) {
            throw new LogQueryException("Cannot run " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LogQueryException("Interrupted while querying logs", e);
        }
    }

    private List<LogEntry> parse(String output) {
        List<LogEntry> entries = new ArrayList<>();
        for (String line : output.split("\n")) {
            LogEntry entry = parser.parse(line);
            if (entry != null) {
                entries.add(entry);
            }
        }
        if (entries.size() > limit) {
            return new ArrayList<>(entries.subList(entries.size() - limit, entries.size()));
        }
        return entries;
    }

    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    static Path expandHome(String dir) {
        if (dir.equals("~") || dir.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + dir.substring(1));
        }
        return Path.of(dir);
    }
}
