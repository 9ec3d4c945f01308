package com.pulse.logs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.config.HubProperties;
import com.pulse.stream.IdleGate;
import com.pulse.stream.RingBuffer;
import com.pulse.stream.StreamController;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@code logs} konusunun akış tarafını bir araya getirir: log takip sürecini
 * yöneten {@link StreamController}, son kayıtları tutan {@link RingBuffer} ve
 * REST gibi abone olmayan istemciler için {@link IdleGate}. Push aboneleri
 * denetleyiciyi {@link com.pulse.hub.ConnectionRegistry} üzerinden, çekme
 * istemcileri {@link #touch()} üzerinden talep eder; ikisi aynı sayacı paylaşır.
 */
@Singleton
public class LogStreamService implements AutoCloseable
{
    static final String READER_POOL = "log-stream-reader";

    private final StreamController<LogEntry> controller;
    private final IdleGate idleGate;
    private final int defaultCount;
    private final WorkerExecutor readerExecutor;

    @Inject
    public LogStreamService(HubProperties properties, Vertx vertx, ObjectMapper mapper) {
        var logs = properties.logs();
        this.readerExecutor = vertx.createSharedWorkerExecutor(READER_POOL, 2, 3650, TimeUnit.DAYS);
        this.controller = new StreamController<>(
                "logs",
                new ProcessLogSource(logs.command(), new LogEntryParser(mapper)),
                new RingBuffer<>(logs.bufferCapacity()),
                task -> readerExecutor.executeBlocking(promise -> {
                    task.run();
                    promise.complete();
                }, false));
        this.idleGate = new IdleGate(controller, vertx, logs.idleTimeoutMillis());
        this.defaultCount = Math.max(1, logs.recentDefaultCount());
    }

    public LogStreamService(StreamController<LogEntry> controller, IdleGate idleGate, int defaultCount) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.idleGate = Objects.requireNonNull(idleGate, "idleGate");
        this.defaultCount = Math.max(1, defaultCount);
        this.readerExecutor = null;
    }

    /**
     * Çekme istemcisinin ilgisini bildirir; akışı gerekirse başlatır ve boşta
     * kalma süresini yeniler.
     */
    public void touch() {
        idleGate.touch();
    }

    public List<LogEntry> recent(Integer count, String processFilter) {
        int n = count == null || count <= 0 ? defaultCount : count;
        List<LogEntry> entries = controller.recent(n);
        if (processFilter == null || processFilter.isBlank()) {
            return entries;
        }
        String q = processFilter.toLowerCase(Locale.ROOT);
        List<LogEntry> filtered = new ArrayList<>();
        for (LogEntry entry : entries) {
            if (entry.process() != null && entry.process().toLowerCase(Locale.ROOT).contains(q)) {
                filtered.add(entry);
            }
        }
        return filtered;
    }

    /**
     * Tampondaki kayıtları süreç adına göre sayar, en çok log üretenden
     * başlayarak sıralar.
     */
    public List<ActiveLogProcess> activeProcesses() {
        Map<String, int[]> counts = new LinkedHashMap<>();
        Map<String, String> lastSeen = new LinkedHashMap<>();
        for (LogEntry entry : controller.buffer().all()) {
            String name = entry.process();
            counts.computeIfAbsent(name, k -> new int[1])[0]++;
            String seen = lastSeen.get(name);
            if (seen == null || (entry.timestamp() != null && entry.timestamp().compareTo(seen) > 0)) {
                lastSeen.put(name, entry.timestamp());
            }
        }
        List<ActiveLogProcess> out = new ArrayList<>(counts.size());
        counts.forEach((name, count) -> out.add(new ActiveLogProcess(name, count[0], lastSeen.get(name))));
        out.sort(Comparator.comparingInt(ActiveLogProcess::count).reversed());
        return out;
    }

    public StreamController<LogEntry> controller() {
        return controller;
    }

    public IdleGate idleGate() {
        return idleGate;
    }

    @PreDestroy
    void shutdown() {
        close();
    }

    @Override
    public void close() {
        idleGate.close();
        controller.forceStop();
        if (readerExecutor != null) {
            readerExecutor.close();
        }
    }
}
