package com.pulse.poll;

import com.pulse.config.HubProperties;
import com.pulse.hub.ConnectionRegistry;
import com.pulse.hub.HubMessageCodec;
import com.pulse.hub.MessageKind;
import com.pulse.hub.Topic;
import com.pulse.metric.MetricsRegistry;
import com.pulse.provider.ProcessListProvider;
import com.pulse.provider.ServiceListProvider;
import com.pulse.provider.SystemStatsProvider;
import io.quarkus.runtime.Startup;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Yoklama ile beslenen her konu için bağımsız bir Vert.x zamanlayıcısı çalıştırır.
 * Her tikte konunun abonesi yoksa sağlayıcı hiç çağrılmaz; varsa sağlayıcı
 * worker havuzunda çalıştırılır, sonuç serileştirilip {@link PayloadCache} ile
 * karşılaştırılır ve yalnızca içerik değiştiyse {@code snapshot} olarak yayınlanır.
 * Sağlayıcı hatası loglanır, önceki değer korunur ve bir sonraki tikte yeniden
 * denenir.
 */
@Startup
@Singleton
public class PollScheduler implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(PollScheduler.class);

    private final ConnectionRegistry registry;
    private final HubMessageCodec codec;
    private final PayloadCache cache;
    private final Vertx vertx;
    private final WorkerExecutor workerExecutor;
    private final MetricsRegistry metrics;
    private final Map<Topic, Registration> registrations = new EnumMap<>(Topic.class);
    private final AtomicBoolean started = new AtomicBoolean(false);

    @Inject
    public PollScheduler(ConnectionRegistry registry,
                         HubMessageCodec codec,
                         Vertx vertx,
                         WorkerExecutor workerExecutor,
                         MetricsRegistry metrics,
                         HubProperties properties,
                         SystemStatsProvider systemStats,
                         ServiceListProvider services,
                         ProcessListProvider processes) {
        this(registry, codec, new PayloadCache(), vertx, workerExecutor, metrics);
        var poll = properties.poll();
        register(Topic.SYSTEM, systemStats, poll.systemIntervalMillis());
        register(Topic.SERVICES, services, poll.servicesIntervalMillis());
        register(Topic.PROCESSES, processes, poll.processesIntervalMillis());
    }

    public PollScheduler(ConnectionRegistry registry,
                         HubMessageCodec codec,
                         PayloadCache cache,
                         Vertx vertx,
                         WorkerExecutor workerExecutor,
                         MetricsRegistry metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Konu için sağlayıcıyı kaydeder. Her konu yalnızca bir kez kaydedilebilir
     * ve kayıt zamanlayıcı başlamadan yapılmalıdır.
     */
    public synchronized void register(Topic topic, DataProvider<?> provider, long intervalMillis) {
        if (!topic.pollDriven()) {
            throw new IllegalArgumentException("Topic " + topic + " is not poll driven");
        }
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("Poll interval for " + topic + " must be positive");
        }
        if (started.get()) {
            throw new IllegalStateException("Cannot register providers after the scheduler started");
        }
        if (registrations.putIfAbsent(topic, new Registration(topic, provider, intervalMillis)) != null) {
            throw new IllegalStateException("Provider already registered for " + topic);
        }
    }

    @PostConstruct
    void init() {
        start();
    }

    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        for (Registration registration : registrations.values()) {
            registration.timerId = vertx.setPeriodic(registration.intervalMillis, id -> tick(registration.topic));
            LOG.infof("Polling %s every %d ms while subscribed", registration.topic, registration.intervalMillis);
        }
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * Tek bir tik çalıştırır. Zamanlayıcı tarafından çağrılır; testler de
     * doğrudan kullanabilir.
     */
    public Future<TickOutcome> tick(Topic topic) {
        Registration registration;
        synchronized (this) {
            registration = registrations.get(topic);
        }
        if (registration == null) {
            return Future.failedFuture(new IllegalArgumentException("No provider registered for " + topic));
        }
        if (registry.subscriberCount(topic) == 0) {
            return Future.succeededFuture(TickOutcome.IDLE);
        }
        if (!registration.inFlight.compareAndSet(false, true)) {
            LOG.debugf("Skipping %s tick, previous fetch still running", topic);
            return Future.succeededFuture(TickOutcome.BUSY);
        }
        return workerExecutor.<TickOutcome>executeBlocking(promise -> {
            try {
                promise.complete(refresh(registration));
            } finally {
                registration.inFlight.set(false);
            }
        }, false);
    }

    public PayloadCache cache() {
        return cache;
    }

    private TickOutcome refresh(Registration registration) {
        Topic topic = registration.topic;
        Object payload;
        long startedNs = System.nanoTime();
        try {
            payload = registration.provider.fetch();
        } catch (ProviderException e) {
            metrics.counter("poll", topic, "failures").inc();
            LOG.warnf(e, "Provider for %s failed, keeping previous snapshot", topic);
            return TickOutcome.FAILED;
        } catch (RuntimeException e) {
            metrics.counter("poll", topic, "failures").inc();
            LOG.errorf(e, "Provider for %s threw unexpectedly, keeping previous snapshot", topic);
            return TickOutcome.FAILED;
        } finally {
            metrics.timer("poll", topic, "fetch").record(System.nanoTime() - startedNs);
        }

        String json;
        try {
            json = codec.encodePayload(payload);
        } catch (UncheckedIOException e) {
            metrics.counter("poll", topic, "failures").inc();
            LOG.errorf(e, "Could not serialize %s payload", topic);
            return TickOutcome.FAILED;
        }

        if (!cache.updateIfChanged(topic, json, System.currentTimeMillis())) {
            metrics.counter("poll", topic, "suppressed").inc();
            return TickOutcome.UNCHANGED;
        }
        registry.broadcast(topic, MessageKind.SNAPSHOT, json);
        return TickOutcome.BROADCAST;
    }

    @PreDestroy
    void shutdown() {
        close();
    }

    @Override
    public synchronized void close() {
        if (!started.getAndSet(false)) {
            return;
        }
        for (Registration registration : registrations.values()) {
            if (registration.timerId >= 0L) {
                vertx.cancelTimer(registration.timerId);
                registration.timerId = -1L;
            }
        }
    }

    private static final class Registration {
        private final Topic topic;
        private final DataProvider<?> provider;
        private final long intervalMillis;
        private final AtomicBoolean inFlight = new AtomicBoolean(false);
        private long timerId = -1L;

        private Registration(Topic topic, DataProvider<?> provider, long intervalMillis) {
            this.topic = topic;
            this.provider = Objects.requireNonNull(provider, "provider");
            this.intervalMillis = intervalMillis;
        }
    }
}
