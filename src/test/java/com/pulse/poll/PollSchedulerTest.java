package com.pulse.poll;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.Eventually;
import com.pulse.hub.ConnectionRegistry;
import com.pulse.hub.HubMessageCodec;
import com.pulse.hub.RecordingConnection;
import com.pulse.hub.Topic;
import com.pulse.metric.MetricsRegistry;
import com.pulse.stream.QueueStreamSource;
import com.pulse.stream.RingBuffer;
import com.pulse.stream.StreamController;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PollSchedulerTest {

    private Vertx vertx;
    private WorkerExecutor worker;
    private ExecutorService readers;
    private StreamController<String> stream;
    private MetricsRegistry metrics;
    private ConnectionRegistry registry;
    private PollScheduler scheduler;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        worker = vertx.createSharedWorkerExecutor("poll-test", 2);
        readers = Executors.newCachedThreadPool();
        stream = new StreamController<>("logs", new QueueStreamSource<>(), new RingBuffer<>(10), readers);
        metrics = new MetricsRegistry();
        HubMessageCodec codec = new HubMessageCodec(new ObjectMapper());
        registry = new ConnectionRegistry(codec, stream, metrics);
        scheduler = new PollScheduler(registry, codec, new PayloadCache(), vertx, worker, metrics);
    }

    @AfterEach
    void tearDown() throws Exception {
        scheduler.close();
        registry.close();
        stream.close();
        readers.shutdownNow();
        worker.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private static TickOutcome await(Future<TickOutcome> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private RecordingConnection subscriber(String id, Topic topic) {
        RecordingConnection connection = new RecordingConnection(id);
        registry.register(connection);
        registry.subscribe(connection, List.of(topic));
        return connection;
    }

    @Nested
    class Ticks {

        // Abonesi olmayan konu için sağlayıcı hiç çağrılmaz.
        @Test
        void idleTopicNeverInvokesProvider() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            scheduler.register(Topic.SERVICES, () -> {
                calls.incrementAndGet();
                return List.of("x");
            }, 10_000);

            for (int i = 0; i < 5; i++) {
                assertEquals(TickOutcome.IDLE, await(scheduler.tick(Topic.SERVICES)));
            }
            assertEquals(0, calls.get());
            assertTrue(scheduler.cache().get(Topic.SERVICES).isEmpty());
        }

        @Test
        void firstTickAfterSubscribeBroadcastsSnapshot() throws Exception {
            scheduler.register(Topic.SYSTEM, () -> Map.of("cpu", 42), 10_000);
            RecordingConnection client = subscriber("c1", Topic.SYSTEM);

            assertEquals(TickOutcome.BROADCAST, await(scheduler.tick(Topic.SYSTEM)));

            List<String> snapshots = client.sentContaining("\"topic\":\"system\"");
            assertEquals(1, snapshots.size());
            assertTrue(snapshots.get(0).contains("\"type\":\"snapshot\""));
            assertTrue(snapshots.get(0).contains("\"cpu\":42"));
            assertEquals("{\"cpu\":42}", scheduler.cache().get(Topic.SYSTEM).orElseThrow().json());
        }

        @Test
        void identicalPayloadIsSuppressed() throws Exception {
            scheduler.register(Topic.SERVICES, () -> List.of("a", "b"), 10_000);
            RecordingConnection client = subscriber("c1", Topic.SERVICES);

            assertEquals(TickOutcome.BROADCAST, await(scheduler.tick(Topic.SERVICES)));
            assertEquals(TickOutcome.UNCHANGED, await(scheduler.tick(Topic.SERVICES)));
            assertEquals(TickOutcome.UNCHANGED, await(scheduler.tick(Topic.SERVICES)));

            assertEquals(1, client.sentContaining("\"topic\":\"services\"").size());
            assertEquals(2, metrics.counter("poll.services.suppressed").get());
        }

        // Hata önceki değeri korur; bir sonraki tik yeniden dener.
        @Test
        void providerFailureKeepsPreviousSnapshotAndRetries() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            scheduler.register(Topic.PROCESSES, () -> {
                int call = calls.incrementAndGet();
                if (call == 2) {
                    throw new ProviderException("ps unavailable");
                }
                if (call == 3) {
                    throw new IllegalStateException("boom");
                }
                return List.of(call);
            }, 10_000);
            RecordingConnection client = subscriber("c1", Topic.PROCESSES);

            assertEquals(TickOutcome.BROADCAST, await(scheduler.tick(Topic.PROCESSES)));
            assertEquals(TickOutcome.FAILED, await(scheduler.tick(Topic.PROCESSES)));
            assertEquals(TickOutcome.FAILED, await(scheduler.tick(Topic.PROCESSES)));
            assertEquals("[1]", scheduler.cache().get(Topic.PROCESSES).orElseThrow().json());

            assertEquals(TickOutcome.BROADCAST, await(scheduler.tick(Topic.PROCESSES)));
            assertEquals(2, client.sentContaining("\"topic\":\"processes\"").size());
            assertEquals(2, metrics.counter("poll.processes.failures").get());
        }

        @Test
        void overlappingTickIsSkipped() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            scheduler.register(Topic.SYSTEM, () -> {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return Map.of("slow", true);
            }, 10_000);
            subscriber("c1", Topic.SYSTEM);

            Future<TickOutcome> first = scheduler.tick(Topic.SYSTEM);
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertEquals(TickOutcome.BUSY, await(scheduler.tick(Topic.SYSTEM)));

            release.countDown();
            assertEquals(TickOutcome.BROADCAST, await(first));
        }

        @Test
        void wildcardSubscriberKeepsTopicPolled() throws Exception {
            scheduler.register(Topic.SYSTEM, () -> Map.of("up", 1), 10_000);
            RecordingConnection all = subscriber("all", Topic.ALL);

            assertEquals(TickOutcome.BROADCAST, await(scheduler.tick(Topic.SYSTEM)));
            assertEquals(1, all.sentContaining("\"topic\":\"system\"").size());
        }

        @Test
        void unknownTopicFails() {
            Future<TickOutcome> outcome = scheduler.tick(Topic.SERVICES);
            assertTrue(outcome.failed());
            assertInstanceOf(IllegalArgumentException.class, outcome.cause());
        }
    }

    @Nested
    class Registration {

        @Test
        void rejectsInvalidRegistrations() {
            DataProvider<String> provider = () -> "x";

            assertThrows(IllegalArgumentException.class, () -> scheduler.register(Topic.LOGS, provider, 1000));
            assertThrows(IllegalArgumentException.class, () -> scheduler.register(Topic.ALL, provider, 1000));
            assertThrows(IllegalArgumentException.class, () -> scheduler.register(Topic.SYSTEM, provider, 0));

            scheduler.register(Topic.SYSTEM, provider, 1000);
            assertThrows(IllegalStateException.class, () -> scheduler.register(Topic.SYSTEM, provider, 1000));
        }

        @Test
        void registrationClosesOnceStarted() {
            scheduler.start();
            assertTrue(scheduler.isRunning());
            assertThrows(IllegalStateException.class, () -> scheduler.register(Topic.SERVICES, () -> "x", 1000));

            scheduler.close();
            assertFalse(scheduler.isRunning());
        }

        // Zamanlayıcı tikleri abone geldiğinde kendiliğinden yayına başlar.
        @Test
        void periodicTimerDrivesBroadcasts() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            scheduler.register(Topic.SYSTEM, () -> Map.of("n", calls.incrementAndGet()), 50);
            scheduler.start();
            RecordingConnection client = subscriber("c1", Topic.SYSTEM);

            Eventually.await("periodic snapshots",
                    () -> client.sentContaining("\"topic\":\"system\"").size() >= 2);
            assertTrue(calls.get() >= 2);
        }
    }
}
