package com.pulse.hub;

import com.pulse.logs.LogStreamService;
import com.pulse.metric.Counter;
import com.pulse.metric.MetricsRegistry;
import com.pulse.stream.StreamController;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Canlı bağlantıları ve her bağlantının konu aboneliklerini tutan kayıt
 * defteri ile yayın motorudur. Bir yayın yalnızca bir kez serileştirilir ve
 * konuya ya da joker {@code *} konusuna abone olan her bağlantıya iletilir.
 * Yazma hatası veren bağlantı kayıttan çıkarılır, diğer teslimler etkilenmez.
 *
 * <p>Her abonelik değişikliğinden sonra {@link Topic#LOGS} için talep yeniden
 * değerlendirilir: abone sayısı 0'dan 1'e çıktığında paylaşılan akışa
 * {@code start}, 1'den 0'a indiğinde {@code stop} gönderilir.</p>
 *
 * <p>Tüm durum değişiklikleri ve gönderimler bu nesnenin kilidi altında
 * yapılır; böylece bir bağlantıya giden mesajların sırası yayın çağrılarının
 * sırasıyla aynıdır.</p>
 */
@Singleton
public class ConnectionRegistry implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(ConnectionRegistry.class);

    private final HubMessageCodec codec;
    private final StreamController<?> stream;
    private final Counter broadcasts;
    private final Counter deliveries;
    private final Counter evictions;
    private final Map<String, Entry> connections = new LinkedHashMap<>();

    private boolean streamDemand;
    private AutoCloseable streamSubscription;

    @Inject
    public ConnectionRegistry(HubMessageCodec codec, LogStreamService logs, MetricsRegistry metrics) {
        this(codec, logs.controller(), metrics);
    }

    public ConnectionRegistry(HubMessageCodec codec, StreamController<?> stream, MetricsRegistry metrics) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.stream = Objects.requireNonNull(stream, "stream");
        this.broadcasts = metrics.counter("hub.broadcasts");
        this.deliveries = metrics.counter("hub.deliveries");
        this.evictions = metrics.counter("hub.evictions");
    }

    @PostConstruct
    void init() {
        forwardStreamUpdates();
    }

    /**
     * Akıştan gelen her kaydı {@link Topic#LOGS} abonelerine {@code update}
     * mesajı olarak iletmeye başlar. Birden fazla çağrı tek dinleyici bırakır.
     */
    public synchronized void forwardStreamUpdates() {
        if (streamSubscription != null) {
            return;
        }
        streamSubscription = stream.addListener(record ->
                broadcast(Topic.LOGS, MessageKind.UPDATE, codec.encodePayload(record)));
    }

    public synchronized void register(HubConnection connection) {
        Objects.requireNonNull(connection, "connection");
        connections.put(connection.id(), new Entry(connection));
        LOG.debugf("Connection %s registered (%d open)", connection.id(), connections.size());
        if (!deliver(connection, codec.connected(System.currentTimeMillis()))) {
            evict(connection.id());
        }
    }

    public synchronized boolean unregister(HubConnection connection) {
        Entry removed = connections.remove(connection.id());
        if (removed == null) {
            return false;
        }
        LOG.debugf("Connection %s unregistered (%d open)", connection.id(), connections.size());
        reevaluateDemand();
        return true;
    }

    /**
     * Bağlantının aboneliklerine konuları ekler, güncel abonelik listesini
     * içeren onay mesajını gönderir ve güncel listeyi döndürür. Liste abone
     * olunma sırasını korur.
     */
    public synchronized List<Topic> subscribe(HubConnection connection, Collection<Topic> topics) {
        Entry entry = connections.get(connection.id());
        if (entry == null) {
            return List.of();
        }
        entry.topics.addAll(topics);
        List<Topic> current = List.copyOf(entry.topics);
        reevaluateDemand();
        if (!deliver(connection, codec.subscribed(current, System.currentTimeMillis()))) {
            evict(connection.id());
        }
        return current;
    }

    public synchronized List<Topic> unsubscribe(HubConnection connection, Collection<Topic> topics) {
        Entry entry = connections.get(connection.id());
        if (entry == null) {
            return List.of();
        }
        entry.topics.removeAll(topics);
        reevaluateDemand();
        return List.copyOf(entry.topics);
    }

    /**
     * Veriyi zarflayıp ilgili bağlantılara gönderir ve teslim edilen bağlantı
     * sayısını döndürür.
     */
    public synchronized int broadcast(Topic topic, MessageKind kind, String payloadJson) {
        if (connections.isEmpty()) {
            return 0;
        }
        String message = null;
        List<String> failed = null;
        int delivered = 0;
        for (Entry entry : connections.values()) {
            if (!entry.wants(topic)) {
                continue;
            }
            if (message == null) {
                message = codec.data(topic, kind, payloadJson, System.currentTimeMillis());
            }
            if (deliver(entry.connection, message)) {
                delivered++;
            } else {
                if (failed == null) {
                    failed = new ArrayList<>();
                }
                failed.add(entry.connection.id());
            }
        }
        if (failed != null) {
            failed.forEach(this::evict);
        }
        if (delivered > 0) {
            broadcasts.inc();
            deliveries.add(delivered);
        }
        return delivered;
    }

    /**
     * Konuya ya da joker konuya abone olan bağlantı sayısı.
     */
    public synchronized int subscriberCount(Topic topic) {
        int count = 0;
        for (Entry entry : connections.values()) {
            if (entry.wants(topic)) {
                count++;
            }
        }
        return count;
    }

    public synchronized int connectionCount() {
        return connections.size();
    }

    public synchronized Set<Topic> subscriptions(HubConnection connection) {
        Entry entry = connections.get(connection.id());
        return entry == null ? Set.of() : Set.copyOf(entry.topics);
    }

    /**
     * Tek bağlantıya doğrudan yanıt (ör. pong) gönderir.
     */
    public synchronized void reply(HubConnection connection, String message) {
        if (connections.containsKey(connection.id()) && !deliver(connection, message)) {
            evict(connection.id());
        }
    }

    /**
     * Asenkron yazma hatası bildirildiğinde taşıma katmanı tarafından çağrılır.
     */
    public synchronized void evict(String connectionId) {
        Entry removed = connections.remove(connectionId);
        if (removed == null) {
            return;
        }
        evictions.inc();
        LOG.debugf("Evicting connection %s after failed send", connectionId);
        try {
            removed.connection.close();
        } catch (RuntimeException e) {
            LOG.debugf(e, "Closing evicted connection %s failed", connectionId);
        }
        reevaluateDemand();
    }

    @PreDestroy
    void shutdown() {
        close();
    }

    @Override
    public synchronized void close() {
        for (Entry entry : connections.values()) {
            try {
                entry.connection.close();
            } catch (RuntimeException e) {
                LOG.debugf(e, "Closing connection %s failed", entry.connection.id());
            }
        }
        connections.clear();
        reevaluateDemand();
        if (streamSubscription != null) {
            try {
                streamSubscription.close();
            } catch (Exception e) {
                LOG.debugf(e, "Detaching stream listener failed");
            }
            streamSubscription = null;
        }
    }

    private boolean deliver(HubConnection connection, String message) {
        try {
            connection.send(message);
            return true;
        } catch (RuntimeException e) {
            LOG.debugf("Send to %s failed: %s", connection.id(), e.getMessage());
            return false;
        }
    }

    private void reevaluateDemand() {
        boolean wanted = subscriberCount(Topic.LOGS) > 0;
        if (wanted && !streamDemand) {
            streamDemand = true;
            stream.start();
            LOG.info("Log stream demanded by push subscribers");
        } else if (!wanted && streamDemand) {
            streamDemand = false;
            stream.stop();
            LOG.info("Last push subscriber of log stream left");
        }
    }

    private static final class Entry {
        private final HubConnection connection;
        private final Set<Topic> topics = new LinkedHashSet<>();

        private Entry(HubConnection connection) {
            this.connection = connection;
        }

        private boolean wants(Topic topic) {
            return topics.contains(topic) || topics.contains(Topic.ALL);
        }
    }
}
