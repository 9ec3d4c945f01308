package com.pulse.net;

import com.pulse.config.HubProperties;
import com.pulse.constants.HubProtocol;
import com.pulse.hub.ClientMessage;
import com.pulse.hub.ConnectionRegistry;
import com.pulse.hub.HubMessageCodec;
import com.pulse.hub.Topic;
import io.quarkus.runtime.Startup;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.http.ServerWebSocket;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * İzleyicilerin bağlandığı WebSocket sunucusudur. Uygulama ayağa kalktığında
 * yapılandırılan port ve yol üzerinden bağlantı kabul eder, her bağlantıyı
 * {@link ConnectionRegistry}'ye kaydeder ve gelen abone ol / abonelikten çık /
 * ping mesajlarını kayıt defterine iletir. Çözülemeyen mesajlar yok sayılır,
 * bağlantı açık kalır.
 */
@Startup
@Singleton
public class HubWebSocketServer implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(HubWebSocketServer.class);

    private final Vertx vertx;
    private final ConnectionRegistry registry;
    private final HubMessageCodec codec;
    private final HubProperties.Network networkConfig;
    private final AtomicLong connectionIds = new AtomicLong();

    private volatile boolean running;
    private HttpServer httpServer;

    @Inject
    public HubWebSocketServer(Vertx vertx,
                              ConnectionRegistry registry,
                              HubMessageCodec codec,
                              HubProperties properties) {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.networkConfig = Objects.requireNonNull(properties.network(), "networkConfig");
    }

    @PostConstruct
    void start()
    {
        HttpServerOptions options = new HttpServerOptions()
                .setHost(networkConfig.host())
                .setPort(networkConfig.port())
                .setTcpNoDelay(true)
                .setReuseAddress(true);

        httpServer = vertx.createHttpServer(options);
        httpServer.webSocketHandler(this::onWebSocket);
        httpServer.requestHandler(request -> request.response().setStatusCode(404).end());
        try {
            httpServer.listen().toCompletionStage().toCompletableFuture().join();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Failed to bind hub WebSocket port", e);
        }

        running = true;
        LOG.infof("Hub WebSocket listening on ws://%s:%d%s",
                networkConfig.host(), httpServer.actualPort(), networkConfig.path());
    }

    public int actualPort() {
        return httpServer == null ? -1 : httpServer.actualPort();
    }

    public boolean isRunning() {
        return running;
    }

    private void onWebSocket(ServerWebSocket socket)
    {
        if (!running || !networkConfig.path().equals(socket.path())) {
            socket.reject(404);
            return;
        }
        String id = "ws-" + connectionIds.incrementAndGet();
        WebSocketConnection connection = new WebSocketConnection(id, socket, registry::evict);

        socket.closeHandler(v -> registry.unregister(connection));
        socket.exceptionHandler(e -> {
            if (LOG.isDebugEnabled()) {
                LOG.debugf(e, "Viewer %s disconnected with error", socket.remoteAddress());
            }
            socket.close();
        });
        socket.textMessageHandler(text -> onMessage(connection, text));
        registry.register(connection);
    }

    void onMessage(WebSocketConnection connection, String text)
    {
        Optional<ClientMessage> decoded = codec.decode(text);
        if (decoded.isEmpty()) {
            LOG.debugf("Ignoring malformed message from %s", connection.id());
            return;
        }
        ClientMessage message = decoded.get();
        switch (message.type()) {
            case HubProtocol.SUBSCRIBE -> registry.subscribe(connection, topics(message));
            case HubProtocol.UNSUBSCRIBE -> registry.unsubscribe(connection, topics(message));
            case HubProtocol.PING -> registry.reply(connection, codec.pong(System.currentTimeMillis()));
            default -> LOG.debugf("Ignoring unknown message type %s from %s", message.type(), connection.id());
        }
    }

    private static List<Topic> topics(ClientMessage message) {
        return message.topics().stream()
                .map(Topic::fromWire)
                .flatMap(Optional::stream)
                .toList();
    }

    @PreDestroy
    void shutdown() {
        close();
    }

    @Override
    public synchronized void close() {
        if (!running) {
            return;
        }
        running = false;
        if (httpServer != null) {
            httpServer.close().toCompletionStage().toCompletableFuture().join();
        }
    }
}
