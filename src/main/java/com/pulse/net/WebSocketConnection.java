package com.pulse.net;

import com.pulse.hub.HubConnection;
import io.vertx.core.http.ServerWebSocket;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * {@link HubConnection} sözleşmesinin Vert.x WebSocket uygulaması. Kapanmış
 * sokete yazma hemen hata verir; yazmanın sonradan başarısız olması ise
 * verilen geri çağrı ile bildirilir.
 */
final class WebSocketConnection implements HubConnection
{
    private final String id;
    private final ServerWebSocket socket;
    private final Consumer<String> onWriteFailure;

    WebSocketConnection(String id, ServerWebSocket socket, Consumer<String> onWriteFailure) {
        this.id = Objects.requireNonNull(id, "id");
        this.socket = Objects.requireNonNull(socket, "socket");
        this.onWriteFailure = Objects.requireNonNull(onWriteFailure, "onWriteFailure");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String text) {
        if (socket.isClosed()) {
            throw new IllegalStateException("WebSocket " + id + " is closed");
        }
        socket.writeTextMessage(text).onFailure(e -> onWriteFailure.accept(id));
    }

    @Override
    public void close() {
        if (!socket.isClosed()) {
            socket.close();
        }
    }

    @Override
    public String toString() {
        return "WebSocketConnection{" + id + ", remote=" + socket.remoteAddress() + '}';
    }
}
