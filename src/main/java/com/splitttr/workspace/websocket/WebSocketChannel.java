package com.splitttr.workspace.websocket;

import com.splitttr.workspace.room.ParticipantChannel;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.WebSocketConnection;

final class WebSocketChannel implements ParticipantChannel {

    private final WebSocketConnection connection;

    WebSocketChannel(WebSocketConnection connection) {
        this.connection = connection;
    }

    @Override
    public String id() {
        return connection.id();
    }

    @Override
    public void send(String text) {
        connection.sendTextAndAwait(text);
    }

    @Override
    public void close(int code, String reason) {
        if (connection.isOpen()) {
            connection.closeAndAwait(new CloseReason(code, reason));
        }
    }
}
