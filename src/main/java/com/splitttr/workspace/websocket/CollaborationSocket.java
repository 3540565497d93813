package com.splitttr.workspace.websocket;

import com.splitttr.workspace.room.ConnectionRegistry;
import com.splitttr.workspace.room.RoomManager;
import io.quarkus.websockets.next.*;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * WebSocket endpoint for project collaboration rooms.
 * Clients connect with {@code ?projectId=...&userId=...}.
 */
@WebSocket(path = "/ws/collaboration")
public class CollaborationSocket {

    private static final Logger log = LoggerFactory.getLogger(CollaborationSocket.class);

    static final int POLICY_VIOLATION = 1008;

    private final RoomManager rooms;
    private final ConnectionRegistry registry;
    private final MessageDispatcher dispatcher;

    @Inject
    public CollaborationSocket(RoomManager rooms, ConnectionRegistry registry, MessageDispatcher dispatcher) {
        this.rooms = rooms;
        this.registry = registry;
        this.dispatcher = dispatcher;
    }

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        String query = connection.handshakeRequest().query();
        Map<String, String> params = parseQuery(query);
        String projectId = params.get("projectId");
        String userId = params.get("userId");

        if (projectId == null || userId == null) {
            log.warn("Refusing WebSocket {}: missing projectId or userId", connection.id());
            connection.closeAndAwait(new CloseReason(POLICY_VIOLATION, "Missing projectId or userId"));
            return;
        }

        String connectionId = rooms.join(projectId, userId, new WebSocketChannel(connection));
        log.debug("WebSocket {} bound to {}", connection.id(), connectionId);
    }

    @OnTextMessage
    public void onMessage(String frame, WebSocketConnection connection) {
        registry.findByChannel(connection.id())
            .ifPresent(c -> dispatcher.dispatch(c.id(), frame));
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        log.debug("WebSocket closed: {}", connection.id());
        handleLeave(connection);
    }

    @OnError
    public void onError(WebSocketConnection connection, Throwable t) {
        log.warn("WebSocket error on {}: {}", connection.id(), t.getMessage());
        handleLeave(connection);
    }

    private void handleLeave(WebSocketConnection connection) {
        registry.findByChannel(connection.id())
            .ifPresent(c -> rooms.leave(c.id()));
    }

    // First occurrence wins; blank values count as missing.
    static Map<String, String> parseQuery(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String name = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            if (!value.isBlank()) {
                params.putIfAbsent(name, value);
            }
        }
        return params;
    }

    private static String decode(String part) {
        return URLDecoder.decode(part, StandardCharsets.UTF_8);
    }
}
