package com.splitttr.workspace.room;

import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class ConnectionRegistry {

    private final ConcurrentHashMap<String, Connection> connections = new ConcurrentHashMap<>();

    // channel id -> connection id
    private final ConcurrentHashMap<String, String> byChannel = new ConcurrentHashMap<>();

    public Connection admit(String userId, String projectId, ParticipantChannel channel, Instant now) {
        var connection = new Connection(newConnectionId(), userId, projectId, channel, now);
        connections.put(connection.id(), connection);
        byChannel.put(channel.id(), connection.id());
        return connection;
    }

    public Optional<Connection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Optional<Connection> findByChannel(String channelId) {
        return Optional.ofNullable(byChannel.get(channelId)).map(connections::get);
    }

    public Optional<Connection> remove(String connectionId) {
        Connection removed = connections.remove(connectionId);
        if (removed != null) {
            byChannel.remove(removed.channel().id(), connectionId);
        }
        return Optional.ofNullable(removed);
    }

    public int size() {
        return connections.size();
    }

    private static String newConnectionId() {
        return "conn_" + UUID.randomUUID();
    }
}
