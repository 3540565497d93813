package com.splitttr.workspace.room;

import com.splitttr.workspace.message.MessageCodec;
import com.splitttr.workspace.message.ServerMessage;
import com.splitttr.workspace.message.ServerMessage.Participant;
import com.splitttr.workspace.message.ServerMessage.RoomJoined;
import com.splitttr.workspace.model.FileLock;
import com.splitttr.workspace.model.UserInfo;
import com.splitttr.workspace.model.UserPresence;
import com.splitttr.workspace.presence.ColorAssigner;
import com.splitttr.workspace.store.CollaborationStore;
import com.splitttr.workspace.store.CollaborationStoreException;
import com.splitttr.workspace.store.PresenceRecord;
import com.splitttr.workspace.store.SessionRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Owns every live room, keyed by project id. Rooms are created by the first
 * joiner and dropped when the last participant leaves.
 */
@ApplicationScoped
public class RoomManager {

    private static final Logger log = LoggerFactory.getLogger(RoomManager.class);

    static final int CLOSE_GOING_AWAY = 1001;

    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();

    private final ConnectionRegistry registry;
    private final CollaborationStore store;
    private final ColorAssigner colors;
    private final MessageCodec codec;
    private final Clock clock;

    @Inject
    public RoomManager(ConnectionRegistry registry, CollaborationStore store, ColorAssigner colors,
                       MessageCodec codec, Clock clock) {
        this.registry = registry;
        this.store = store;
        this.colors = colors;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Admits a connection into the project's room, creating the room if needed.
     * The joiner receives a {@code room_joined} snapshot; everyone else a {@code user_joined}.
     *
     * A joiner whose snapshot cannot be sent is dropped before anyone else sees it.
     *
     * @return the new connection id
     */
    public String join(String projectId, String userId, ParticipantChannel channel) {
        Connection connection = registry.admit(userId, projectId, channel, clock.instant());
        String color = colors.colorFor(userId);
        UserInfo info = lookupUser(userId);

        while (true) {
            AtomicBoolean created = new AtomicBoolean();
            Room room = rooms.computeIfAbsent(projectId, id -> {
                created.set(true);
                return new Room(id, newSessionId(), clock.instant());
            });

            synchronized (room) {
                if (room.isClosed()) {
                    // lost a race with the last leaver or the reaper; retry on a fresh room
                    continue;
                }
                Instant now = clock.instant();
                UserPresence presence = UserPresence.online(connection.id(), userId, info, now);
                var snapshot = new RoomJoined(projectId, room.sessionId(), color,
                    Stream.concat(room.presenceList().stream(), Stream.of(presence)).map(this::participant).toList(),
                    room.cursorList(), room.lockList());

                // Nobody hears about a joiner that never received its snapshot.
                if (!deliverSnapshot(connection, ServerMessage.roomJoined(snapshot, userId, now))) {
                    registry.remove(connection.id());
                    if (room.isEmpty()) {
                        room.close();
                        rooms.remove(projectId, room);
                    }
                    return connection.id();
                }
                room.addParticipant(connection.id(), channel, presence);
                broadcast(room, ServerMessage.userJoined(room.sessionId(), participant(presence), now),
                    Set.of(connection.id()));
            }

            persistJoin(room, connection, created.get());
            log.info("User {} joined collaboration room for project {}", userId, projectId);
            return connection.id();
        }
    }

    /**
     * Removes the connection from its room, releasing the user's locks. Unknown
     * connections are ignored, so this is safe to call more than once.
     */
    public void leave(String connectionId) {
        Optional<Connection> removed = registry.remove(connectionId);
        if (removed.isEmpty()) {
            return;
        }
        Connection connection = removed.get();
        Room room = rooms.get(connection.projectId());
        if (room != null) {
            depart(room, connection);
        }
        log.info("User {} disconnected from project {}", connection.userId(), connection.projectId());
    }

    public Optional<Membership> membership(String connectionId) {
        return registry.find(connectionId).flatMap(connection -> {
            Room room = rooms.get(connection.projectId());
            return room == null ? Optional.empty() : Optional.of(new Membership(connection, room));
        });
    }

    public Optional<Membership> touch(String connectionId) {
        Optional<Membership> membership = membership(connectionId);
        membership.ifPresent(m -> {
            Instant now = clock.instant();
            synchronized (m.room()) {
                m.room().touch(now);
                m.room().presenceOf(connectionId).ifPresent(p -> m.room().putPresence(p.touched(now)));
            }
        });
        return membership;
    }

    public void broadcast(String projectId, ServerMessage message, Set<String> excluding) {
        Room room = rooms.get(projectId);
        if (room != null) {
            broadcast(room, message, excluding);
        }
    }

    public void broadcast(Room room, ServerMessage message, Set<String> excluding) {
        String json = codec.encode(message);
        List<String> failed;
        synchronized (room) {
            failed = room.deliver(json, excluding);
        }
        failed.forEach(this::evict);
    }

    public void broadcastToAll(Room room, ServerMessage message) {
        broadcast(room, message, Set.of());
    }

    public void sendTo(String connectionId, ServerMessage message) {
        registry.find(connectionId).ifPresent(connection -> {
            try {
                connection.channel().send(codec.encode(message));
            } catch (RuntimeException e) {
                log.warn("Error sending message to connection {}: {}", connectionId, e.getMessage());
                evict(connectionId);
            }
        });
    }

    /**
     * Closes the room if it has been idle since before {@code cutoff}: every
     * member is unregistered and its channel closed, then the session is
     * marked inactive.
     *
     * @return true if the room was closed
     */
    public boolean closeIfIdle(Room room, Instant cutoff) {
        Map<String, ParticipantChannel> members;
        synchronized (room) {
            if (room.isClosed() || !room.isIdleSince(cutoff)) {
                return false;
            }
            room.close();
            members = room.channels();
            rooms.remove(room.projectId(), room);
        }

        members.forEach((connectionId, channel) -> {
            registry.remove(connectionId);
            try {
                channel.close(CLOSE_GOING_AWAY, "Room closed due to inactivity");
            } catch (RuntimeException e) {
                log.warn("Error closing connection {}: {}", connectionId, e.getMessage());
            }
        });
        deactivateSession(room);
        return true;
    }

    public Optional<Room> room(String projectId) {
        return Optional.ofNullable(rooms.get(projectId));
    }

    public List<Room> rooms() {
        return List.copyOf(rooms.values());
    }

    public List<UserPresence> participants(String projectId) {
        Room room = rooms.get(projectId);
        if (room == null) {
            return List.of();
        }
        synchronized (room) {
            return room.presenceList();
        }
    }

    public int roomCount() {
        return rooms.size();
    }

    public int connectionCount() {
        return registry.size();
    }

    public Participant participant(UserPresence presence) {
        return new Participant(presence.userId(), presence.status(), presence.currentFile(),
            presence.userInfo(), colors.colorFor(presence.userId()));
    }

    private boolean deliverSnapshot(Connection connection, ServerMessage snapshot) {
        try {
            connection.channel().send(codec.encode(snapshot));
            return true;
        } catch (RuntimeException e) {
            log.warn("Dropping connection {} of user {}: room snapshot could not be sent: {}",
                connection.id(), connection.userId(), e.getMessage());
            return false;
        }
    }

    // Send failures land here; the dead channel gets no goodbye.
    private void evict(String connectionId) {
        registry.remove(connectionId).ifPresent(connection -> {
            log.info("Evicting unreachable connection {} of user {}", connectionId, connection.userId());
            Room room = rooms.get(connection.projectId());
            if (room != null) {
                depart(room, connection);
            }
        });
    }

    private void depart(Room room, Connection connection) {
        String userId = connection.userId();
        List<FileLock> released;
        boolean emptied;
        synchronized (room) {
            if (!room.hasParticipant(connection.id())) {
                return;
            }
            room.removeParticipant(connection.id());
            released = room.locksHeldBy(userId);
            released.forEach(lock -> room.removeLock(lock.fileName()));

            Instant now = clock.instant();
            for (FileLock lock : released) {
                broadcastToAll(room, ServerMessage.fileUnlocked(room.sessionId(), lock.fileName(), userId, now));
            }
            broadcastToAll(room, ServerMessage.userLeft(room.sessionId(), userId, now));

            emptied = room.isEmpty() && !room.isClosed();
            if (emptied) {
                room.close();
                rooms.remove(room.projectId(), room);
            }
        }

        for (FileLock lock : released) {
            try {
                store.removeFileLock(room.sessionId(), lock.fileName());
            } catch (CollaborationStoreException e) {
                log.warn("Error removing lock on {}: {}", lock.fileName(), e.getMessage());
            }
        }
        if (emptied) {
            deactivateSession(room);
        }
    }

    private void persistJoin(Room room, Connection connection, boolean createdRoom) {
        try {
            if (createdRoom) {
                store.createSession(SessionRecord.open(room.projectId(), room.sessionId()));
            }
            store.createPresence(PresenceRecord.joined(room.sessionId(), connection.userId(), connection.id()));
        } catch (CollaborationStoreException e) {
            log.error("Error joining project room {}: {}", room.projectId(), e.getMessage());
            sendTo(connection.id(), ServerMessage.error("Failed to join collaboration room", clock.instant()));
        }
    }

    private UserInfo lookupUser(String userId) {
        try {
            return store.findUser(userId).orElseGet(UserInfo::empty);
        } catch (CollaborationStoreException e) {
            log.warn("Error looking up user {}: {}", userId, e.getMessage());
            return UserInfo.empty();
        }
    }

    private void deactivateSession(Room room) {
        try {
            store.markSessionInactive(room.sessionId());
        } catch (CollaborationStoreException e) {
            log.warn("Error updating session status for {}: {}", room.sessionId(), e.getMessage());
        }
    }

    private static String newSessionId() {
        return "session_" + UUID.randomUUID();
    }
}
