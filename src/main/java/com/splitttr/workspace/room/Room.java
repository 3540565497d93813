package com.splitttr.workspace.room;

import com.splitttr.workspace.model.CursorState;
import com.splitttr.workspace.model.EditOperation;
import com.splitttr.workspace.model.FileLock;
import com.splitttr.workspace.model.UserPresence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shared state of one project's collaboration room.
 *
 * <p>Not thread-safe on its own: every read or write happens while holding the
 * room's monitor ({@code synchronized (room)}), which serializes all handlers
 * touching the same room.
 */
public class Room {

    private static final Logger log = LoggerFactory.getLogger(Room.class);

    private final String projectId;
    private final String sessionId;

    private final Map<String, ParticipantChannel> participants = new LinkedHashMap<>();
    private final Map<String, UserPresence> presence = new LinkedHashMap<>();
    private final Map<String, CursorState> cursors = new LinkedHashMap<>();
    private final Map<String, FileLock> locks = new LinkedHashMap<>();
    private final Map<String, List<EditOperation>> operations = new HashMap<>();

    private long chatSequence;
    private Instant lastActivity;
    private boolean closed;

    public Room(String projectId, String sessionId, Instant createdAt) {
        this.projectId = projectId;
        this.sessionId = sessionId;
        this.lastActivity = createdAt;
    }

    public String projectId() {
        return projectId;
    }

    public String sessionId() {
        return sessionId;
    }

    // Participants

    public void addParticipant(String connectionId, ParticipantChannel channel, UserPresence joined) {
        participants.put(connectionId, channel);
        presence.put(connectionId, joined);
        touch(joined.lastActivity());
    }

    public Optional<UserPresence> removeParticipant(String connectionId) {
        participants.remove(connectionId);
        cursors.remove(connectionId);
        return Optional.ofNullable(presence.remove(connectionId));
    }

    public boolean hasParticipant(String connectionId) {
        return participants.containsKey(connectionId);
    }

    public Set<String> participantIds() {
        return Set.copyOf(participants.keySet());
    }

    public Map<String, ParticipantChannel> channels() {
        return Map.copyOf(participants);
    }

    public boolean isEmpty() {
        return participants.isEmpty();
    }

    // Presence and cursors

    public Optional<UserPresence> presenceOf(String connectionId) {
        return Optional.ofNullable(presence.get(connectionId));
    }

    public void putPresence(UserPresence updated) {
        if (participants.containsKey(updated.connectionId())) {
            presence.put(updated.connectionId(), updated);
        }
    }

    public List<UserPresence> presenceList() {
        return List.copyOf(presence.values());
    }

    public Optional<CursorState> cursorOf(String connectionId) {
        return Optional.ofNullable(cursors.get(connectionId));
    }

    public void putCursor(String connectionId, CursorState cursor) {
        if (participants.containsKey(connectionId)) {
            cursors.put(connectionId, cursor);
        }
    }

    public List<CursorState> cursorList() {
        return List.copyOf(cursors.values());
    }

    // Locks

    public Optional<FileLock> lockOn(String fileName) {
        return Optional.ofNullable(locks.get(fileName));
    }

    public boolean putLockIfAbsent(FileLock lock) {
        return locks.putIfAbsent(lock.fileName(), lock) == null;
    }

    public boolean removeLock(String fileName) {
        return locks.remove(fileName) != null;
    }

    public List<FileLock> locksHeldBy(String userId) {
        return locks.values().stream()
            .filter(lock -> lock.lockedBy().equals(userId))
            .toList();
    }

    public List<FileLock> lockList() {
        return List.copyOf(locks.values());
    }

    // Operations

    /**
     * Appends to the file's buffer, dropping the oldest entries beyond {@code limit}.
     * Returns the live buffer.
     */
    public List<EditOperation> appendOperation(EditOperation op, int limit) {
        List<EditOperation> buffer = operations.computeIfAbsent(op.fileName(), f -> new ArrayList<>());
        buffer.add(op);
        if (buffer.size() > limit) {
            buffer.subList(0, buffer.size() - limit).clear();
        }
        return buffer;
    }

    public List<EditOperation> operationsOn(String fileName) {
        return List.copyOf(operations.getOrDefault(fileName, List.of()));
    }

    public long nextChatSequence() {
        return ++chatSequence;
    }

    // Lifecycle

    public void touch(Instant now) {
        if (now.isAfter(lastActivity)) {
            lastActivity = now;
        }
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public boolean isIdleSince(Instant cutoff) {
        return lastActivity.isBefore(cutoff);
    }

    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Sends one frame to every participant not in {@code excluding}.
     *
     * @return ids of participants whose send failed; the caller evicts them
     */
    public List<String> deliver(String json, Set<String> excluding) {
        List<String> failed = new ArrayList<>();
        participants.forEach((connectionId, channel) -> {
            if (excluding.contains(connectionId)) {
                return;
            }
            try {
                channel.send(json);
            } catch (RuntimeException e) {
                log.warn("Error sending message to connection {}: {}", connectionId, e.getMessage());
                failed.add(connectionId);
            }
        });
        return failed;
    }
}
