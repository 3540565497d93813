package com.splitttr.workspace.lock;

import com.splitttr.workspace.config.CollaborationSettings;
import com.splitttr.workspace.message.ClientMessage.LockRequest;
import com.splitttr.workspace.message.ClientMessage.UnlockRequest;
import com.splitttr.workspace.message.ServerMessage;
import com.splitttr.workspace.message.ServerMessage.LockDenied;
import com.splitttr.workspace.model.FileLock;
import com.splitttr.workspace.room.Membership;
import com.splitttr.workspace.room.Room;
import com.splitttr.workspace.room.RoomManager;
import com.splitttr.workspace.store.CollaborationStore;
import com.splitttr.workspace.store.LockRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Cooperative per-file locks within a room. Any existing lock blocks a new
 * one regardless of type, so {@code shared} currently behaves as
 * {@code exclusive}. Locks held by a departing user are released by
 * {@link RoomManager}.
 */
@ApplicationScoped
public class FileLockManager {

    private static final Logger log = LoggerFactory.getLogger(FileLockManager.class);

    static final String ALREADY_LOCKED = "File already locked";

    private final RoomManager rooms;
    private final CollaborationStore store;
    private final CollaborationSettings settings;
    private final Clock clock;

    @Inject
    public FileLockManager(RoomManager rooms, CollaborationStore store, CollaborationSettings settings, Clock clock) {
        this.rooms = rooms;
        this.store = store;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Tries to lock a file for the requesting user. A grant is broadcast to the
     * whole room; a denial goes to the requester only and changes nothing.
     */
    public Optional<LockResult> acquire(String connectionId, LockRequest request) {
        Optional<Membership> membership = rooms.membership(connectionId);
        if (membership.isEmpty()) {
            return Optional.empty();
        }
        Room room = membership.get().room();
        String userId = membership.get().userId();
        String fileName = request.fileName();

        FileLock expired = null;
        FileLock granted;
        synchronized (room) {
            if (!room.hasParticipant(connectionId)) {
                return Optional.empty();
            }
            Instant now = clock.instant();
            Optional<FileLock> existing = room.lockOn(fileName);
            if (existing.isPresent() && existing.get().isExpired(now)) {
                expired = existing.get();
                room.removeLock(fileName);
                rooms.broadcastToAll(room,
                    ServerMessage.fileUnlocked(room.sessionId(), fileName, expired.lockedBy(), now));
                log.debug("Lock on {} held by {} expired", fileName, expired.lockedBy());
                existing = Optional.empty();
            }

            if (existing.isPresent()) {
                String holder = existing.get().lockedBy();
                rooms.sendTo(connectionId, ServerMessage.lockDenied(room.sessionId(), userId,
                    new LockDenied(fileName, holder, ALREADY_LOCKED), now));
                return Optional.of(new LockResult.Denied(fileName, holder));
            }

            Instant expiresAt = settings.locksExpire() ? now.plus(settings.lockTtl()) : null;
            granted = new FileLock(fileName, userId, request.lockType(), now, expiresAt);
            room.putLockIfAbsent(granted);
            rooms.broadcastToAll(room, ServerMessage.fileLocked(room.sessionId(), granted, now));
        }

        if (expired != null) {
            store.removeFileLock(room.sessionId(), fileName);
        }
        store.createFileLock(LockRecord.of(room.sessionId(), granted));
        return Optional.of(new LockResult.Granted(granted));
    }

    public boolean release(String connectionId, UnlockRequest request) {
        Optional<Membership> membership = rooms.membership(connectionId);
        if (membership.isEmpty()) {
            return false;
        }
        Room room = membership.get().room();
        String userId = membership.get().userId();
        String fileName = request.fileName();

        synchronized (room) {
            if (!room.hasParticipant(connectionId)) {
                return false;
            }
            Optional<FileLock> lock = room.lockOn(fileName);
            if (lock.isEmpty() || !lock.get().lockedBy().equals(userId)) {
                return false;
            }
            room.removeLock(fileName);
            rooms.broadcastToAll(room, ServerMessage.fileUnlocked(room.sessionId(), fileName, userId, clock.instant()));
        }

        store.removeFileLock(room.sessionId(), fileName);
        return true;
    }
}
