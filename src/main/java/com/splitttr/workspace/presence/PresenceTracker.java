package com.splitttr.workspace.presence;

import com.splitttr.workspace.message.ClientMessage.PresenceUpdate;
import com.splitttr.workspace.message.ServerMessage;
import com.splitttr.workspace.message.ServerMessage.PresenceChanged;
import com.splitttr.workspace.model.UserPresence;
import com.splitttr.workspace.room.Membership;
import com.splitttr.workspace.room.Room;
import com.splitttr.workspace.room.RoomManager;
import com.splitttr.workspace.store.CollaborationStore;
import com.splitttr.workspace.store.PresenceRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

@ApplicationScoped
public class PresenceTracker {

    private final RoomManager rooms;
    private final CollaborationStore store;
    private final Clock clock;

    @Inject
    public PresenceTracker(RoomManager rooms, CollaborationStore store, Clock clock) {
        this.rooms = rooms;
        this.store = store;
        this.clock = clock;
    }

    public Optional<UserPresence> updatePresence(String connectionId, PresenceUpdate update) {
        Optional<Membership> membership = rooms.membership(connectionId);
        if (membership.isEmpty()) {
            return Optional.empty();
        }
        Room room = membership.get().room();

        UserPresence updated;
        synchronized (room) {
            Optional<UserPresence> current = room.presenceOf(connectionId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            Instant now = clock.instant();
            updated = current.get().withStatus(update.status(), update.currentFile(),
                update.viewportStart(), update.viewportEnd(), now);
            room.putPresence(updated);

            var change = new PresenceChanged(updated.userId(), updated.status(), updated.currentFile(),
                updated.viewportStart(), updated.viewportEnd());
            rooms.broadcast(room, ServerMessage.presenceUpdate(room.sessionId(), change, now), Set.of(connectionId));
        }

        store.updatePresence(connectionId, new PresenceRecord(null, room.sessionId(), updated.userId(),
            connectionId, updated.status(), updated.currentFile(), updated.viewportStart(), updated.viewportEnd()));
        return Optional.of(updated);
    }

    // caller holds the room's monitor
    public void markEditing(Room room, String connectionId, String fileName, Instant now) {
        room.presenceOf(connectionId).ifPresent(p -> room.putPresence(p.editing(fileName, now)));
    }
}
