package com.splitttr.workspace.presence;

import com.splitttr.workspace.message.ClientMessage.CursorUpdate;
import com.splitttr.workspace.message.ServerMessage;
import com.splitttr.workspace.model.CursorState;
import com.splitttr.workspace.room.Membership;
import com.splitttr.workspace.room.Room;
import com.splitttr.workspace.room.RoomManager;
import com.splitttr.workspace.store.CollaborationStore;
import com.splitttr.workspace.store.CollaborationStoreException;
import com.splitttr.workspace.store.CursorRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

@ApplicationScoped
public class CursorBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(CursorBroadcaster.class);

    private final RoomManager rooms;
    private final PresenceTracker presence;
    private final ColorAssigner colors;
    private final CollaborationStore store;
    private final Clock clock;

    @Inject
    public CursorBroadcaster(RoomManager rooms, PresenceTracker presence, ColorAssigner colors,
                             CollaborationStore store, Clock clock) {
        this.rooms = rooms;
        this.presence = presence;
        this.colors = colors;
        this.store = store;
        this.clock = clock;
    }

    public Optional<CursorState> updateCursor(String connectionId, CursorUpdate update) {
        Optional<Membership> membership = rooms.membership(connectionId);
        if (membership.isEmpty()) {
            return Optional.empty();
        }
        Room room = membership.get().room();
        String userId = membership.get().userId();

        var cursor = new CursorState(userId, update.fileName(), update.line(), update.column(),
            update.selectionStart(), update.selectionEnd(), colors.colorFor(userId), true);
        synchronized (room) {
            if (!room.hasParticipant(connectionId)) {
                return Optional.empty();
            }
            Instant now = clock.instant();
            room.putCursor(connectionId, cursor);
            presence.markEditing(room, connectionId, update.fileName(), now);
            rooms.broadcast(room, ServerMessage.cursorUpdate(room.sessionId(), cursor, now), Set.of(connectionId));
        }

        persist(connectionId, cursor);
        return Optional.of(cursor);
    }

    // Cursor rows are best effort; a failure never reaches the client.
    private void persist(String connectionId, CursorState cursor) {
        try {
            store.findPresenceByConnection(connectionId)
                .ifPresent(row -> store.updateCursorPosition(row.id(), CursorRecord.of(cursor)));
        } catch (CollaborationStoreException e) {
            log.warn("Error storing cursor position for {}: {}", connectionId, e.getMessage());
        }
    }
}
