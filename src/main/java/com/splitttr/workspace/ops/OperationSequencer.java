package com.splitttr.workspace.ops;

import com.splitttr.workspace.config.CollaborationSettings;
import com.splitttr.workspace.message.ClientMessage.EditRequest;
import com.splitttr.workspace.message.ClientMessage.FileChange;
import com.splitttr.workspace.message.ServerMessage;
import com.splitttr.workspace.message.ServerMessage.FileChanged;
import com.splitttr.workspace.model.EditOperation;
import com.splitttr.workspace.presence.PresenceTracker;
import com.splitttr.workspace.room.Membership;
import com.splitttr.workspace.room.Room;
import com.splitttr.workspace.room.RoomManager;
import com.splitttr.workspace.store.CollaborationStore;
import com.splitttr.workspace.store.OperationRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Orders edits per file by server arrival time and rewrites each incoming
 * position against what other participants did first.
 */
@ApplicationScoped
public class OperationSequencer {

    private static final Logger log = LoggerFactory.getLogger(OperationSequencer.class);

    private final RoomManager rooms;
    private final PresenceTracker presence;
    private final CollaborationStore store;
    private final CollaborationSettings settings;
    private final Clock clock;

    @Inject
    public OperationSequencer(RoomManager rooms, PresenceTracker presence, CollaborationStore store,
                              CollaborationSettings settings, Clock clock) {
        this.rooms = rooms;
        this.presence = presence;
        this.store = store;
        this.settings = settings;
        this.clock = clock;
    }

    public Optional<EditOperation> submit(String connectionId, EditRequest request) {
        Optional<Membership> membership = rooms.membership(connectionId);
        if (membership.isEmpty()) {
            return Optional.empty();
        }
        Room room = membership.get().room();

        EditOperation original;
        EditOperation transformed;
        synchronized (room) {
            if (!room.hasParticipant(connectionId)) {
                return Optional.empty();
            }
            Instant now = clock.instant();
            original = new EditOperation(newOperationId(), connectionId, membership.get().userId(),
                request.fileName(), request.operationType(), request.position(), request.content(),
                request.length(), request.vectorClock(), now);

            List<EditOperation> buffer = room.appendOperation(original, settings.operationBufferLimit());
            buffer.sort(PositionTransformer.BY_TIMESTAMP);
            transformed = original.withPosition(PositionTransformer.transform(original, buffer));
            if (!transformed.position().equals(original.position())) {
                log.debug("Transformed {} on {} from {} to {}", original.id(), original.fileName(),
                    original.position(), transformed.position());
            }

            presence.markEditing(room, connectionId, request.fileName(), now);
            rooms.broadcast(room, ServerMessage.editOperation(room.sessionId(), transformed, now),
                Set.of(connectionId));
        }

        store.createEditOperation(OperationRecord.of(room.sessionId(), original, transformed));
        return Optional.of(transformed);
    }

    public void relayFileChange(String connectionId, FileChange change) {
        rooms.membership(connectionId).ifPresent(m -> {
            Room room = m.room();
            var payload = new FileChanged(change.fileName(), change.content(), m.userId());
            rooms.broadcast(room, ServerMessage.fileChange(room.sessionId(), payload, clock.instant()),
                Set.of(connectionId));
        });
    }

    private static String newOperationId() {
        return "op_" + UUID.randomUUID();
    }
}
