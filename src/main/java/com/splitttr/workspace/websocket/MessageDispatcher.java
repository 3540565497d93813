package com.splitttr.workspace.websocket;

import com.splitttr.workspace.chat.ChatRelay;
import com.splitttr.workspace.lock.FileLockManager;
import com.splitttr.workspace.message.ClientMessage;
import com.splitttr.workspace.message.ClientMessage.ChatPost;
import com.splitttr.workspace.message.ClientMessage.CursorUpdate;
import com.splitttr.workspace.message.ClientMessage.EditRequest;
import com.splitttr.workspace.message.ClientMessage.FileChange;
import com.splitttr.workspace.message.ClientMessage.LockRequest;
import com.splitttr.workspace.message.ClientMessage.PresenceUpdate;
import com.splitttr.workspace.message.ClientMessage.UnlockRequest;
import com.splitttr.workspace.message.MalformedMessageException;
import com.splitttr.workspace.message.MessageCodec;
import com.splitttr.workspace.message.ServerMessage;
import com.splitttr.workspace.ops.OperationSequencer;
import com.splitttr.workspace.presence.CursorBroadcaster;
import com.splitttr.workspace.presence.PresenceTracker;
import com.splitttr.workspace.room.RoomManager;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Decodes inbound frames and routes them by type. Every failure is contained
 * to the frame that caused it; the connection stays open.
 */
@ApplicationScoped
public class MessageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    private final MessageCodec codec;
    private final RoomManager rooms;
    private final PresenceTracker presence;
    private final CursorBroadcaster cursors;
    private final OperationSequencer operations;
    private final FileLockManager locks;
    private final ChatRelay chat;
    private final Clock clock;

    @Inject
    public MessageDispatcher(MessageCodec codec, RoomManager rooms, PresenceTracker presence,
                             CursorBroadcaster cursors, OperationSequencer operations,
                             FileLockManager locks, ChatRelay chat, Clock clock) {
        this.codec = codec;
        this.rooms = rooms;
        this.presence = presence;
        this.cursors = cursors;
        this.operations = operations;
        this.locks = locks;
        this.chat = chat;
        this.clock = clock;
    }

    public void dispatch(String connectionId, String frame) {
        Optional<ClientMessage> decoded;
        try {
            decoded = codec.decode(frame);
        } catch (MalformedMessageException e) {
            log.warn("Error parsing message from {}: {}", connectionId, e.getMessage());
            rooms.sendTo(connectionId, ServerMessage.error("Invalid message format", clock.instant()));
            return;
        }
        if (decoded.isEmpty()) {
            log.info("Ignoring message of unknown type from {}", connectionId);
            return;
        }

        ClientMessage message = decoded.get();
        if (rooms.touch(connectionId).isEmpty()) {
            return;
        }
        log.debug("Received {} from {}", message.type().wireName(), connectionId);

        try {
            route(connectionId, message);
        } catch (RuntimeException e) {
            log.error("Error handling message {} from {}", message.type().wireName(), connectionId, e);
            rooms.sendTo(connectionId,
                ServerMessage.error("Failed to process " + message.type().wireName(), clock.instant()));
        }
    }

    private void route(String connectionId, ClientMessage message) {
        switch (message.type()) {
            case CURSOR_UPDATE -> cursors.updateCursor(connectionId, (CursorUpdate) message);
            case EDIT_OPERATION -> operations.submit(connectionId, (EditRequest) message);
            case FILE_CHANGE -> operations.relayFileChange(connectionId, (FileChange) message);
            case PRESENCE_UPDATE -> presence.updatePresence(connectionId, (PresenceUpdate) message);
            case FILE_LOCK -> locks.acquire(connectionId, (LockRequest) message);
            case FILE_UNLOCK -> locks.release(connectionId, (UnlockRequest) message);
            case CHAT_MESSAGE -> chat.post(connectionId, (ChatPost) message);
        }
    }
}
