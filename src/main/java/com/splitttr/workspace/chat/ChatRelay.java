package com.splitttr.workspace.chat;

import com.splitttr.workspace.message.ClientMessage.ChatPost;
import com.splitttr.workspace.message.ServerMessage;
import com.splitttr.workspace.message.ServerMessage.ChatPosted;
import com.splitttr.workspace.model.ChatMessage;
import com.splitttr.workspace.model.UserInfo;
import com.splitttr.workspace.model.UserPresence;
import com.splitttr.workspace.presence.ColorAssigner;
import com.splitttr.workspace.room.Membership;
import com.splitttr.workspace.room.Room;
import com.splitttr.workspace.room.RoomManager;
import com.splitttr.workspace.store.CollaborationStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Chat and code annotations. Messages are stored before anyone sees them and
 * are delivered to the whole room, sender included.
 */
@ApplicationScoped
public class ChatRelay {

    private final RoomManager rooms;
    private final CollaborationStore store;
    private final ColorAssigner colors;
    private final Clock clock;

    @Inject
    public ChatRelay(RoomManager rooms, CollaborationStore store, ColorAssigner colors, Clock clock) {
        this.rooms = rooms;
        this.store = store;
        this.colors = colors;
        this.clock = clock;
    }

    /**
     * Stores the message, then numbers and relays it in one step so the room
     * sees messages in sequence order. A message stored while its sender was
     * leaving is still relayed.
     */
    public Optional<ChatMessage> post(String connectionId, ChatPost post) {
        Optional<Membership> membership = rooms.membership(connectionId);
        if (membership.isEmpty()) {
            return Optional.empty();
        }
        Room room = membership.get().room();
        String userId = membership.get().userId();

        synchronized (room) {
            if (!room.hasParticipant(connectionId)) {
                return Optional.empty();
            }
        }
        var draft = new ChatMessage(null, room.sessionId(), userId, post.messageType(), post.content(),
            post.fileName(), post.lineNumber(), post.replyTo(), post.mentions(), null, clock.instant());
        ChatMessage stored = store.createMessage(draft);

        synchronized (room) {
            ChatMessage posted = numbered(draft, stored, room.nextChatSequence());
            UserInfo info = room.presenceOf(connectionId)
                .map(UserPresence::userInfo)
                .orElseGet(UserInfo::empty);
            rooms.broadcastToAll(room, ServerMessage.chatMessage(room.sessionId(),
                new ChatPosted(posted, info, colors.colorFor(userId)), clock.instant()));
            return Optional.of(posted);
        }
    }

    // The room owns the sequence; storage owns id and creation time.
    private static ChatMessage numbered(ChatMessage draft, ChatMessage stored, long sequence) {
        String id = stored == null ? null : stored.id();
        Instant createdAt = stored == null || stored.createdAt() == null ? draft.createdAt() : stored.createdAt();
        return new ChatMessage(id, draft.sessionId(), draft.userId(), draft.messageType(), draft.content(),
            draft.fileName(), draft.lineNumber(), draft.replyTo(), draft.mentions(), sequence, createdAt);
    }
}
