package com.splitttr.workspace.message;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.splitttr.workspace.model.ChatMessage;
import com.splitttr.workspace.model.CursorState;
import com.splitttr.workspace.model.EditOperation;
import com.splitttr.workspace.model.FileLock;
import com.splitttr.workspace.model.PresenceStatus;
import com.splitttr.workspace.model.UserInfo;

import java.time.Instant;
import java.util.List;

/**
 * Outbound envelope. {@code userId} names the user whose action produced the
 * message, when there is one.
 */
public record ServerMessage(
    String type,
    Object payload,
    long timestamp,
    String userId,
    String sessionId
) {
    public record Participant(
        String userId,
        PresenceStatus status,
        String currentFile,
        UserInfo userInfo,
        String userColor
    ) {}

    public record RoomJoined(
        String roomId,
        String sessionId,
        String userColor,
        List<Participant> participants,
        List<CursorState> activeCursors,
        List<FileLock> fileLocks
    ) {}

    public record UserJoined(Participant user) {}

    public record UserLeft(String userId) {}

    public record PresenceChanged(
        String userId,
        PresenceStatus status,
        String currentFile,
        Integer viewportStart,
        Integer viewportEnd
    ) {}

    public record FileChanged(String fileName, String content, String changedBy) {}

    public record LockDenied(String fileName, String lockedBy, String reason) {}

    public record FileUnlocked(String fileName, String unlockedBy) {}

    public record ChatPosted(
        @JsonUnwrapped ChatMessage message,
        UserInfo userInfo,
        String userColor
    ) {}

    public record ErrorBody(String message) {}

    public static ServerMessage roomJoined(RoomJoined snapshot, String userId, Instant at) {
        return new ServerMessage("room_joined", snapshot, at.toEpochMilli(), userId, snapshot.sessionId());
    }

    public static ServerMessage userJoined(String sessionId, Participant user, Instant at) {
        return new ServerMessage("user_joined", new UserJoined(user), at.toEpochMilli(), user.userId(), sessionId);
    }

    public static ServerMessage userLeft(String sessionId, String userId, Instant at) {
        return new ServerMessage("user_left", new UserLeft(userId), at.toEpochMilli(), userId, sessionId);
    }

    public static ServerMessage cursorUpdate(String sessionId, CursorState cursor, Instant at) {
        return new ServerMessage("cursor_update", cursor, at.toEpochMilli(), cursor.userId(), sessionId);
    }

    public static ServerMessage presenceUpdate(String sessionId, PresenceChanged change, Instant at) {
        return new ServerMessage("presence_update", change, at.toEpochMilli(), change.userId(), sessionId);
    }

    public static ServerMessage editOperation(String sessionId, EditOperation op, Instant at) {
        return new ServerMessage("edit_operation", op, at.toEpochMilli(), op.userId(), sessionId);
    }

    public static ServerMessage fileChange(String sessionId, FileChanged change, Instant at) {
        return new ServerMessage("file_change", change, at.toEpochMilli(), change.changedBy(), sessionId);
    }

    public static ServerMessage fileLocked(String sessionId, FileLock lock, Instant at) {
        return new ServerMessage("file_locked", lock, at.toEpochMilli(), lock.lockedBy(), sessionId);
    }

    public static ServerMessage lockDenied(String sessionId, String requester, LockDenied denial, Instant at) {
        return new ServerMessage("file_lock_denied", denial, at.toEpochMilli(), requester, sessionId);
    }

    public static ServerMessage fileUnlocked(String sessionId, String fileName, String userId, Instant at) {
        return new ServerMessage("file_unlocked", new FileUnlocked(fileName, userId), at.toEpochMilli(), userId, sessionId);
    }

    public static ServerMessage chatMessage(String sessionId, ChatPosted posted, Instant at) {
        return new ServerMessage("chat_message", posted, at.toEpochMilli(), posted.message().userId(), sessionId);
    }

    public static ServerMessage error(String message, Instant at) {
        return new ServerMessage("error", new ErrorBody(message), at.toEpochMilli(), null, null);
    }
}
