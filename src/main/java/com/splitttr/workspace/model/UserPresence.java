package com.splitttr.workspace.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Presence of one connection inside a room. Instances are immutable; a room
 * replaces the entry on every change.
 */
public record UserPresence(
    @JsonIgnore String connectionId,
    String userId,
    PresenceStatus status,
    String currentFile,
    Integer viewportStart,
    Integer viewportEnd,
    UserInfo userInfo,
    Instant lastActivity
) {
    public static UserPresence online(String connectionId, String userId, UserInfo info, Instant now) {
        return new UserPresence(connectionId, userId, PresenceStatus.ONLINE, null, null, null, info, now);
    }

    public UserPresence withStatus(PresenceStatus newStatus, String file, Integer start, Integer end, Instant now) {
        return new UserPresence(connectionId, userId, newStatus, file, start, end, userInfo, now);
    }

    // Cursor motion and edits imply the user is editing that file; the viewport is kept.
    public UserPresence editing(String file, Instant now) {
        return new UserPresence(connectionId, userId, PresenceStatus.EDITING, file, viewportStart, viewportEnd, userInfo, now);
    }

    public UserPresence touched(Instant now) {
        return new UserPresence(connectionId, userId, status, currentFile, viewportStart, viewportEnd, userInfo, now);
    }
}
