package com.splitttr.workspace.store;

import com.splitttr.workspace.model.PresenceStatus;

public record PresenceRecord(
    String id,
    String sessionId,
    String userId,
    String connectionId,
    PresenceStatus status,
    String currentFile,
    Integer viewportStart,
    Integer viewportEnd
) {
    public static PresenceRecord joined(String sessionId, String userId, String connectionId) {
        return new PresenceRecord(null, sessionId, userId, connectionId, PresenceStatus.ONLINE, null, null, null);
    }
}
