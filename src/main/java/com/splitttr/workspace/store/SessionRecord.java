package com.splitttr.workspace.store;

public record SessionRecord(
    String projectId,
    String sessionId,
    boolean isActive,
    int maxParticipants,
    boolean lockingEnabled,
    String conflictResolution
) {
    public static SessionRecord open(String projectId, String sessionId) {
        return new SessionRecord(projectId, sessionId, true, 10, false, "operational_transform");
    }
}
