package com.splitttr.workspace.store;

import com.splitttr.workspace.model.EditOperation;
import com.splitttr.workspace.model.OperationType;
import com.splitttr.workspace.model.Position;

import java.time.Instant;
import java.util.Map;

/** Stored form of an edit, carrying both the submitted and the transformed position. */
public record OperationRecord(
    String sessionId,
    String operationId,
    String userId,
    String fileName,
    OperationType operationType,
    Position position,
    Position transformedPosition,
    String content,
    int length,
    Map<String, Long> vectorClock,
    Instant timestamp
) {
    public static OperationRecord of(String sessionId, EditOperation original, EditOperation transformed) {
        return new OperationRecord(sessionId, original.id(), original.userId(), original.fileName(),
            original.type(), original.position(), transformed.position(), original.content(),
            original.deletedLength(), original.vectorClock(), original.timestamp());
    }
}
