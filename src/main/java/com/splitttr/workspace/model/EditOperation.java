package com.splitttr.workspace.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Map;

/**
 * A single edit as accepted by the server. The vector clock is the client's
 * causality hint; it is stored but never used for ordering.
 */
public record EditOperation(
    String id,
    @JsonIgnore String connectionId,
    String userId,
    String fileName,
    OperationType type,
    Position position,
    String content,
    Integer length,
    Map<String, Long> vectorClock,
    Instant timestamp
) {
    public EditOperation {
        vectorClock = vectorClock == null ? Map.of() : Map.copyOf(vectorClock);
    }

    public EditOperation withPosition(Position newPosition) {
        return new EditOperation(id, connectionId, userId, fileName, type, newPosition,
            content, length, vectorClock, timestamp);
    }

    /** Characters added by an insert; zero when no content was sent. */
    public int insertedLength() {
        return content == null ? 0 : content.length();
    }

    public int deletedLength() {
        return length == null ? 0 : length;
    }
}
