package com.splitttr.workspace.model;

import java.time.Instant;
import java.util.List;

/** A chat line or code annotation. {@code sequence} is assigned by the room when the message is relayed. */
public record ChatMessage(
    String id,
    String sessionId,
    String userId,
    String messageType,
    String content,
    String fileName,
    Integer lineNumber,
    String replyTo,
    List<String> mentions,
    Long sequence,
    Instant createdAt
) {
    public ChatMessage {
        mentions = mentions == null ? List.of() : List.copyOf(mentions);
    }
}
