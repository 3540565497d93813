package com.splitttr.workspace.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.splitttr.workspace.room.ParticipantChannel;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** Channel that keeps every frame it is sent, optionally failing on send. */
public class RecordingChannel implements ParticipantChannel {

    private static final ObjectMapper mapper = new ObjectMapper();

    private final String id = "ws-" + UUID.randomUUID();
    private final List<String> frames = new ArrayList<>();
    private boolean failing;
    private Integer closeCode;
    private String closeReason;

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String text) {
        if (failing) {
            throw new IllegalStateException("peer gone");
        }
        frames.add(text);
    }

    @Override
    public void close(int code, String reason) {
        closeCode = code;
        closeReason = reason;
    }

    public void failSends() {
        failing = true;
    }

    public void clear() {
        frames.clear();
    }

    public List<JsonNode> messages() {
        return frames.stream().map(RecordingChannel::parse).toList();
    }

    public List<String> types() {
        return messages().stream().map(m -> m.get("type").asText()).toList();
    }

    public List<JsonNode> ofType(String type) {
        return messages().stream().filter(m -> type.equals(m.get("type").asText())).toList();
    }

    /** Payload of the most recent message of the given type. */
    public JsonNode lastPayload(String type) {
        List<JsonNode> matching = ofType(type);
        if (matching.isEmpty()) {
            throw new AssertionError("no " + type + " message among " + types());
        }
        return matching.get(matching.size() - 1).get("payload");
    }

    public boolean received(String type) {
        return types().contains(type);
    }

    public Integer closeCode() {
        return closeCode;
    }

    public String closeReason() {
        return closeReason;
    }

    private static JsonNode parse(String frame) {
        try {
            return mapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
