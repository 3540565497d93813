package com.splitttr.workspace.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;

/**
 * JSON envelope codec. Inbound frames look like
 * {@code {type, payload, timestamp, userId, sessionId}}; only {@code type} and
 * {@code payload} are read, the rest is client bookkeeping.
 */
@ApplicationScoped
public class MessageCodec {

    private static final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    /**
     * Decodes one inbound frame.
     *
     * @return the typed payload, or empty when the type is not one we handle
     * @throws MalformedMessageException if the frame is not JSON, has no type,
     *     or its payload does not fit the declared type
     */
    public Optional<ClientMessage> decode(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Frame is not valid JSON", e);
        }
        if (root == null || !root.isObject() || !root.path("type").isTextual()) {
            throw new MalformedMessageException("Envelope has no type");
        }

        String typeName = root.get("type").asText();
        Optional<InboundType> type = InboundType.fromWire(typeName);
        if (type.isEmpty()) {
            return Optional.empty();
        }

        JsonNode payload = root.get("payload");
        if (payload == null || payload.isNull()) {
            payload = JsonNodeFactory.instance.objectNode();
        }
        if (!payload.isObject()) {
            throw new MalformedMessageException("Payload of " + typeName + " must be an object");
        }

        try {
            return Optional.of(mapper.treeToValue(payload, type.get().payloadType()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedMessageException("Invalid " + typeName + " payload", e);
        }
    }

    public String encode(ServerMessage message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + message.type() + " message", e);
        }
    }
}
