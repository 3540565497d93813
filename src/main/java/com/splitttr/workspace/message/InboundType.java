package com.splitttr.workspace.message;

import java.util.Arrays;
import java.util.Optional;

public enum InboundType {
    CURSOR_UPDATE("cursor_update", ClientMessage.CursorUpdate.class),
    EDIT_OPERATION("edit_operation", ClientMessage.EditRequest.class),
    FILE_CHANGE("file_change", ClientMessage.FileChange.class),
    PRESENCE_UPDATE("presence_update", ClientMessage.PresenceUpdate.class),
    FILE_LOCK("file_lock", ClientMessage.LockRequest.class),
    FILE_UNLOCK("file_unlock", ClientMessage.UnlockRequest.class),
    CHAT_MESSAGE("chat_message", ClientMessage.ChatPost.class);

    private final String wireName;
    private final Class<? extends ClientMessage> payloadType;

    InboundType(String wireName, Class<? extends ClientMessage> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends ClientMessage> payloadType() {
        return payloadType;
    }

    public static Optional<InboundType> fromWire(String name) {
        return Arrays.stream(values())
            .filter(t -> t.wireName.equals(name))
            .findFirst();
    }
}
