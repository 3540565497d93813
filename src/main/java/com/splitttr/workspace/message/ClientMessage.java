package com.splitttr.workspace.message;

import com.splitttr.workspace.model.LockType;
import com.splitttr.workspace.model.OperationType;
import com.splitttr.workspace.model.Position;
import com.splitttr.workspace.model.PresenceStatus;

import java.util.List;
import java.util.Map;

import static com.splitttr.workspace.message.PayloadChecks.requireNonNegative;
import static com.splitttr.workspace.message.PayloadChecks.requirePresent;
import static com.splitttr.workspace.message.PayloadChecks.requireText;

/**
 * Payload of an inbound envelope. Each variant validates its own required
 * fields, so a decoded message is always complete.
 */
public sealed interface ClientMessage {

    InboundType type();

    record CursorUpdate(
        String fileName,
        Integer line,
        Integer column,
        Position selectionStart,
        Position selectionEnd
    ) implements ClientMessage {
        public CursorUpdate {
            requireText(fileName, "fileName");
            requireNonNegative(line, "line");
            requireNonNegative(column, "column");
        }

        @Override
        public InboundType type() {
            return InboundType.CURSOR_UPDATE;
        }
    }

    record EditRequest(
        String fileName,
        OperationType operationType,
        Position position,
        String content,
        Integer length,
        Map<String, Long> vectorClock
    ) implements ClientMessage {
        public EditRequest {
            requireText(fileName, "fileName");
            requirePresent(operationType, "operationType");
            requirePresent(position, "position");
        }

        @Override
        public InboundType type() {
            return InboundType.EDIT_OPERATION;
        }
    }

    record FileChange(String fileName, String content) implements ClientMessage {
        public FileChange {
            requireText(fileName, "fileName");
        }

        @Override
        public InboundType type() {
            return InboundType.FILE_CHANGE;
        }
    }

    record PresenceUpdate(
        PresenceStatus status,
        String currentFile,
        Integer viewportStart,
        Integer viewportEnd
    ) implements ClientMessage {
        public PresenceUpdate {
            requirePresent(status, "status");
        }

        @Override
        public InboundType type() {
            return InboundType.PRESENCE_UPDATE;
        }
    }

    record LockRequest(String fileName, LockType lockType) implements ClientMessage {
        public LockRequest {
            requireText(fileName, "fileName");
            lockType = lockType == null ? LockType.EXCLUSIVE : lockType;
        }

        @Override
        public InboundType type() {
            return InboundType.FILE_LOCK;
        }
    }

    record UnlockRequest(String fileName) implements ClientMessage {
        public UnlockRequest {
            requireText(fileName, "fileName");
        }

        @Override
        public InboundType type() {
            return InboundType.FILE_UNLOCK;
        }
    }

    record ChatPost(
        String content,
        String messageType,
        String fileName,
        Integer lineNumber,
        String replyTo,
        List<String> mentions
    ) implements ClientMessage {
        public ChatPost {
            requireText(content, "content");
            messageType = messageType == null || messageType.isBlank() ? "chat" : messageType;
            mentions = mentions == null ? List.of() : List.copyOf(mentions);
        }

        @Override
        public InboundType type() {
            return InboundType.CHAT_MESSAGE;
        }
    }
}
