package com.splitttr.workspace.store;

import com.splitttr.workspace.model.ChatMessage;
import com.splitttr.workspace.model.UserInfo;

import java.util.List;
import java.util.Optional;

/**
 * Durable side of the collaboration engine. Room state lives in memory; every
 * write here mirrors a change that has already been applied to it. The read
 * side serves history the rooms do not keep. Implementations throw {@link CollaborationStoreException} on failure.
 */
public interface CollaborationStore {

    void createSession(SessionRecord session);

    void markSessionInactive(String sessionId);

    Optional<SessionRecord> findActiveSession(String projectId);

    PresenceRecord createPresence(PresenceRecord presence);

    void updatePresence(String connectionId, PresenceRecord presence);

    Optional<PresenceRecord> findPresenceByConnection(String connectionId);

    void updateCursorPosition(String presenceId, CursorRecord cursor);

    void createEditOperation(OperationRecord operation);

    void createFileLock(LockRecord lock);

    void removeFileLock(String sessionId, String fileName);

    /** Persists a chat message and returns it with its storage id. */
    ChatMessage createMessage(ChatMessage message);

    /** Most recent messages of the session, at most {@code limit}. */
    List<ChatMessage> sessionMessages(String sessionId, int limit);

    List<ChatMessage> fileMessages(String sessionId, String fileName, int limit);

    Optional<UserInfo> findUser(String userId);
}
