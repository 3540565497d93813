package com.splitttr.workspace.store;

import com.splitttr.workspace.model.ChatMessage;
import com.splitttr.workspace.model.UserInfo;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.eclipse.microprofile.rest.client.inject.RestClient;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

@ApplicationScoped
public class RestCollaborationStore implements CollaborationStore {

    private final CollaborationStoreClient client;

    @Inject
    public RestCollaborationStore(@RestClient CollaborationStoreClient client) {
        this.client = client;
    }

    @Override
    public void createSession(SessionRecord session) {
        call("create session " + session.sessionId(), () -> client.createSession(session));
    }

    @Override
    public void markSessionInactive(String sessionId) {
        run("deactivate session " + sessionId,
            () -> client.updateSessionStatus(sessionId, new SessionStatusUpdate(false)));
    }

    @Override
    public Optional<SessionRecord> findActiveSession(String projectId) {
        List<SessionRecord> sessions = call("list sessions of project " + projectId,
            () -> client.projectSessions(projectId));
        return sessions == null ? Optional.empty() : sessions.stream().filter(SessionRecord::isActive).findFirst();
    }

    @Override
    public PresenceRecord createPresence(PresenceRecord presence) {
        return call("create presence for " + presence.connectionId(), () -> client.createPresence(presence));
    }

    @Override
    public void updatePresence(String connectionId, PresenceRecord presence) {
        call("update presence for " + connectionId, () -> client.updatePresence(connectionId, presence));
    }

    @Override
    public Optional<PresenceRecord> findPresenceByConnection(String connectionId) {
        try {
            return Optional.ofNullable(client.getPresence(connectionId));
        } catch (WebApplicationException e) {
            if (e.getResponse() != null && e.getResponse().getStatus() == 404) {
                return Optional.empty();
            }
            throw new CollaborationStoreException("Failed to look up presence for " + connectionId, e);
        } catch (ProcessingException e) {
            throw new CollaborationStoreException("Failed to look up presence for " + connectionId, e);
        }
    }

    @Override
    public void updateCursorPosition(String presenceId, CursorRecord cursor) {
        run("update cursor for " + presenceId, () -> client.updateCursor(presenceId, cursor));
    }

    @Override
    public void createEditOperation(OperationRecord operation) {
        run("create operation " + operation.operationId(), () -> client.createOperation(operation));
    }

    @Override
    public void createFileLock(LockRecord lock) {
        run("create lock on " + lock.fileName(), () -> client.createLock(lock));
    }

    @Override
    public void removeFileLock(String sessionId, String fileName) {
        run("remove lock on " + fileName, () -> client.removeLock(sessionId, fileName));
    }

    @Override
    public ChatMessage createMessage(ChatMessage message) {
        return call("create chat message", () -> client.createMessage(message));
    }

    @Override
    public List<ChatMessage> sessionMessages(String sessionId, int limit) {
        return orEmpty(call("load messages of session " + sessionId, () -> client.messages(sessionId, null, limit)));
    }

    @Override
    public List<ChatMessage> fileMessages(String sessionId, String fileName, int limit) {
        return orEmpty(call("load messages on " + fileName, () -> client.messages(sessionId, fileName, limit)));
    }

    @Override
    public Optional<UserInfo> findUser(String userId) {
        try {
            return Optional.ofNullable(client.getUser(userId)).map(UserProfile::toUserInfo);
        } catch (WebApplicationException e) {
            if (e.getResponse() != null && e.getResponse().getStatus() == 404) {
                return Optional.empty();
            }
            throw new CollaborationStoreException("Failed to look up user " + userId, e);
        } catch (ProcessingException e) {
            throw new CollaborationStoreException("Failed to look up user " + userId, e);
        }
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private <T> T call(String what, Supplier<T> request) {
        try {
            return request.get();
        } catch (WebApplicationException | ProcessingException e) {
            throw new CollaborationStoreException("Failed to " + what, e);
        }
    }

    private void run(String what, Runnable request) {
        call(what, () -> {
            request.run();
            return null;
        });
    }
}
