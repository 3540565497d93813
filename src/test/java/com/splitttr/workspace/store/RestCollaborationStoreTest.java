package com.splitttr.workspace.store;

import com.splitttr.workspace.model.UserInfo;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RestCollaborationStoreTest {

    @Mock
    CollaborationStoreClient client;

    private RestCollaborationStore store;

    @BeforeEach
    void setUp() {
        store = new RestCollaborationStore(client);
    }

    private static WebApplicationException httpError(int status) {
        Response response = mock(Response.class);
        when(response.getStatus()).thenReturn(status);
        WebApplicationException error = mock(WebApplicationException.class);
        when(error.getResponse()).thenReturn(response);
        return error;
    }

    @Test
    void userProfileIsMappedToUserInfo() {
        when(client.getUser("u1")).thenReturn(new UserProfile("u1", "Ada", "Lovelace", "ada@example.com", null));

        assertEquals(new UserInfo("Ada", "Lovelace", "ada@example.com", null), store.findUser("u1").orElseThrow());
    }

    @Test
    void missingUserIsEmptyNotAnError() {
        WebApplicationException notFound = httpError(404);
        when(client.getUser("ghost")).thenThrow(notFound);

        assertTrue(store.findUser("ghost").isEmpty());
    }

    @Test
    void serverErrorsBecomeStoreExceptions() {
        WebApplicationException serverError = httpError(500);
        when(client.getPresence("conn_1")).thenThrow(serverError);

        var thrown = assertThrows(CollaborationStoreException.class, () -> store.findPresenceByConnection("conn_1"));
        assertSame(serverError, thrown.getCause());
    }

    @Test
    void transportFailuresBecomeStoreExceptions() {
        doThrow(new ProcessingException("connection refused")).when(client).removeLock("s1", "main.go");

        assertThrows(CollaborationStoreException.class, () -> store.removeFileLock("s1", "main.go"));
    }

    @Test
    void sessionDeactivationSendsInactiveStatus() {
        store.markSessionInactive("s1");

        verify(client).updateSessionStatus(eq("s1"), eq(new SessionStatusUpdate(false)));
        verify(client, never()).createSession(any());
    }

    @Test
    void activeSessionIsPickedFromTheProjectList() {
        SessionRecord closed = new SessionRecord("P", "old", false, 10, false, "operational_transform");
        SessionRecord open = SessionRecord.open("P", "current");
        when(client.projectSessions("P")).thenReturn(List.of(closed, open));

        assertEquals(Optional.of(open), store.findActiveSession("P"));
    }

    @Test
    void fileHistoryPassesTheFileFilter() {
        when(client.messages("s1", "main.go", 20)).thenReturn(null);

        assertTrue(store.fileMessages("s1", "main.go", 20).isEmpty());
        verify(client).messages("s1", "main.go", 20);
    }

    @Test
    void sessionHistoryFailureBecomesStoreException() {
        when(client.messages("s1", null, 50)).thenThrow(new ProcessingException("timeout"));

        assertThrows(CollaborationStoreException.class, () -> store.sessionMessages("s1", 50));
    }
}
