package com.splitttr.workspace.store;

import com.splitttr.workspace.model.ChatMessage;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;

@RegisterRestClient(configKey = "collaboration-store")
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface CollaborationStoreClient {

    @POST
    @Path("/collaboration/sessions")
    SessionRecord createSession(SessionRecord session);

    @GET
    @Path("/collaboration/projects/{projectId}/sessions")
    List<SessionRecord> projectSessions(@PathParam("projectId") String projectId);

    @PUT
    @Path("/collaboration/sessions/{sessionId}/status")
    void updateSessionStatus(@PathParam("sessionId") String sessionId, SessionStatusUpdate update);

    @POST
    @Path("/collaboration/presence")
    PresenceRecord createPresence(PresenceRecord presence);

    @PUT
    @Path("/collaboration/presence/{connectionId}")
    PresenceRecord updatePresence(@PathParam("connectionId") String connectionId, PresenceRecord presence);

    @GET
    @Path("/collaboration/presence/{connectionId}")
    PresenceRecord getPresence(@PathParam("connectionId") String connectionId);

    @PUT
    @Path("/collaboration/presence/{presenceId}/cursor")
    void updateCursor(@PathParam("presenceId") String presenceId, CursorRecord cursor);

    @POST
    @Path("/collaboration/operations")
    void createOperation(OperationRecord operation);

    @POST
    @Path("/collaboration/locks")
    void createLock(LockRecord lock);

    @DELETE
    @Path("/collaboration/locks")
    void removeLock(@QueryParam("sessionId") String sessionId, @QueryParam("fileName") String fileName);

    @POST
    @Path("/collaboration/messages")
    ChatMessage createMessage(ChatMessage message);

    @GET
    @Path("/collaboration/sessions/{sessionId}/messages")
    List<ChatMessage> messages(@PathParam("sessionId") String sessionId,
                               @QueryParam("fileName") String fileName,
                               @QueryParam("limit") int limit);

    @GET
    @Path("/users/{id}")
    UserProfile getUser(@PathParam("id") String id);
}
