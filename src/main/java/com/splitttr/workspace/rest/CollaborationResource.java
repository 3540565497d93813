package com.splitttr.workspace.rest;

import com.splitttr.workspace.message.ServerMessage.ErrorBody;
import com.splitttr.workspace.message.ServerMessage.Participant;
import com.splitttr.workspace.model.ChatMessage;
import com.splitttr.workspace.room.RoomManager;
import com.splitttr.workspace.store.CollaborationStore;
import com.splitttr.workspace.store.CollaborationStoreException;
import com.splitttr.workspace.store.SessionRecord;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/** Read-only view of live rooms and their stored history for dashboards and the project page. */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
public class CollaborationResource {

    private static final Logger log = LoggerFactory.getLogger(CollaborationResource.class);

    private final RoomManager rooms;
    private final CollaborationStore store;

    @Inject
    public CollaborationResource(RoomManager rooms, CollaborationStore store) {
        this.rooms = rooms;
        this.store = store;
    }

    /** The project's active session with its live participants; 204 when there is none. */
    @GET
    @Path("/projects/{projectId}/collaboration/session")
    public Response session(@PathParam("projectId") String projectId) {
        try {
            Optional<SessionRecord> active = store.findActiveSession(projectId);
            if (active.isEmpty()) {
                return Response.noContent().build();
            }
            List<Participant> users = participants(projectId);
            return Response.ok(new CollaborationSessionView(active.get(), users.size(), users)).build();
        } catch (CollaborationStoreException e) {
            log.error("Error getting collaboration session of project {}: {}", projectId, e.getMessage());
            return Response.serverError().entity(new ErrorBody("Failed to get collaboration session")).build();
        }
    }

    @GET
    @Path("/projects/{projectId}/collaboration/participants")
    public List<Participant> participants(@PathParam("projectId") String projectId) {
        return rooms.participants(projectId).stream()
            .map(rooms::participant)
            .toList();
    }

    @GET
    @Path("/projects/{projectId}/collaboration/messages")
    public Response messages(@PathParam("projectId") String projectId,
                             @QueryParam("limit") @DefaultValue("50") int limit,
                             @QueryParam("fileName") String fileName) {
        if (limit < 1) {
            return Response.status(Response.Status.BAD_REQUEST)
                .entity(new ErrorBody("limit must be positive"))
                .build();
        }
        try {
            Optional<SessionRecord> active = store.findActiveSession(projectId);
            if (active.isEmpty()) {
                return Response.ok(List.of()).build();
            }
            String sessionId = active.get().sessionId();
            List<ChatMessage> messages = fileName == null || fileName.isBlank()
                ? store.sessionMessages(sessionId, limit)
                : store.fileMessages(sessionId, fileName, limit);
            return Response.ok(messages).build();
        } catch (CollaborationStoreException e) {
            log.error("Error getting collaboration messages of project {}: {}", projectId, e.getMessage());
            return Response.serverError().entity(new ErrorBody("Failed to get collaboration messages")).build();
        }
    }

    @GET
    @Path("/collaboration/stats")
    public CollaborationStats stats() {
        return new CollaborationStats(rooms.roomCount(), rooms.connectionCount());
    }
}
