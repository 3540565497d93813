package com.splitttr.workspace.rest;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.splitttr.workspace.message.ServerMessage.Participant;
import com.splitttr.workspace.store.SessionRecord;

import java.util.List;

/** Stored session record flattened together with who is in the room right now. */
public record CollaborationSessionView(
    @JsonUnwrapped SessionRecord session,
    int participants,
    List<Participant> activeUsers
) {}
