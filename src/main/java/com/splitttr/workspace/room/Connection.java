package com.splitttr.workspace.room;

import java.time.Instant;

/** One admitted client session, bound to a single user and project for its lifetime. */
public record Connection(
    String id,
    String userId,
    String projectId,
    ParticipantChannel channel,
    Instant admittedAt
) {}
