package com.splitttr.workspace.model;

import java.time.Instant;

public record FileLock(
    String fileName,
    String lockedBy,
    LockType lockType,
    Instant lockedAt,
    Instant expiresAt
) {
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
