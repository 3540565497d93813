package com.splitttr.workspace.store;

import com.splitttr.workspace.model.FileLock;
import com.splitttr.workspace.model.LockType;

import java.time.Instant;

public record LockRecord(
    String sessionId,
    String fileName,
    String lockedBy,
    LockType lockType,
    boolean autoRelease,
    Instant expiresAt
) {
    public static LockRecord of(String sessionId, FileLock lock) {
        return new LockRecord(sessionId, lock.fileName(), lock.lockedBy(), lock.lockType(), true, lock.expiresAt());
    }
}
