package com.splitttr.workspace.lock;

import com.splitttr.workspace.model.FileLock;

public sealed interface LockResult {

    record Granted(FileLock lock) implements LockResult {}

    record Denied(String fileName, String lockedBy) implements LockResult {}

    default boolean granted() {
        return this instanceof Granted;
    }
}
