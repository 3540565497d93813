package com.splitttr.workspace.config;

import java.time.Duration;

/**
 * Tunables for the collaboration engine.
 *
 * @param idleThreshold       rooms idle longer than this are reaped
 * @param sweepInterval       how often the reaper scans all rooms
 * @param operationBufferLimit max operations kept per file for transforming later edits
 * @param lockTtl             lifetime of a granted lock; zero means no expiry
 */
public record CollaborationSettings(
    Duration idleThreshold,
    Duration sweepInterval,
    int operationBufferLimit,
    Duration lockTtl
) {
    public CollaborationSettings {
        if (operationBufferLimit < 1) {
            throw new IllegalArgumentException("operationBufferLimit must be positive");
        }
        if (idleThreshold.isNegative() || sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("reaper durations must be positive");
        }
        lockTtl = lockTtl == null ? Duration.ZERO : lockTtl;
    }

    public static CollaborationSettings defaults() {
        return new CollaborationSettings(Duration.ofMinutes(30), Duration.ofMinutes(5), 500, Duration.ZERO);
    }

    public boolean locksExpire() {
        return !lockTtl.isZero() && !lockTtl.isNegative();
    }
}
