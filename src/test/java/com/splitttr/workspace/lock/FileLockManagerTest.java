package com.splitttr.workspace.lock;

import com.fasterxml.jackson.databind.JsonNode;
import com.splitttr.workspace.config.CollaborationSettings;
import com.splitttr.workspace.message.ClientMessage.LockRequest;
import com.splitttr.workspace.message.ClientMessage.UnlockRequest;
import com.splitttr.workspace.model.FileLock;
import com.splitttr.workspace.model.LockType;
import com.splitttr.workspace.room.Room;
import com.splitttr.workspace.store.LockRecord;
import com.splitttr.workspace.support.CollaborationHarness;
import com.splitttr.workspace.support.RecordingChannel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class FileLockManagerTest {

    private final CollaborationHarness h = new CollaborationHarness();
    private final RecordingChannel a = new RecordingChannel();
    private final RecordingChannel b = new RecordingChannel();
    private String connA;
    private String connB;

    private void joinBoth(CollaborationHarness harness) {
        connA = harness.joinQuietly("P", "alice", a);
        connB = harness.joinQuietly("P", "bob", b);
        a.clear();
    }

    @Test
    @DisplayName("A locks main.go, B is denied, A disconnects and the room sees the unlock")
    void lockDeniedThenReleasedOnDisconnect() {
        joinBoth(h);

        LockResult granted = h.locks.acquire(connA, new LockRequest("main.go", LockType.EXCLUSIVE)).orElseThrow();
        assertTrue(granted.granted());
        assertEquals("alice", a.lastPayload("file_locked").get("lockedBy").asText());
        assertEquals("alice", b.lastPayload("file_locked").get("lockedBy").asText());
        assertEquals("exclusive", b.lastPayload("file_locked").get("lockType").asText());

        LockResult denied = h.locks.acquire(connB, new LockRequest("main.go", LockType.EXCLUSIVE)).orElseThrow();
        assertEquals(new LockResult.Denied("main.go", "alice"), denied);
        JsonNode denial = b.lastPayload("file_lock_denied");
        assertEquals("alice", denial.get("lockedBy").asText());
        assertEquals("File already locked", denial.get("reason").asText());
        assertFalse(a.received("file_lock_denied"));

        h.rooms.leave(connA);

        JsonNode unlocked = b.lastPayload("file_unlocked");
        assertEquals("main.go", unlocked.get("fileName").asText());
        assertEquals("alice", unlocked.get("unlockedBy").asText());
        assertTrue(h.rooms.room("P").orElseThrow().lockOn("main.go").isEmpty());
    }

    @Test
    void denialLeavesLockStateUntouched() {
        joinBoth(h);
        h.locks.acquire(connA, new LockRequest("main.go", LockType.EXCLUSIVE));
        Room room = h.rooms.room("P").orElseThrow();
        FileLock before = room.lockOn("main.go").orElseThrow();

        h.locks.acquire(connB, new LockRequest("main.go", LockType.SHARED));

        assertEquals(before, room.lockOn("main.go").orElseThrow());
        assertEquals(1, room.lockList().size());
        verify(h.store, times(1)).createFileLock(any(LockRecord.class));
    }

    @Test
    void sharedLocksConflictLikeExclusiveOnes() {
        joinBoth(h);

        assertTrue(h.locks.acquire(connA, new LockRequest("main.go", LockType.SHARED)).orElseThrow().granted());
        assertFalse(h.locks.acquire(connB, new LockRequest("main.go", LockType.SHARED)).orElseThrow().granted());
    }

    @Test
    void onlyTheHolderCanRelease() {
        joinBoth(h);
        h.locks.acquire(connA, new LockRequest("main.go", LockType.EXCLUSIVE));
        b.clear();

        assertFalse(h.locks.release(connB, new UnlockRequest("main.go")));
        assertFalse(b.received("file_unlocked"));
        verify(h.store, never()).removeFileLock(anyString(), anyString());

        assertTrue(h.locks.release(connA, new UnlockRequest("main.go")));
        assertEquals("alice", b.lastPayload("file_unlocked").get("unlockedBy").asText());
        assertTrue(a.received("file_unlocked"));
        verify(h.store).removeFileLock(h.rooms.room("P").orElseThrow().sessionId(), "main.go");

        assertFalse(h.locks.release(connA, new UnlockRequest("main.go")));
    }

    @Test
    void expiredLockIsReleasedBeforeTheNextRequest() {
        var expiring = new CollaborationHarness(new CollaborationSettings(
            Duration.ofMinutes(30), Duration.ofMinutes(5), 500, Duration.ofMinutes(2)));
        joinBoth(expiring);

        FileLock lock = ((LockResult.Granted) expiring.locks
            .acquire(connA, new LockRequest("main.go", LockType.EXCLUSIVE)).orElseThrow()).lock();
        assertEquals(expiring.clock.instant().plus(Duration.ofMinutes(2)), lock.expiresAt());

        expiring.clock.advance(Duration.ofMinutes(1));
        assertFalse(expiring.locks.acquire(connB, new LockRequest("main.go", LockType.EXCLUSIVE)).orElseThrow().granted());

        expiring.clock.advance(Duration.ofMinutes(1));
        LockResult result = expiring.locks.acquire(connB, new LockRequest("main.go", LockType.EXCLUSIVE)).orElseThrow();

        assertTrue(result.granted());
        assertEquals("alice", a.lastPayload("file_unlocked").get("unlockedBy").asText());
        assertEquals("bob", a.lastPayload("file_locked").get("lockedBy").asText());
    }

    @Test
    void locksWithoutTtlNeverExpire() {
        joinBoth(h);
        FileLock lock = ((LockResult.Granted) h.locks
            .acquire(connA, new LockRequest("main.go", LockType.EXCLUSIVE)).orElseThrow()).lock();

        h.clock.advance(Duration.ofDays(3));

        assertNull(lock.expiresAt());
        assertFalse(h.locks.acquire(connB, new LockRequest("main.go", LockType.EXCLUSIVE)).orElseThrow().granted());
    }

    @Test
    void connectionOutsideTheRoomCannotReleaseEvenForTheHolder() {
        joinBoth(h);
        h.locks.acquire(connA, new LockRequest("main.go", LockType.EXCLUSIVE));
        String stale = h.registry.admit("alice", "P", new RecordingChannel(), h.clock.instant()).id();

        assertFalse(h.locks.release(stale, new UnlockRequest("main.go")));
        assertTrue(h.rooms.room("P").orElseThrow().lockOn("main.go").isPresent());
        verify(h.store, never()).removeFileLock(anyString(), anyString());
    }
}
