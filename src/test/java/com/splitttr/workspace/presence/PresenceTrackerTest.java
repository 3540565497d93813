package com.splitttr.workspace.presence;

import com.fasterxml.jackson.databind.JsonNode;
import com.splitttr.workspace.message.ClientMessage.PresenceUpdate;
import com.splitttr.workspace.model.PresenceStatus;
import com.splitttr.workspace.model.UserPresence;
import com.splitttr.workspace.store.PresenceRecord;
import com.splitttr.workspace.support.CollaborationHarness;
import com.splitttr.workspace.support.RecordingChannel;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

class PresenceTrackerTest {

    private final CollaborationHarness h = new CollaborationHarness();

    @Test
    void updatesRecordBroadcastsToOthersAndPersists() {
        var a = new RecordingChannel();
        var b = new RecordingChannel();
        String connA = h.joinQuietly("P", "alice", a);
        h.joinQuietly("P", "bob", b);
        a.clear();

        UserPresence updated = h.presence.updatePresence(connA,
            new PresenceUpdate(PresenceStatus.AWAY, "README.md", 10, 40)).orElseThrow();

        assertEquals(PresenceStatus.AWAY, updated.status());
        assertEquals(updated, h.rooms.room("P").orElseThrow().presenceOf(connA).orElseThrow());

        JsonNode payload = b.lastPayload("presence_update");
        assertEquals("alice", payload.get("userId").asText());
        assertEquals("away", payload.get("status").asText());
        assertEquals("README.md", payload.get("currentFile").asText());
        assertEquals(40, payload.get("viewportEnd").asInt());
        assertFalse(a.received("presence_update"));

        ArgumentCaptor<PresenceRecord> stored = ArgumentCaptor.forClass(PresenceRecord.class);
        verify(h.store).updatePresence(eq(connA), stored.capture());
        assertEquals(PresenceStatus.AWAY, stored.getValue().status());
        assertEquals(10, stored.getValue().viewportStart());
    }

    @Test
    void unknownConnectionIsIgnored() {
        assertTrue(h.presence.updatePresence("conn_missing",
            new PresenceUpdate(PresenceStatus.IDLE, null, null, null)).isEmpty());
    }
}
