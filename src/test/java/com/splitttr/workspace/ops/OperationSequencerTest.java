package com.splitttr.workspace.ops;

import com.fasterxml.jackson.databind.JsonNode;
import com.splitttr.workspace.config.CollaborationSettings;
import com.splitttr.workspace.message.ClientMessage.EditRequest;
import com.splitttr.workspace.message.ClientMessage.FileChange;
import com.splitttr.workspace.model.EditOperation;
import com.splitttr.workspace.model.OperationType;
import com.splitttr.workspace.model.Position;
import com.splitttr.workspace.model.PresenceStatus;
import com.splitttr.workspace.store.OperationRecord;
import com.splitttr.workspace.support.CollaborationHarness;
import com.splitttr.workspace.support.RecordingChannel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class OperationSequencerTest {

    private static EditRequest insert(String file, int line, int column, String text) {
        return new EditRequest(file, OperationType.INSERT, new Position(line, column), text, null, Map.of("u", 1L));
    }

    @Test
    @DisplayName("B's edit at col 2 lands at col 7 after A inserted 5 chars at col 0 just before")
    void concurrentInsertShiftsLaterEdit() {
        var h = new CollaborationHarness();
        var a = new RecordingChannel();
        var b = new RecordingChannel();
        String connA = h.joinQuietly("P", "alice", a);
        String connB = h.joinQuietly("P", "bob", b);
        a.clear();

        EditOperation first = h.operations.submit(connA, insert("main.go", 3, 0, "hello")).orElseThrow();
        h.clock.advance(Duration.ofMillis(5));
        EditOperation second = h.operations.submit(connB, insert("main.go", 3, 2, "x")).orElseThrow();

        assertEquals(new Position(3, 0), first.position());
        assertEquals(new Position(3, 7), second.position());

        JsonNode relayed = a.lastPayload("edit_operation");
        assertEquals(7, relayed.get("position").get("column").asInt());
        assertEquals("bob", relayed.get("userId").asText());
        assertFalse(relayed.has("connectionId"));
        assertEquals(1, b.ofType("edit_operation").size());
        assertEquals(1, a.ofType("edit_operation").size());

        ArgumentCaptor<OperationRecord> stored = ArgumentCaptor.forClass(OperationRecord.class);
        verify(h.store, times(2)).createEditOperation(stored.capture());
        OperationRecord record = stored.getAllValues().get(1);
        assertEquals(new Position(3, 2), record.position());
        assertEquals(new Position(3, 7), record.transformedPosition());
        assertEquals(Map.of("u", 1L), record.vectorClock());
    }

    @Test
    void editsOnOtherFilesDoNotInterfere() {
        var h = new CollaborationHarness();
        String connA = h.joinQuietly("P", "alice", new RecordingChannel());
        String connB = h.joinQuietly("P", "bob", new RecordingChannel());

        h.operations.submit(connA, insert("a.go", 0, 0, "hello"));
        h.clock.advance(Duration.ofMillis(1));

        assertEquals(new Position(0, 2), h.operations.submit(connB, insert("b.go", 0, 2, "x")).orElseThrow().position());
    }

    @Test
    void submittingMarksThePresenceAsEditing() {
        var h = new CollaborationHarness();
        String conn = h.joinQuietly("P", "alice", new RecordingChannel());

        h.operations.submit(conn, insert("main.go", 0, 0, "x"));

        var presence = h.rooms.room("P").orElseThrow().presenceOf(conn).orElseThrow();
        assertEquals(PresenceStatus.EDITING, presence.status());
        assertEquals("main.go", presence.currentFile());
    }

    @Test
    void bufferKeepsOnlyTheNewestOperations() {
        var h = new CollaborationHarness(new CollaborationSettings(
            Duration.ofMinutes(30), Duration.ofMinutes(5), 2, Duration.ZERO));
        String conn = h.joinQuietly("P", "alice", new RecordingChannel());

        for (int i = 0; i < 3; i++) {
            h.operations.submit(conn, insert("main.go", 0, i, "x"));
            h.clock.advance(Duration.ofMillis(1));
        }

        var buffered = h.rooms.room("P").orElseThrow().operationsOn("main.go");
        assertEquals(2, buffered.size());
        assertEquals(1, buffered.get(0).position().column());
    }

    @Test
    void fileChangeIsRelayedToOthersOnly() {
        var h = new CollaborationHarness();
        var a = new RecordingChannel();
        var b = new RecordingChannel();
        String connA = h.joinQuietly("P", "alice", a);
        h.joinQuietly("P", "bob", b);
        a.clear();

        h.operations.relayFileChange(connA, new FileChange("main.go", "package main"));

        JsonNode payload = b.lastPayload("file_change");
        assertEquals("package main", payload.get("content").asText());
        assertEquals("alice", payload.get("changedBy").asText());
        assertFalse(a.received("file_change"));
    }

    @Test
    void connectionWithoutRoomIsIgnored() {
        var h = new CollaborationHarness();
        assertTrue(h.operations.submit("conn_missing", insert("main.go", 0, 0, "x")).isEmpty());
    }
}
