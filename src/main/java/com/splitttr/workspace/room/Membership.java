package com.splitttr.workspace.room;

/** A live connection together with the room it currently belongs to. */
public record Membership(Connection connection, Room room) {

    public String connectionId() {
        return connection.id();
    }

    public String userId() {
        return connection.userId();
    }
}
