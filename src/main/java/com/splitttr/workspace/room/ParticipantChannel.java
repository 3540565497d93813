package com.splitttr.workspace.room;

/**
 * Outbound side of one client's network session. Implementations throw an
 * unchecked exception from {@link #send} when the peer can no longer be reached.
 */
public interface ParticipantChannel {

    /** Transport-level id, unique among open channels. */
    String id();

    void send(String text);

    void close(int code, String reason);
}
