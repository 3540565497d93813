package com.splitttr.workspace.message;

/** Raised when an inbound frame is not a valid envelope for its declared type. */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
