package com.splitttr.workspace.store;

public class CollaborationStoreException extends RuntimeException {

    public CollaborationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
