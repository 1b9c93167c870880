package com.openforge.storeagent.common;

/**
 * The persistence layer was unreachable or rejected a write.
 * The failed operation left no partial state behind.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
