package com.jasmin.abuseguard.store;

/**
 * The backing store could not render an answer. This is the only failure the engine propagates;
 * callers resolve it with the action's fail-open / fail-closed policy.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
