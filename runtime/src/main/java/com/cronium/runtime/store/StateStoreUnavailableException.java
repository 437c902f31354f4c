package com.cronium.runtime.store;

/**
 * The backing store could not serve the request (down, timed out, pool exhausted).
 * Safe for the caller to retry.
 */
public class StateStoreUnavailableException extends RuntimeException {

    public StateStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
