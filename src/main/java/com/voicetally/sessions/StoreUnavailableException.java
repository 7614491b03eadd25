package com.voicetally.sessions;

/**
 * A persistence call failed. Nothing is retried; the caller decides whether to
 * repeat the whole operation.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
