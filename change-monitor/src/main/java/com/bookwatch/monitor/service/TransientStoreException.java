package com.bookwatch.monitor.service;

/**
 * Store or transport temporarily unavailable. Retried at the call site, then recorded
 * against the item being processed.
 */
public class TransientStoreException extends RuntimeException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
