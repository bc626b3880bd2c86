package com.bookwatch.monitor.service;

/**
 * Malformed item record. The item is skipped for the run and reported as an error entry.
 */
public class DataIntegrityException extends RuntimeException {

    public DataIntegrityException(String message) {
        super(message);
    }
}
