package com.bookwatch.monitor.service;

/**
 * Semantic groups of tracked fields. Each group except CONTENT has its own digest;
 * CONTENT fields only take part in the overall content hash.
 */
public enum FieldGroup {
    PRICE,
    AVAILABILITY,
    METADATA,
    CONTENT
}
