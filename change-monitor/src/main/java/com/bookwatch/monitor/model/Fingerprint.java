package com.bookwatch.monitor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Digests of one tracked item, one row per item id in the fingerprints table.
 *
 * The snapshot holds the raw field values the hashes were computed from, so a later
 * run can report precise old/new values. It is null for rows written without one.
 */
@Value
@Builder(toBuilder = true)
public class Fingerprint {

    String itemId;
    String sourceUrl;

    String contentHash;
    String priceHash;
    String availabilityHash;
    String metadataHash;

    Item snapshot;

    Instant createdAt;
    Instant updatedAt;

    /** Set when the item disappeared from the catalog; cleared when it comes back. */
    Instant removedAt;

    public boolean isRemoved() {
        return removedAt != null;
    }
}
