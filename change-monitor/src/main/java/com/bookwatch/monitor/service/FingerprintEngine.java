package com.bookwatch.monitor.service;

import com.bookwatch.monitor.model.Fingerprint;
import com.bookwatch.monitor.model.Item;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes SHA-256 fingerprints of catalog items.
 *
 * Each digest covers a sorted JSON object of canonical field values, so field order,
 * numeric formatting (51.77 vs 51.770) and surrounding whitespace do not affect it.
 * Item ids are derived from the source URL the same way.
 */
@Component
@Slf4j
public class FingerprintEngine {

    private static final String ITEM_ID_PREFIX = "book_";
    private static final int ITEM_ID_HEX_LENGTH = 32;

    // Own mapper: hash input must not depend on application Jackson settings.
    private static final ObjectMapper CANONICAL_JSON = JsonMapper.builder()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    private final Clock clock;

    public FingerprintEngine(Clock clock) {
        this.clock = clock;
    }

    public Fingerprint computeFingerprint(Item item) {
        Instant now = clock.instant();
        Fingerprint fingerprint = Fingerprint.builder()
                .itemId(itemIdFor(item.getSourceUrl()))
                .sourceUrl(item.getSourceUrl())
                .contentHash(digest(List.of(TrackedField.values()), item))
                .priceHash(groupHash(FieldGroup.PRICE, item))
                .availabilityHash(groupHash(FieldGroup.AVAILABILITY, item))
                .metadataHash(groupHash(FieldGroup.METADATA, item))
                .snapshot(item)
                .createdAt(now)
                .updatedAt(now)
                .build();

        log.debug("Fingerprint {} content={}...", fingerprint.getItemId(), fingerprint.getContentHash().substring(0, 16));
        return fingerprint;
    }

    public String groupHash(FieldGroup group, Item item) {
        return digest(TrackedField.inGroup(group), item);
    }

    /** Stable id for a source URL: re-crawling the same URL always yields the same id. */
    public String itemIdFor(String sourceUrl) {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new DataIntegrityException("source_url is required to derive an item id");
        }
        return ITEM_ID_PREFIX + sha256Hex(sourceUrl.trim()).substring(0, ITEM_ID_HEX_LENGTH);
    }

    private String digest(Collection<TrackedField> fields, Item item) {
        Map<String, String> canonical = new TreeMap<>();
        for (TrackedField field : fields) {
            canonical.put(field.key(), field.canonical(item));
        }
        try {
            return sha256Hex(CANONICAL_JSON.writeValueAsString(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise fields for hashing", e);
        }
    }

    static String sha256Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
