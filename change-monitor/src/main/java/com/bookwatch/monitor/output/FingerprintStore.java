package com.bookwatch.monitor.output;

import com.bookwatch.monitor.model.Fingerprint;
import com.bookwatch.monitor.model.FingerprintStats;
import com.bookwatch.monitor.model.Item;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One fingerprint row per item id.
 *
 * Concurrent workers of a run always touch distinct item ids, so upsert is a plain
 * update-then-insert without row locking.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FingerprintStore {

    private static final String COLUMNS = """
            item_id, source_url, content_hash, price_hash, availability_hash, metadata_hash,
            snapshot, created_at, updated_at, removed_at""";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public Optional<Fingerprint> find(String itemId) {
        return StoreCalls.translate("find fingerprint " + itemId, () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM fingerprints WHERE item_id = ?",
                rowMapper(), itemId).stream().findFirst());
    }

    public Optional<Fingerprint> findBySourceUrl(String sourceUrl) {
        return StoreCalls.translate("find fingerprint by url", () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM fingerprints WHERE source_url = ?",
                rowMapper(), sourceUrl).stream().findFirst());
    }

    /**
     * Writes the fingerprint, keeping the original created_at of an existing row.
     * Clears any removal marker, since the item was just observed.
     */
    public void upsert(Fingerprint fp) {
        String snapshot = toJson(fp.getSnapshot());
        StoreCalls.run("upsert fingerprint " + fp.getItemId(), () -> {
            int updated = jdbcTemplate.update("""
                    UPDATE fingerprints
                    SET source_url = ?, content_hash = ?, price_hash = ?, availability_hash = ?,
                        metadata_hash = ?, snapshot = ?, updated_at = ?, removed_at = NULL
                    WHERE item_id = ?
                    """,
                    fp.getSourceUrl(), fp.getContentHash(), fp.getPriceHash(), fp.getAvailabilityHash(),
                    fp.getMetadataHash(), snapshot, StoreCalls.timestamp(fp.getUpdatedAt()), fp.getItemId());

            if (updated == 0) {
                jdbcTemplate.update("INSERT INTO fingerprints (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,NULL)",
                        fp.getItemId(), fp.getSourceUrl(), fp.getContentHash(), fp.getPriceHash(),
                        fp.getAvailabilityHash(), fp.getMetadataHash(), snapshot,
                        StoreCalls.timestamp(fp.getCreatedAt()), StoreCalls.timestamp(fp.getUpdatedAt()));
                log.debug("Created fingerprint {}", fp.getItemId());
            } else {
                log.debug("Updated fingerprint {}", fp.getItemId());
            }
        });
    }

    public void markRemoved(String itemId, Instant removedAt) {
        StoreCalls.run("mark fingerprint removed " + itemId, () -> jdbcTemplate.update(
                "UPDATE fingerprints SET removed_at = ? WHERE item_id = ? AND removed_at IS NULL",
                StoreCalls.timestamp(removedAt), itemId));
    }

    Set<String> listAllItemIds() {
        return StoreCalls.translate("list fingerprint ids", () ->
                new HashSet<>(jdbcTemplate.queryForList("SELECT item_id FROM fingerprints", String.class)));
    }

    /** Ids of items still expected in the catalog, i.e. not already reported as removed. */
    public Set<String> listActiveItemIds() {
        return StoreCalls.translate("list active fingerprint ids", () -> new HashSet<>(jdbcTemplate.queryForList(
                "SELECT item_id FROM fingerprints WHERE removed_at IS NULL", String.class)));
    }

    public long count() {
        return StoreCalls.translate("count fingerprints", () -> {
            Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM fingerprints", Long.class);
            return total == null ? 0L : total;
        });
    }

    public FingerprintStats stats() {
        return StoreCalls.translate("fingerprint stats", () -> jdbcTemplate.queryForObject("""
                SELECT COUNT(*) AS total,
                       SUM(CASE WHEN removed_at IS NULL THEN 1 ELSE 0 END) AS active,
                       MIN(updated_at) AS oldest,
                       MAX(updated_at) AS newest
                FROM fingerprints
                """, (rs, i) -> {
            long total = rs.getLong("total");
            long active = rs.getLong("active");
            return new FingerprintStats(total, active, total - active,
                    StoreCalls.instant(rs.getTimestamp("oldest")),
                    StoreCalls.instant(rs.getTimestamp("newest")));
        }));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RowMapper<Fingerprint> rowMapper() {
        return (rs, rowNum) -> Fingerprint.builder()
                .itemId(rs.getString("item_id"))
                .sourceUrl(rs.getString("source_url"))
                .contentHash(rs.getString("content_hash"))
                .priceHash(rs.getString("price_hash"))
                .availabilityHash(rs.getString("availability_hash"))
                .metadataHash(rs.getString("metadata_hash"))
                .snapshot(readSnapshot(rs))
                .createdAt(StoreCalls.instant(rs.getTimestamp("created_at")))
                .updatedAt(StoreCalls.instant(rs.getTimestamp("updated_at")))
                .removedAt(StoreCalls.instant(rs.getTimestamp("removed_at")))
                .build();
    }

    private Item readSnapshot(ResultSet rs) throws SQLException {
        String json = rs.getString("snapshot");
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Item.class);
        } catch (JsonProcessingException e) {
            // Unreadable snapshot degrades to hash-only evidence for this item.
            log.warn("Ignoring unreadable snapshot for {}: {}", rs.getString("item_id"), e.getMessage());
            return null;
        }
    }

    private String toJson(Item snapshot) {
        if (snapshot == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise item snapshot", e);
        }
    }
}
