package com.bookwatch.monitor.output;

import com.bookwatch.monitor.model.Change;
import com.bookwatch.monitor.model.ChangePage;
import com.bookwatch.monitor.model.ChangeQuery;
import com.bookwatch.monitor.model.ChangeType;
import com.bookwatch.monitor.model.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only log of detected changes.
 *
 * A call to {@link #persistChanges} is one transaction: either every chunk is written or
 * none is, so the caller can retry the whole call.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChangeLogStore {

    private static final int BATCH_SIZE = 500;

    private static final String COLUMNS = """
            change_id, run_id, item_id, source_url, change_type, severity, severity_rank,
            old_value, new_value, field_name, human_summary, detected_at, confidence_score""";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public void persistChanges(List<Change> changes) {
        if (changes.isEmpty()) return;

        int total = changes.size();
        StoreCalls.run("persist changes", () -> transactionTemplate.executeWithoutResult(tx -> {
            for (int i = 0; i < total; i += BATCH_SIZE) {
                writeBatch(changes.subList(i, Math.min(i + BATCH_SIZE, total)));
                log.debug("Wrote change batch {}/{}", Math.min(i + BATCH_SIZE, total), total);
            }
        }));
        log.info("Persisted {} change records", total);
    }

    public ChangePage queryChanges(ChangeQuery query, int page, int size) {
        if (page < 0 || size < 1) {
            throw new IllegalArgumentException("page must be >= 0 and size >= 1");
        }
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        List<Object> params = new ArrayList<>();

        if (query.getItemId() != null) {
            where.append(" AND item_id = ?");
            params.add(query.getItemId());
        }
        if (query.getChangeType() != null) {
            where.append(" AND change_type = ?");
            params.add(query.getChangeType().name());
        }
        if (query.getMinSeverity() != null) {
            where.append(" AND severity_rank >= ?");
            params.add(query.getMinSeverity().ordinal());
        }
        if (query.getDetectedFrom() != null) {
            where.append(" AND detected_at >= ?");
            params.add(StoreCalls.timestamp(query.getDetectedFrom()));
        }
        if (query.getDetectedTo() != null) {
            where.append(" AND detected_at < ?");
            params.add(StoreCalls.timestamp(query.getDetectedTo()));
        }

        return StoreCalls.translate("query changes", () -> {
            Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM change_logs" + where, Long.class,
                    params.toArray());

            List<Object> pageParams = new ArrayList<>(params);
            pageParams.add(size);
            pageParams.add((long) page * size);
            List<Change> changes = jdbcTemplate.query(
                    "SELECT " + COLUMNS + " FROM change_logs" + where
                            + " ORDER BY detected_at DESC, change_id LIMIT ? OFFSET ?",
                    rowMapper(), pageParams.toArray());

            return new ChangePage(changes, page, size, total == null ? 0L : total);
        });
    }

    /** All changes detected on the given UTC calendar day. */
    public List<Change> findDetectedOn(LocalDate date) {
        return StoreCalls.translate("changes detected on " + date, () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM change_logs WHERE detected_at >= ? AND detected_at < ?"
                        + " ORDER BY detected_at DESC, change_id",
                rowMapper(),
                StoreCalls.timestamp(date.atStartOfDay(ZoneOffset.UTC).toInstant()),
                StoreCalls.timestamp(date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant())));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void writeBatch(List<Change> batch) {
        jdbcTemplate.batchUpdate(
                "INSERT INTO change_logs (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)",
                batch, batch.size(), (ps, c) -> {
                    ps.setString(1, c.getChangeId());
                    ps.setString(2, c.getRunId());
                    ps.setString(3, c.getItemId());
                    ps.setString(4, c.getSourceUrl());
                    ps.setString(5, c.getChangeType().name());
                    ps.setString(6, c.getSeverity().name());
                    ps.setInt(7, c.getSeverity().ordinal());
                    ps.setString(8, c.getOldValue());
                    ps.setString(9, c.getNewValue());
                    ps.setString(10, c.getFieldName());
                    ps.setString(11, c.getHumanSummary());
                    ps.setTimestamp(12, StoreCalls.timestamp(c.getDetectedAt()));
                    ps.setDouble(13, c.getConfidenceScore());
                });
    }

    private RowMapper<Change> rowMapper() {
        return (rs, rowNum) -> Change.builder()
                .changeId(rs.getString("change_id"))
                .runId(rs.getString("run_id"))
                .itemId(rs.getString("item_id"))
                .sourceUrl(rs.getString("source_url"))
                .changeType(ChangeType.valueOf(rs.getString("change_type")))
                .severity(Severity.valueOf(rs.getString("severity")))
                .oldValue(rs.getString("old_value"))
                .newValue(rs.getString("new_value"))
                .fieldName(rs.getString("field_name"))
                .humanSummary(rs.getString("human_summary"))
                .detectedAt(StoreCalls.instant(rs.getTimestamp("detected_at")))
                .confidenceScore(rs.getDouble("confidence_score"))
                .build();
    }
}
