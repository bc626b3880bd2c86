package com.bookwatch.monitor.output;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the tables owned by the change monitor. The books table belongs to the crawler
 * and is only read.
 *
 * Structured columns (snapshot, payload, breakdown maps) hold JSON text.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MonitorSchema {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring change-monitor schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS fingerprints
            (
                item_id             VARCHAR(64) PRIMARY KEY,
                source_url          VARCHAR NOT NULL,
                content_hash        VARCHAR(64) NOT NULL,
                price_hash          VARCHAR(64) NOT NULL,
                availability_hash   VARCHAR(64) NOT NULL,
                metadata_hash       VARCHAR(64) NOT NULL,
                snapshot            VARCHAR,
                created_at          TIMESTAMP NOT NULL,
                updated_at          TIMESTAMP NOT NULL,
                removed_at          TIMESTAMP
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS change_logs
            (
                change_id           VARCHAR(36) PRIMARY KEY,
                run_id              VARCHAR(36),
                item_id             VARCHAR(64) NOT NULL,
                source_url          VARCHAR NOT NULL,
                change_type         VARCHAR(32) NOT NULL,
                severity            VARCHAR(16) NOT NULL,
                severity_rank       INTEGER NOT NULL,
                old_value           VARCHAR,
                new_value           VARCHAR,
                field_name          VARCHAR(64),
                human_summary       VARCHAR NOT NULL,
                detected_at         TIMESTAMP NOT NULL,
                confidence_score    DOUBLE PRECISION NOT NULL
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_change_logs_detected_at ON change_logs (detected_at)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_change_logs_item_id ON change_logs (item_id)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS alert_dispatches
            (
                change_id           VARCHAR(36) NOT NULL,
                channel             VARCHAR(32) NOT NULL,
                outcome             VARCHAR(32) NOT NULL,
                detail              VARCHAR,
                decided_at          TIMESTAMP NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS detection_results
            (
                run_id              VARCHAR(36) PRIMARY KEY,
                run_timestamp       TIMESTAMP NOT NULL,
                success             BOOLEAN NOT NULL,
                final_state         VARCHAR(16) NOT NULL,
                payload             VARCHAR NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS daily_reports
            (
                report_date         DATE PRIMARY KEY,
                report_id           VARCHAR(32) NOT NULL,
                generated_at        TIMESTAMP NOT NULL,
                payload             VARCHAR NOT NULL
            )
        """);

        log.info("Change-monitor schema ready.");
    }
}
