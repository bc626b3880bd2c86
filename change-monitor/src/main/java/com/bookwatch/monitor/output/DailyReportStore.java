package com.bookwatch.monitor.output;

import com.bookwatch.monitor.model.DailyReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Daily reports keyed by report date. Storing a report for a date replaces the previous one.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DailyReportStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public void upsert(DailyReport report) {
        String payload = toJson(report);
        Date reportDate = Date.valueOf(report.getReportDate());

        StoreCalls.run("upsert daily report " + report.getReportDate(), () -> {
            int updated = jdbcTemplate.update(
                    "UPDATE daily_reports SET report_id = ?, generated_at = ?, payload = ? WHERE report_date = ?",
                    report.getReportId(), StoreCalls.timestamp(report.getGeneratedAt()), payload, reportDate);
            if (updated == 0) {
                jdbcTemplate.update(
                        "INSERT INTO daily_reports (report_date, report_id, generated_at, payload) VALUES (?,?,?,?)",
                        reportDate, report.getReportId(), StoreCalls.timestamp(report.getGeneratedAt()), payload);
            }
        });
        log.info("Stored daily report {}", report.getReportId());
    }

    public Optional<DailyReport> find(LocalDate date) {
        return StoreCalls.translate("find daily report " + date, () -> jdbcTemplate.query(
                "SELECT payload FROM daily_reports WHERE report_date = ?",
                rowMapper(), Date.valueOf(date)).stream().findFirst());
    }

    /** Reports from the last {@code days} days up to and including {@code today}, newest first. */
    public List<DailyReport> history(LocalDate today, int days) {
        return StoreCalls.translate("daily report history", () -> jdbcTemplate.query(
                "SELECT payload FROM daily_reports WHERE report_date > ? AND report_date <= ? ORDER BY report_date DESC",
                rowMapper(), Date.valueOf(today.minusDays(days)), Date.valueOf(today)));
    }

    public int deleteOlderThan(LocalDate cutoff) {
        return StoreCalls.translate("delete old daily reports", () -> jdbcTemplate.update(
                "DELETE FROM daily_reports WHERE report_date < ?", Date.valueOf(cutoff)));
    }

    private RowMapper<DailyReport> rowMapper() {
        return (rs, rowNum) -> {
            try {
                return objectMapper.readValue(rs.getString("payload"), DailyReport.class);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupt daily report payload", e);
            }
        };
    }

    private String toJson(DailyReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise daily report", e);
        }
    }
}
