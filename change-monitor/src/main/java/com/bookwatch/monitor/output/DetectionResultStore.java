package com.bookwatch.monitor.output;

import com.bookwatch.monitor.model.DetectionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * One row per orchestration run, successful or not. The full result is kept as JSON.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DetectionResultStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public void persist(DetectionResult result) {
        String payload = toJson(result);
        StoreCalls.run("persist detection result " + result.getRunId(), () -> jdbcTemplate.update(
                "INSERT INTO detection_results (run_id, run_timestamp, success, final_state, payload) VALUES (?,?,?,?,?)",
                result.getRunId(), StoreCalls.timestamp(result.getRunTimestamp()), result.isSuccess(),
                result.getFinalState().name(), payload));
        log.debug("Persisted detection result {} ({})", result.getRunId(), result.getFinalState());
    }

    /** Runs started on the given UTC day, oldest first. */
    public List<DetectionResult> findByRunDate(LocalDate date) {
        return StoreCalls.translate("detection results on " + date, () -> jdbcTemplate.query(
                "SELECT payload FROM detection_results WHERE run_timestamp >= ? AND run_timestamp < ?"
                        + " ORDER BY run_timestamp",
                rowMapper(),
                StoreCalls.timestamp(date.atStartOfDay(ZoneOffset.UTC).toInstant()),
                StoreCalls.timestamp(date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant())));
    }

    public Optional<DetectionResult> latest() {
        return StoreCalls.translate("latest detection result", () -> jdbcTemplate.query(
                "SELECT payload FROM detection_results ORDER BY run_timestamp DESC LIMIT 1",
                rowMapper()).stream().findFirst());
    }

    private RowMapper<DetectionResult> rowMapper() {
        return (rs, rowNum) -> {
            try {
                return objectMapper.readValue(rs.getString("payload"), DetectionResult.class);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupt detection result payload", e);
            }
        };
    }

    private String toJson(DetectionResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise detection result", e);
        }
    }
}
