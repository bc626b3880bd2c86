package com.bookwatch.monitor.output;

import com.bookwatch.monitor.model.AlertDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Audit trail of alert routing decisions, including suppressed and failed ones.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AlertDispatchStore {

    private final JdbcTemplate jdbcTemplate;

    public void record(List<AlertDecision> decisions) {
        if (decisions.isEmpty()) return;

        StoreCalls.run("record alert decisions", () -> jdbcTemplate.batchUpdate(
                "INSERT INTO alert_dispatches (change_id, channel, outcome, detail, decided_at) VALUES (?,?,?,?,?)",
                decisions, decisions.size(), (ps, d) -> {
                    ps.setString(1, d.changeId());
                    ps.setString(2, d.channel());
                    ps.setString(3, d.outcome().name());
                    ps.setString(4, d.detail());
                    ps.setTimestamp(5, StoreCalls.timestamp(d.decidedAt()));
                }));
        log.debug("Recorded {} alert decisions", decisions.size());
    }

    int countForChange(String changeId) {
        return StoreCalls.translate("count alert decisions", () -> {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM alert_dispatches WHERE change_id = ?", Integer.class, changeId);
            return count == null ? 0 : count;
        });
    }
}
