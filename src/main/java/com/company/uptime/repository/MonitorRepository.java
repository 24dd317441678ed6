package com.company.uptime.repository;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Monitor;
import com.company.uptime.domain.enums.MonitorStatus;
import com.company.uptime.domain.enums.MonitorType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class MonitorRepository {

    private static final String SELECT_COLUMNS = """
            SELECT monitor_id, user_id, name, url, type, status,
                   check_interval_seconds, timeout_ms, max_retries, active,
                   last_checked_at, last_response_time_ms, last_status_code, last_error,
                   total_checks, successful_checks, failed_checks,
                   alert_on_down, alert_on_recovery, created_at, updated_at
            FROM monitors
            """;

    private final JdbcTemplate jdbcTemplate;

    public Monitor save(Monitor monitor) {
        String sql = """
            INSERT INTO monitors (
                monitor_id, user_id, name, url, type, status,
                check_interval_seconds, timeout_ms, max_retries, active,
                total_checks, successful_checks, failed_checks,
                alert_on_down, alert_on_recovery, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0, 0, 0, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
                monitor.getMonitorId(),
                monitor.getUserId(),
                monitor.getName(),
                monitor.getUrl(),
                monitor.getType().name(),
                monitor.getStatus().name(),
                monitor.getCheckIntervalSeconds(),
                monitor.getTimeoutMs(),
                monitor.getMaxRetries(),
                monitor.getActive(),
                monitor.getAlertOnDown(),
                monitor.getAlertOnRecovery(),
                Timestamp.from(monitor.getCreatedAt()),
                Timestamp.from(monitor.getUpdatedAt())
        );

        monitor.setTotalChecks(0L);
        monitor.setSuccessfulChecks(0L);
        monitor.setFailedChecks(0L);
        return monitor;
    }

    /**
     * Updates user-editable configuration; check counters are left alone.
     */
    public void update(Monitor monitor) {
        String sql = """
            UPDATE monitors
            SET name = ?,
                url = ?,
                type = ?,
                status = ?,
                check_interval_seconds = ?,
                timeout_ms = ?,
                max_retries = ?,
                active = ?,
                alert_on_down = ?,
                alert_on_recovery = ?,
                updated_at = ?
            WHERE monitor_id = ?
            """;

        jdbcTemplate.update(sql,
                monitor.getName(),
                monitor.getUrl(),
                monitor.getType().name(),
                monitor.getStatus().name(),
                monitor.getCheckIntervalSeconds(),
                monitor.getTimeoutMs(),
                monitor.getMaxRetries(),
                monitor.getActive(),
                monitor.getAlertOnDown(),
                monitor.getAlertOnRecovery(),
                Timestamp.from(monitor.getUpdatedAt()),
                monitor.getMonitorId()
        );
    }

    /**
     * Applies one check result atomically so concurrent workers never lose a counter update.
     */
    public void recordCheck(String monitorId, CheckResult result, MonitorStatus status) {
        String sql = """
            UPDATE monitors
            SET total_checks = total_checks + 1,
                successful_checks = successful_checks + ?,
                failed_checks = failed_checks + ?,
                status = ?,
                last_checked_at = ?,
                last_response_time_ms = ?,
                last_status_code = ?,
                last_error = ?
            WHERE monitor_id = ?
            """;

        int success = result.isSuccessful() ? 1 : 0;
        jdbcTemplate.update(sql,
                success,
                1 - success,
                status.name(),
                Timestamp.from(result.getCheckedAt()),
                result.getLatencyMs(),
                result.getStatusCode(),
                result.getError(),
                monitorId
        );
    }

    public Optional<Monitor> findById(String monitorId) {
        String sql = SELECT_COLUMNS + "WHERE monitor_id = ?";
        List<Monitor> results = jdbcTemplate.query(sql, new MonitorRowMapper(), monitorId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Monitor> findByUserId(String userId) {
        String sql = SELECT_COLUMNS + "WHERE user_id = ? ORDER BY created_at, monitor_id";
        return jdbcTemplate.query(sql, new MonitorRowMapper(), userId);
    }

    /**
     * Active monitors in creation order.
     */
    public List<Monitor> findAllActive() {
        String sql = SELECT_COLUMNS + "WHERE active = true ORDER BY created_at, monitor_id";
        return jdbcTemplate.query(sql, new MonitorRowMapper());
    }

    public boolean deleteById(String monitorId) {
        return jdbcTemplate.update("DELETE FROM monitors WHERE monitor_id = ?", monitorId) > 0;
    }

    private static class MonitorRowMapper implements RowMapper<Monitor> {
        @Override
        public Monitor mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Monitor.builder()
                    .monitorId(rs.getString("monitor_id"))
                    .userId(rs.getString("user_id"))
                    .name(rs.getString("name"))
                    .url(rs.getString("url"))
                    .type(MonitorType.valueOf(rs.getString("type")))
                    .status(MonitorStatus.fromString(rs.getString("status")))
                    .checkIntervalSeconds(rs.getInt("check_interval_seconds"))
                    .timeoutMs(rs.getInt("timeout_ms"))
                    .maxRetries(rs.getInt("max_retries"))
                    .active(rs.getBoolean("active"))
                    .lastCheckedAt(toInstant(rs.getTimestamp("last_checked_at")))
                    .lastResponseTimeMs(rs.getObject("last_response_time_ms", Long.class))
                    .lastStatusCode(rs.getObject("last_status_code", Integer.class))
                    .lastError(rs.getString("last_error"))
                    .totalChecks(rs.getLong("total_checks"))
                    .successfulChecks(rs.getLong("successful_checks"))
                    .failedChecks(rs.getLong("failed_checks"))
                    .alertOnDown(rs.getBoolean("alert_on_down"))
                    .alertOnRecovery(rs.getBoolean("alert_on_recovery"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .build();
        }

        private static Instant toInstant(Timestamp timestamp) {
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
