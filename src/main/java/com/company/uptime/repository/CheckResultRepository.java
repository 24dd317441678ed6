package com.company.uptime.repository;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.enums.CheckOutcome;
import com.company.uptime.domain.enums.ProbeFailureReason;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;

/**
 * Append-only log of check results.
 */
@Repository
@RequiredArgsConstructor
public class CheckResultRepository {

    private final JdbcTemplate jdbcTemplate;

    public void append(CheckResult result) {
        String sql = """
            INSERT INTO check_results (
                subject_key, outcome, latency_ms, status_code, error, error_reason,
                expiry_date, days_until_expiry, checked_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
                result.getSubjectKey(),
                result.getOutcome().name(),
                result.getLatencyMs(),
                result.getStatusCode(),
                result.getError(),
                result.getErrorReason() != null ? result.getErrorReason().name() : null,
                result.getExpiryDate() != null ? Timestamp.from(result.getExpiryDate()) : null,
                result.getDaysUntilExpiry(),
                Timestamp.from(result.getCheckedAt())
        );
    }

    public List<CheckResult> findRecent(String subjectKey, int limit) {
        String sql = """
            SELECT subject_key, outcome, latency_ms, status_code, error, error_reason,
                   expiry_date, days_until_expiry, checked_at
            FROM check_results
            WHERE subject_key = ?
            ORDER BY checked_at DESC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, new CheckResultRowMapper(), subjectKey, limit);
    }

    public int deleteBySubject(String subjectKey) {
        return jdbcTemplate.update("DELETE FROM check_results WHERE subject_key = ?", subjectKey);
    }

    private static class CheckResultRowMapper implements RowMapper<CheckResult> {
        @Override
        public CheckResult mapRow(ResultSet rs, int rowNum) throws SQLException {
            String reason = rs.getString("error_reason");
            Timestamp expiry = rs.getTimestamp("expiry_date");
            return CheckResult.builder()
                    .subjectKey(rs.getString("subject_key"))
                    .outcome(CheckOutcome.valueOf(rs.getString("outcome")))
                    .latencyMs(rs.getLong("latency_ms"))
                    .statusCode(rs.getObject("status_code", Integer.class))
                    .error(rs.getString("error"))
                    .errorReason(reason != null ? ProbeFailureReason.valueOf(reason) : null)
                    .expiryDate(expiry != null ? expiry.toInstant() : null)
                    .daysUntilExpiry(rs.getObject("days_until_expiry", Integer.class))
                    .checkedAt(rs.getTimestamp("checked_at").toInstant())
                    .build();
        }
    }
}
