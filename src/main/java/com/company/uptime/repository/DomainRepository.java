package com.company.uptime.repository;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Domain;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
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
public class DomainRepository {

    private static final String SELECT_COLUMNS = """
            SELECT domain_name, user_id, check_interval_seconds, active,
                   last_checked_at, last_expiry_date, last_days_until_expiry, registrar, last_error,
                   expired, expiring_soon, total_checks, successful_checks, failed_checks,
                   enable_expiry_alerts, alert_days_before, created_at, updated_at
            FROM domains
            """;

    private final JdbcTemplate jdbcTemplate;

    /**
     * @throws DuplicateKeyException if the domain is already tracked
     */
    public Domain save(Domain domain) throws DuplicateKeyException {
        String sql = """
            INSERT INTO domains (
                domain_name, user_id, check_interval_seconds, active,
                expired, expiring_soon, total_checks, successful_checks, failed_checks,
                enable_expiry_alerts, alert_days_before, created_at, updated_at
            ) VALUES (?, ?, ?, ?, false, false, 0, 0, 0, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
                domain.getDomainName(),
                domain.getUserId(),
                domain.getCheckIntervalSeconds(),
                domain.getActive(),
                domain.getEnableExpiryAlerts(),
                domain.getAlertDaysBefore(),
                Timestamp.from(domain.getCreatedAt()),
                Timestamp.from(domain.getUpdatedAt())
        );

        domain.setExpired(false);
        domain.setExpiringSoon(false);
        domain.setTotalChecks(0L);
        domain.setSuccessfulChecks(0L);
        domain.setFailedChecks(0L);
        return domain;
    }

    public void update(Domain domain) {
        String sql = """
            UPDATE domains
            SET check_interval_seconds = ?,
                active = ?,
                enable_expiry_alerts = ?,
                alert_days_before = ?,
                updated_at = ?
            WHERE domain_name = ?
            """;

        jdbcTemplate.update(sql,
                domain.getCheckIntervalSeconds(),
                domain.getActive(),
                domain.getEnableExpiryAlerts(),
                domain.getAlertDaysBefore(),
                Timestamp.from(domain.getUpdatedAt()),
                domain.getDomainName()
        );
    }

    /**
     * Applies one WHOIS result. A failed lookup keeps the last known expiry data and only
     * records the error.
     */
    public void recordCheck(String domainName, CheckResult result, boolean expired, boolean expiringSoon) {
        if (!result.isSuccessful()) {
            String sql = """
                UPDATE domains
                SET total_checks = total_checks + 1,
                    failed_checks = failed_checks + 1,
                    last_checked_at = ?,
                    last_error = ?
                WHERE domain_name = ?
                """;
            jdbcTemplate.update(sql, Timestamp.from(result.getCheckedAt()), result.getError(), domainName);
            return;
        }

        String sql = """
            UPDATE domains
            SET total_checks = total_checks + 1,
                successful_checks = successful_checks + 1,
                last_checked_at = ?,
                last_expiry_date = ?,
                last_days_until_expiry = ?,
                registrar = COALESCE(?, registrar),
                last_error = NULL,
                expired = ?,
                expiring_soon = ?
            WHERE domain_name = ?
            """;

        jdbcTemplate.update(sql,
                Timestamp.from(result.getCheckedAt()),
                result.getExpiryDate() != null ? Timestamp.from(result.getExpiryDate()) : null,
                result.getDaysUntilExpiry(),
                result.getRegistrar(),
                expired,
                expiringSoon,
                domainName
        );
    }

    public Optional<Domain> findByName(String domainName) {
        String sql = SELECT_COLUMNS + "WHERE domain_name = ?";
        List<Domain> results = jdbcTemplate.query(sql, new DomainRowMapper(), domainName);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Domain> findByUserId(String userId) {
        String sql = SELECT_COLUMNS + "WHERE user_id = ? ORDER BY created_at, domain_name";
        return jdbcTemplate.query(sql, new DomainRowMapper(), userId);
    }

    /**
     * Active domains of one user with expiry alerts on that are flagged as expiring soon or
     * have between 0 and {@code days} days left, soonest first.
     */
    public List<Domain> findExpiring(String userId, int days) {
        String sql = SELECT_COLUMNS + """
            WHERE user_id = ?
              AND active = true
              AND enable_expiry_alerts = true
              AND (expiring_soon = true OR last_days_until_expiry BETWEEN 0 AND ?)
            ORDER BY last_days_until_expiry NULLS LAST, domain_name
            """;
        return jdbcTemplate.query(sql, new DomainRowMapper(), userId, days);
    }

    /**
     * Active domains in creation order.
     */
    public List<Domain> findAllActive() {
        String sql = SELECT_COLUMNS + "WHERE active = true ORDER BY created_at, domain_name";
        return jdbcTemplate.query(sql, new DomainRowMapper());
    }

    public boolean deleteByName(String domainName) {
        return jdbcTemplate.update("DELETE FROM domains WHERE domain_name = ?", domainName) > 0;
    }

    private static class DomainRowMapper implements RowMapper<Domain> {
        @Override
        public Domain mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Domain.builder()
                    .domainName(rs.getString("domain_name"))
                    .userId(rs.getString("user_id"))
                    .checkIntervalSeconds(rs.getInt("check_interval_seconds"))
                    .active(rs.getBoolean("active"))
                    .lastCheckedAt(toInstant(rs.getTimestamp("last_checked_at")))
                    .lastExpiryDate(toInstant(rs.getTimestamp("last_expiry_date")))
                    .lastDaysUntilExpiry(rs.getObject("last_days_until_expiry", Integer.class))
                    .registrar(rs.getString("registrar"))
                    .lastError(rs.getString("last_error"))
                    .expired(rs.getBoolean("expired"))
                    .expiringSoon(rs.getBoolean("expiring_soon"))
                    .totalChecks(rs.getLong("total_checks"))
                    .successfulChecks(rs.getLong("successful_checks"))
                    .failedChecks(rs.getLong("failed_checks"))
                    .enableExpiryAlerts(rs.getBoolean("enable_expiry_alerts"))
                    .alertDaysBefore(rs.getInt("alert_days_before"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .build();
        }

        private static Instant toInstant(Timestamp timestamp) {
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
