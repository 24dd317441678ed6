package com.company.uptime.domain;

import com.company.uptime.domain.enums.CheckOutcome;
import com.company.uptime.domain.enums.ProbeFailureReason;
import com.company.uptime.exception.ProbeException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of one probe against one subject. Immutable once built.
 */
@Value
@Builder(toBuilder = true)
public class CheckResult {
    String subjectKey;
    CheckOutcome outcome;
    long latencyMs;
    Integer statusCode;
    String error;
    ProbeFailureReason errorReason;
    Instant expiryDate;
    Integer daysUntilExpiry;
    String registrar;
    Instant checkedAt;

    public boolean isSuccessful() {
        return outcome != null && outcome.isSuccessful();
    }

    /**
     * Maps a probe error onto a result; timeouts keep their own outcome.
     */
    public static CheckResult fromProbeException(SubjectRef ref, ProbeException e, long latencyMs, Instant checkedAt) {
        return CheckResult.builder()
                .subjectKey(ref.key())
                .outcome(e.getReason() == ProbeFailureReason.TIMEOUT ? CheckOutcome.TIMEOUT : CheckOutcome.FAILURE)
                .latencyMs(latencyMs)
                .statusCode(e.getStatusCode())
                .error(e.getMessage())
                .errorReason(e.getReason())
                .checkedAt(checkedAt)
                .build();
    }

    public String summary() {
        StringBuilder sb = new StringBuilder(String.valueOf(outcome)).append(" in ").append(latencyMs).append("ms");
        if (statusCode != null) {
            sb.append(", status ").append(statusCode);
        }
        if (daysUntilExpiry != null) {
            sb.append(", ").append(daysUntilExpiry).append(" days until expiry");
        }
        if (error != null) {
            sb.append(": ").append(error);
        }
        return sb.toString();
    }
}
