package com.company.uptime.service;

import com.company.uptime.config.UptimeProperties;
import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Domain;
import com.company.uptime.domain.Monitor;
import com.company.uptime.domain.Subject;
import com.company.uptime.domain.enums.AlertType;
import com.company.uptime.domain.enums.MonitorStatus;
import com.company.uptime.event.ThresholdCrossedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns check results into alerts. Only transitions raise an alert: a monitor going down or
 * recovering, a domain entering its expiry window or expiring.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertNotificationService {

    private final ApplicationEventPublisher eventPublisher;
    private final AlertSender alertSender;
    private final UptimeProperties properties;

    /**
     * @param previous the subject as it was before {@code result} was recorded
     */
    public void notifyIfThresholdCrossed(Subject previous, CheckResult result) {
        evaluate(previous, result).ifPresent(event -> {
            log.warn("{} for {}: {}", event.getAlertType(), event.getSubjectKey(), event.getMessage());
            eventPublisher.publishEvent(event);
        });
    }

    @EventListener
    @Async
    public void handleThresholdCrossed(ThresholdCrossedEvent event) {
        alertSender.send(event);
    }

    Optional<ThresholdCrossedEvent> evaluate(Subject previous, CheckResult result) {
        if (previous instanceof Monitor monitor) {
            return evaluateMonitor(monitor, result);
        }
        if (previous instanceof Domain domain) {
            return evaluateDomain(domain, result);
        }
        return Optional.empty();
    }

    private Optional<ThresholdCrossedEvent> evaluateMonitor(Monitor monitor, CheckResult result) {
        boolean wasDown = monitor.getStatus() == MonitorStatus.DOWN;

        if (!result.isSuccessful() && !wasDown && Boolean.TRUE.equals(monitor.getAlertOnDown())) {
            return Optional.of(event(monitor, AlertType.MONITOR_DOWN,
                    "Monitor " + monitor.getName() + " is down: " + result.getError(), result));
        }
        if (result.isSuccessful() && wasDown && Boolean.TRUE.equals(monitor.getAlertOnRecovery())) {
            return Optional.of(event(monitor, AlertType.MONITOR_RECOVERED,
                    "Monitor " + monitor.getName() + " recovered after " + result.getLatencyMs() + "ms", result));
        }
        return Optional.empty();
    }

    private Optional<ThresholdCrossedEvent> evaluateDomain(Domain domain, CheckResult result) {
        if (!result.isSuccessful() || result.getDaysUntilExpiry() == null
                || !Boolean.TRUE.equals(domain.getEnableExpiryAlerts())) {
            return Optional.empty();
        }

        int days = result.getDaysUntilExpiry();
        if (days < 0 && !Boolean.TRUE.equals(domain.getExpired())) {
            return Optional.of(event(domain, AlertType.DOMAIN_EXPIRED,
                    "Domain " + domain.getDomainName() + " expired " + (-days) + " days ago", result));
        }
        if (days >= 0 && days <= alertWindowOf(domain) && !Boolean.TRUE.equals(domain.getExpiringSoon())) {
            return Optional.of(event(domain, AlertType.DOMAIN_EXPIRING,
                    "Domain " + domain.getDomainName() + " expires in " + days + " days", result));
        }
        return Optional.empty();
    }

    int alertWindowOf(Domain domain) {
        return domain.getAlertDaysBefore() != null
                ? domain.getAlertDaysBefore()
                : properties.getScheduler().getExpiryAlertDays();
    }

    private static ThresholdCrossedEvent event(Subject subject, AlertType type, String message, CheckResult result) {
        return new ThresholdCrossedEvent(subject.getRef().key(), subject.getUserId(), type, message, result);
    }
}
