package com.company.uptime.service;

import com.company.uptime.config.UptimeProperties;
import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Domain;
import com.company.uptime.domain.Monitor;
import com.company.uptime.domain.enums.AlertType;
import com.company.uptime.domain.enums.CheckOutcome;
import com.company.uptime.domain.enums.MonitorStatus;
import com.company.uptime.event.ThresholdCrossedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AlertNotificationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private AlertSender alertSender;

    private UptimeProperties properties;
    private AlertNotificationService service;

    @BeforeEach
    void setUp() {
        properties = new UptimeProperties();
        service = new AlertNotificationService(eventPublisher, alertSender, properties);
    }

    private static CheckResult result(CheckOutcome outcome, Integer daysUntilExpiry) {
        return CheckResult.builder()
                .outcome(outcome)
                .daysUntilExpiry(daysUntilExpiry)
                .latencyMs(120)
                .error(outcome == CheckOutcome.SUCCESS ? null : "Connection refused")
                .checkedAt(NOW)
                .build();
    }

    // ========================================================================
    // Monitors
    // ========================================================================

    @Nested
    @DisplayName("Monitors")
    class MonitorTests {

        private Monitor monitor(MonitorStatus status) {
            return Monitor.builder()
                    .monitorId("42")
                    .userId("user-1")
                    .name("API")
                    .status(status)
                    .alertOnDown(true)
                    .alertOnRecovery(true)
                    .build();
        }

        @Test
        @DisplayName("should publish a down alert when a monitor goes down")
        void shouldAlertOnDown() {
            service.notifyIfThresholdCrossed(monitor(MonitorStatus.UP), result(CheckOutcome.FAILURE, null));

            ArgumentCaptor<ThresholdCrossedEvent> published = ArgumentCaptor.forClass(ThresholdCrossedEvent.class);
            verify(eventPublisher).publishEvent(published.capture());
            assertThat(published.getValue().getAlertType()).isEqualTo(AlertType.MONITOR_DOWN);
            assertThat(published.getValue().getSubjectKey()).isEqualTo("monitor:42");
            assertThat(published.getValue().getUserId()).isEqualTo("user-1");
            assertThat(published.getValue().getMessage()).contains("Connection refused");
        }

        @Test
        @DisplayName("should not repeat the down alert while the monitor stays down")
        void shouldNotRepeatDownAlert() {
            service.notifyIfThresholdCrossed(monitor(MonitorStatus.DOWN), result(CheckOutcome.TIMEOUT, null));

            verify(eventPublisher, never()).publishEvent(any(Object.class));
        }

        @Test
        @DisplayName("should publish a recovery alert when a down monitor comes back")
        void shouldAlertOnRecovery() {
            Optional<ThresholdCrossedEvent> event =
                    service.evaluate(monitor(MonitorStatus.DOWN), result(CheckOutcome.SUCCESS, null));

            assertThat(event).map(ThresholdCrossedEvent::getAlertType).contains(AlertType.MONITOR_RECOVERED);
        }

        @Test
        @DisplayName("should stay silent when down alerts are disabled")
        void shouldRespectAlertToggle() {
            Monitor quiet = monitor(MonitorStatus.UP).toBuilder().alertOnDown(false).build();

            assertThat(service.evaluate(quiet, result(CheckOutcome.FAILURE, null))).isEmpty();
        }

        @Test
        @DisplayName("should hand published events to the alert sender")
        void shouldDispatchEvent() {
            ThresholdCrossedEvent event = new ThresholdCrossedEvent("monitor:42", "user-1",
                    AlertType.MONITOR_DOWN, "down", result(CheckOutcome.FAILURE, null));

            service.handleThresholdCrossed(event);

            verify(alertSender).send(event);
        }
    }

    // ========================================================================
    // Domains
    // ========================================================================

    @Nested
    @DisplayName("Domains")
    class DomainTests {

        private Domain domain() {
            return Domain.builder()
                    .domainName("example.com")
                    .userId("user-1")
                    .enableExpiryAlerts(true)
                    .alertDaysBefore(14)
                    .expired(false)
                    .expiringSoon(false)
                    .build();
        }

        @Test
        @DisplayName("should alert when a domain enters its expiry window")
        void shouldAlertWhenExpiring() {
            Optional<ThresholdCrossedEvent> event = service.evaluate(domain(), result(CheckOutcome.SUCCESS, 10));

            assertThat(event).map(ThresholdCrossedEvent::getAlertType).contains(AlertType.DOMAIN_EXPIRING);
            assertThat(event.get().getMessage()).contains("expires in 10 days");
        }

        @Test
        @DisplayName("should not alert outside the domain's own window")
        void shouldNotAlertOutsideWindow() {
            assertThat(service.evaluate(domain(), result(CheckOutcome.SUCCESS, 20))).isEmpty();
        }

        @Test
        @DisplayName("should alert once when a domain expires")
        void shouldAlertWhenExpired() {
            Optional<ThresholdCrossedEvent> first = service.evaluate(domain(), result(CheckOutcome.SUCCESS, -1));
            Optional<ThresholdCrossedEvent> again = service.evaluate(domain().toBuilder().expired(true).build(),
                    result(CheckOutcome.SUCCESS, -2));

            assertThat(first).map(ThresholdCrossedEvent::getAlertType).contains(AlertType.DOMAIN_EXPIRED);
            assertThat(again).isEmpty();
        }

        @Test
        @DisplayName("should not alert again while already expiring soon")
        void shouldNotRepeatExpiringAlert() {
            Domain flagged = domain().toBuilder().expiringSoon(true).build();

            assertThat(service.evaluate(flagged, result(CheckOutcome.SUCCESS, 5))).isEmpty();
        }

        @Test
        @DisplayName("should ignore failed lookups and disabled alerts")
        void shouldIgnoreFailuresAndDisabledAlerts() {
            assertThat(service.evaluate(domain(), result(CheckOutcome.FAILURE, null))).isEmpty();
            assertThat(service.evaluate(domain().toBuilder().enableExpiryAlerts(false).build(),
                    result(CheckOutcome.SUCCESS, 3))).isEmpty();
        }

        @Test
        @DisplayName("should default the window from configuration")
        void shouldDefaultAlertWindow() {
            properties.getScheduler().setExpiryAlertDays(45);

            assertThat(service.alertWindowOf(domain().toBuilder().alertDaysBefore(null).build())).isEqualTo(45);
        }
    }
}
