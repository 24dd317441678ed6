package com.company.uptime.service;

import com.company.uptime.event.ThresholdCrossedEvent;
import com.company.uptime.exception.AlertSendException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Emits threshold alerts as trace spans; the collector forwards them to the alerting backend.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TelemetryAlertSender implements AlertSender {

    private final Tracer tracer;
    private final MeterRegistry meterRegistry;

    @Override
    @Retry(name = "alertDispatch", fallbackMethod = "sendFallback")
    @CircuitBreaker(name = "alertDispatch", fallbackMethod = "sendFallback")
    public void send(ThresholdCrossedEvent event) {
        Span span = tracer.spanBuilder("subject.threshold.alert")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("subject.key", event.getSubjectKey());
            span.setAttribute("user.id", event.getUserId() != null ? event.getUserId() : "");
            span.setAttribute("alert.type", event.getAlertType().name());

            span.addEvent("Threshold crossed",
                    Attributes.of(
                            AttributeKey.stringKey("message"), event.getMessage(),
                            AttributeKey.stringKey("outcome"), String.valueOf(event.getResult().getOutcome()),
                            AttributeKey.longKey("latency_ms"), event.getResult().getLatencyMs()
                    ));

            meterRegistry.counter("alerts.sent", "type", event.getAlertType().name()).increment();
            log.info("{} alert sent for {}", event.getAlertType(), event.getSubjectKey());

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to send alert");
            throw new AlertSendException("Failed to send alert for " + event.getSubjectKey(), e);
        } finally {
            span.end();
        }
    }

    void sendFallback(ThresholdCrossedEvent event, Exception e) {
        log.error("Alert backend unavailable, dropping {} alert for {}: {}",
                event.getAlertType(), event.getSubjectKey(), e.getMessage());

        meterRegistry.counter("alerts.failed", "type", event.getAlertType().name()).increment();
    }
}
