package com.company.uptime.probe;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Monitor;
import com.company.uptime.domain.enums.CheckOutcome;
import com.company.uptime.domain.enums.MonitorType;
import com.company.uptime.domain.enums.ProbeFailureReason;
import com.company.uptime.exception.ProbeException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompositeProbeExecutorTest {

    @Mock
    private Probe httpProbe;

    @Mock
    private Probe tcpProbe;

    private SimpleMeterRegistry meterRegistry;
    private CompositeProbeExecutor executor;

    private final Monitor monitor = Monitor.builder()
            .monitorId("42")
            .type(MonitorType.TCP)
            .url("db.internal:5432")
            .build();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        executor = new CompositeProbeExecutor(List.of(httpProbe, tcpProbe), meterRegistry);
        lenient().when(tcpProbe.kind()).thenReturn("tcp");
    }

    @Test
    @DisplayName("should route to the first probe that supports the subject")
    void shouldRouteToSupportingProbe() {
        CheckResult up = CheckResult.builder().subjectKey("monitor:42").outcome(CheckOutcome.SUCCESS).build();
        when(httpProbe.supports(monitor)).thenReturn(false);
        when(tcpProbe.supports(monitor)).thenReturn(true);
        when(tcpProbe.probe(monitor)).thenReturn(up);

        assertThat(executor.execute(monitor)).isSameAs(up);

        verify(httpProbe, never()).probe(monitor);
        assertThat(meterRegistry.timer("probe.duration", "kind", "tcp", "outcome", "success").count())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("should time failed probes under their failure reason")
    void shouldRecordFailureReason() {
        when(httpProbe.supports(monitor)).thenReturn(false);
        when(tcpProbe.supports(monitor)).thenReturn(true);
        when(tcpProbe.probe(monitor))
                .thenThrow(new ProbeException(ProbeFailureReason.CONNECTION_REFUSED, "refused"));

        assertThatThrownBy(() -> executor.execute(monitor)).isInstanceOf(ProbeException.class);

        assertThat(meterRegistry.timer("probe.duration", "kind", "tcp", "outcome", "connection_refused").count())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("should reject a subject no probe supports")
    void shouldRejectUnsupportedSubject() {
        when(httpProbe.supports(monitor)).thenReturn(false);
        when(tcpProbe.supports(monitor)).thenReturn(false);

        assertThatThrownBy(() -> executor.execute(monitor))
                .isInstanceOf(ProbeException.class)
                .extracting(e -> ((ProbeException) e).getReason())
                .isEqualTo(ProbeFailureReason.UNSUPPORTED);
    }
}
