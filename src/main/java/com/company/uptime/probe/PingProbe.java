package com.company.uptime.probe;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Monitor;
import com.company.uptime.domain.Subject;
import com.company.uptime.domain.enums.CheckOutcome;
import com.company.uptime.domain.enums.MonitorType;
import com.company.uptime.domain.enums.ProbeFailureReason;
import com.company.uptime.exception.ProbeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;

/**
 * Reachability check through {@link InetAddress#isReachable}: ICMP echo when the process may
 * send it, otherwise a TCP echo attempt. No reply within the timeout is a TIMEOUT.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PingProbe implements Probe {

    private final Clock clock;

    @Override
    public boolean supports(Subject subject) {
        return subject instanceof Monitor monitor && monitor.getType() == MonitorType.PING;
    }

    @Override
    public String kind() {
        return "ping";
    }

    @Override
    public CheckResult probe(Subject subject) {
        Monitor monitor = (Monitor) subject;
        String host = TargetAddress.parse(monitor.getUrl()).getHost();
        int timeoutMs = monitor.getTimeoutMs() != null ? monitor.getTimeoutMs() : 30000;

        long start = System.nanoTime();
        try {
            InetAddress address = InetAddress.getByName(host);
            boolean reachable = address.isReachable(timeoutMs);
            long latencyMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            if (!reachable) {
                throw new ProbeException(ProbeFailureReason.TIMEOUT, "No echo reply from " + host + " within " + timeoutMs + "ms");
            }

            log.debug("Ping {} answered in {}ms", host, latencyMs);

            return CheckResult.builder()
                    .subjectKey(monitor.getRef().key())
                    .outcome(CheckOutcome.SUCCESS)
                    .latencyMs(latencyMs)
                    .checkedAt(clock.instant())
                    .build();

        } catch (UnknownHostException e) {
            throw new ProbeException(ProbeFailureReason.DNS_FAILURE, "Cannot resolve " + host, e);
        } catch (IOException e) {
            throw new ProbeException(ProbeFailureReason.IO, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
