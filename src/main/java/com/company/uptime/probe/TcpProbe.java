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
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;

/**
 * TCP connect check; up when the handshake completes within the timeout.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TcpProbe implements Probe {

    private final Clock clock;

    @Override
    public boolean supports(Subject subject) {
        return subject instanceof Monitor monitor && monitor.getType() == MonitorType.TCP;
    }

    @Override
    public String kind() {
        return "tcp";
    }

    @Override
    public CheckResult probe(Subject subject) {
        Monitor monitor = (Monitor) subject;
        TargetAddress target = TargetAddress.parse(monitor.getUrl());
        if (target.getPort() == null) {
            throw new ProbeException(ProbeFailureReason.INVALID_TARGET, "TCP target needs a port: " + monitor.getUrl());
        }
        int timeoutMs = monitor.getTimeoutMs() != null ? monitor.getTimeoutMs() : 30000;

        long start = System.nanoTime();
        try (Socket socket = new Socket()) {
            InetSocketAddress address = new InetSocketAddress(target.getHost(), target.getPort());
            if (address.isUnresolved()) {
                throw new UnknownHostException(target.getHost());
            }
            socket.connect(address, timeoutMs);
            long latencyMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            log.debug("TCP check {}:{} connected in {}ms", target.getHost(), target.getPort(), latencyMs);

            return CheckResult.builder()
                    .subjectKey(monitor.getRef().key())
                    .outcome(CheckOutcome.SUCCESS)
                    .latencyMs(latencyMs)
                    .checkedAt(clock.instant())
                    .build();

        } catch (SocketTimeoutException e) {
            throw new ProbeException(ProbeFailureReason.TIMEOUT, "No connection within " + timeoutMs + "ms", e);
        } catch (UnknownHostException e) {
            throw new ProbeException(ProbeFailureReason.DNS_FAILURE, "Cannot resolve " + target.getHost(), e);
        } catch (ConnectException e) {
            throw new ProbeException(ProbeFailureReason.CONNECTION_REFUSED,
                    "Connection refused by " + target.getHost() + ":" + target.getPort(), e);
        } catch (IOException e) {
            throw new ProbeException(ProbeFailureReason.IO, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
