package com.company.uptime.probe;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Monitor;
import com.company.uptime.domain.Subject;
import com.company.uptime.domain.enums.CheckOutcome;
import com.company.uptime.domain.enums.MonitorType;
import com.company.uptime.domain.enums.ProbeFailureReason;
import com.company.uptime.exception.ProbeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Clock;
import java.time.Duration;

/**
 * HTTP/HTTPS GET. Any status below 400 counts as up; redirects are followed.
 */
@Component
@Slf4j
public class HttpProbe implements Probe {

    private static final String USER_AGENT = "UptimeScheduler/1.0 (+uptime check)";

    private final Clock clock;
    private final HttpClient httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(10))
            .build();

    public HttpProbe(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean supports(Subject subject) {
        return subject instanceof Monitor monitor && monitor.getType() != null && monitor.getType().isHttp();
    }

    @Override
    public String kind() {
        return "http";
    }

    @Override
    public CheckResult probe(Subject subject) {
        Monitor monitor = (Monitor) subject;
        Duration timeout = Duration.ofMillis(monitor.getTimeoutMs() != null ? monitor.getTimeoutMs() : 30000);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(targetUri(monitor))
                    .timeout(timeout)
                    .header("User-Agent", USER_AGENT)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ProbeException(ProbeFailureReason.INVALID_TARGET, "Invalid URL: " + monitor.getUrl(), e);
        }

        long start = System.nanoTime();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            long latencyMs = elapsedMillis(start);
            int status = response.statusCode();
            boolean up = status < 400;

            log.debug("HTTP check {} -> {} in {}ms", monitor.getUrl(), status, latencyMs);

            return CheckResult.builder()
                    .subjectKey(monitor.getRef().key())
                    .outcome(up ? CheckOutcome.SUCCESS : CheckOutcome.FAILURE)
                    .latencyMs(latencyMs)
                    .statusCode(status)
                    .error(up ? null : "HTTP " + status)
                    .checkedAt(clock.instant())
                    .build();

        } catch (HttpTimeoutException e) {
            throw new ProbeException(ProbeFailureReason.TIMEOUT,
                    "No response within " + timeout.toMillis() + "ms", e);
        } catch (ConnectException e) {
            if (e.getCause() instanceof UnresolvedAddressException) {
                throw new ProbeException(ProbeFailureReason.DNS_FAILURE, "Cannot resolve " + request.uri().getHost(), e);
            }
            throw new ProbeException(ProbeFailureReason.CONNECTION_REFUSED,
                    "Connection refused by " + request.uri().getHost(), e);
        } catch (UnknownHostException e) {
            throw new ProbeException(ProbeFailureReason.DNS_FAILURE, "Cannot resolve " + request.uri().getHost(), e);
        } catch (IOException e) {
            throw new ProbeException(ProbeFailureReason.IO, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProbeException(ProbeFailureReason.IO, "Interrupted during HTTP check", e);
        }
    }

    private static URI targetUri(Monitor monitor) {
        String url = monitor.getUrl().trim();
        if (!url.contains("://")) {
            url = (monitor.getType() == MonitorType.HTTPS ? "https://" : "http://") + url;
        }
        return URI.create(url);
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
