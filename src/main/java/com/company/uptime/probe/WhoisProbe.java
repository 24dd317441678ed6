package com.company.uptime.probe;

import com.company.uptime.config.UptimeProperties;
import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Domain;
import com.company.uptime.domain.Subject;
import com.company.uptime.domain.enums.CheckOutcome;
import com.company.uptime.domain.enums.ProbeFailureReason;
import com.company.uptime.exception.ProbeException;
import com.company.uptime.pacing.Pacer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Domain expiry through WHOIS. Every lookup is preceded by a random pause, because registrars
 * rate-limit individual queries and not only bursts.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WhoisProbe implements Probe {

    private static final double MILLIS_PER_DAY = 86_400_000d;

    private final WhoisClient whoisClient;
    private final WhoisExpiryParser parser;
    private final Pacer pacer;
    private final UptimeProperties properties;
    private final Clock clock;

    @Override
    public boolean supports(Subject subject) {
        return subject instanceof Domain;
    }

    @Override
    public String kind() {
        return "whois";
    }

    @Override
    public CheckResult probe(Subject subject) {
        Domain domain = (Domain) subject;
        UptimeProperties.Whois whois = properties.getWhois();

        pacer.jitter(whois.getJitterMinMs(), whois.getJitterMaxMs());

        long start = System.nanoTime();
        String response = whoisClient.lookup(domain.getDomainName());
        long latencyMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        WhoisRecord parsed = parser.parse(response)
                .orElseThrow(() -> new ProbeException(ProbeFailureReason.WHOIS_PARSE,
                        "No expiry date in WHOIS response for " + domain.getDomainName()));

        Instant now = clock.instant();
        int daysUntilExpiry = daysUntil(parsed.getExpiryDate(), now);

        log.debug("WHOIS {} expires {} ({} days)", domain.getDomainName(), parsed.getExpiryDate(), daysUntilExpiry);

        return CheckResult.builder()
                .subjectKey(domain.getRef().key())
                .outcome(CheckOutcome.SUCCESS)
                .latencyMs(latencyMs)
                .expiryDate(parsed.getExpiryDate())
                .daysUntilExpiry(daysUntilExpiry)
                .registrar(parsed.getRegistrar())
                .checkedAt(now)
                .build();
    }

    /**
     * Whole days left, rounded up: anything less than a day still counts as one.
     */
    static int daysUntil(Instant expiry, Instant now) {
        return (int) Math.ceil((expiry.toEpochMilli() - now.toEpochMilli()) / MILLIS_PER_DAY);
    }
}
