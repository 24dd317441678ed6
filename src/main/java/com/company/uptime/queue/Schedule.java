package com.company.uptime.queue;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * When a repeating registration fires: a fixed period or a cron expression (evaluated in UTC).
 * Five-field expressions are accepted and get a leading seconds field of {@code 0}.
 */
@Getter
@EqualsAndHashCode
public final class Schedule {

    public enum Type {
        EVERY,
        CRON
    }

    private final Type type;
    private final Long everyMillis;
    private final String cron;

    @JsonCreator
    private Schedule(@JsonProperty("type") Type type,
                     @JsonProperty("everyMillis") Long everyMillis,
                     @JsonProperty("cron") String cron) {
        this.type = type;
        this.everyMillis = everyMillis;
        this.cron = cron;
    }

    public static Schedule every(Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Schedule period must be positive: " + period);
        }
        return new Schedule(Type.EVERY, period.toMillis(), null);
    }

    public static Schedule everySeconds(long seconds) {
        return every(Duration.ofSeconds(seconds));
    }

    public static Schedule cron(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression must not be blank");
        }
        String normalized = expression.trim().replaceAll("\\s+", " ");
        if (normalized.split(" ").length == 5) {
            normalized = "0 " + normalized;
        }
        // Fails fast with IllegalArgumentException on a bad expression
        CronExpression.parse(normalized);
        return new Schedule(Type.CRON, null, normalized);
    }

    /**
     * First fire instant strictly after {@code instant}, or {@code null} if a cron
     * expression never fires again.
     */
    public Instant nextFireAfter(Instant instant) {
        if (type == Type.EVERY) {
            return instant.plusMillis(everyMillis);
        }
        ZonedDateTime next = CronExpression.parse(cron).next(instant.atZone(ZoneOffset.UTC));
        return next != null ? next.toInstant() : null;
    }

    /**
     * Next fire instant after {@code now} counted from a fire instant that has already passed.
     * Missed fires collapse into one.
     */
    public Instant advance(Instant firedAt, Instant now) {
        if (type == Type.EVERY) {
            long missed = (now.toEpochMilli() - firedAt.toEpochMilli()) / everyMillis + 1;
            return firedAt.plusMillis(missed * everyMillis);
        }
        Instant next = nextFireAfter(firedAt);
        while (next != null && !next.isAfter(now)) {
            next = nextFireAfter(next);
        }
        return next;
    }

    /** Fixed period, or {@code null} for cron schedules. */
    public Duration interval() {
        return type == Type.EVERY ? Duration.ofMillis(everyMillis) : null;
    }

    @Override
    public String toString() {
        return type == Type.EVERY ? "every " + everyMillis / 1000 + "s" : "cron " + cron;
    }
}
