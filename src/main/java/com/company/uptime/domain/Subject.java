package com.company.uptime.domain;

import java.time.Instant;

/**
 * Something checked on a schedule: a {@link Monitor} or a {@link Domain}.
 */
public interface Subject {

    SubjectRef getRef();

    String getUserId();

    Integer getCheckIntervalSeconds();

    Boolean getActive();

    Instant getLastCheckedAt();

    Instant getCreatedAt();

    default boolean isEnabled() {
        return Boolean.TRUE.equals(getActive());
    }

    /**
     * Due when never checked, or when the last check is older than one interval.
     */
    default boolean isDue(Instant now) {
        Instant lastCheckedAt = getLastCheckedAt();
        if (lastCheckedAt == null) {
            return true;
        }
        Integer interval = getCheckIntervalSeconds();
        return interval == null || lastCheckedAt.plusSeconds(interval).isBefore(now);
    }
}
