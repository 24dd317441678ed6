package com.company.uptime.domain;

import com.company.uptime.domain.enums.SubjectType;
import lombok.Value;

import java.util.Locale;

/**
 * Identity of a checked subject. The key doubles as the name of the subject's job queue.
 */
@Value
public class SubjectRef implements Comparable<SubjectRef> {

    SubjectType type;
    String id;

    public static SubjectRef monitor(String monitorId) {
        return new SubjectRef(SubjectType.MONITOR, monitorId);
    }

    public static SubjectRef domain(String domainName) {
        return new SubjectRef(SubjectType.DOMAIN, normalizeDomain(domainName));
    }

    public static SubjectRef of(SubjectType type, String id) {
        return type == SubjectType.DOMAIN ? domain(id) : monitor(id);
    }

    /**
     * Parses a key of the form {@code monitor:<id>} or {@code domain:<name>}.
     */
    public static SubjectRef parse(String key) {
        int separator = key == null ? -1 : key.indexOf(':');
        if (separator <= 0 || separator == key.length() - 1) {
            throw new IllegalArgumentException("Malformed subject key: " + key);
        }
        return of(SubjectType.fromPrefix(key.substring(0, separator)), key.substring(separator + 1));
    }

    public static String normalizeDomain(String domainName) {
        return domainName == null ? null : domainName.trim().toLowerCase(Locale.ROOT);
    }

    public String key() {
        return type.getPrefix() + ":" + id;
    }

    /**
     * Job key of the subject's recurring check, e.g. {@code monitor-42} or
     * {@code domain-expiry-example.com}.
     */
    public String recurringJobKey() {
        return type.getJobKeyPrefix() + id;
    }

    @Override
    public int compareTo(SubjectRef other) {
        return key().compareTo(other.key());
    }

    @Override
    public String toString() {
        return key();
    }
}
