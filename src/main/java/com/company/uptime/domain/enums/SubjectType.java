package com.company.uptime.domain.enums;

public enum SubjectType {
    MONITOR("monitor", "monitor-"),
    DOMAIN("domain", "domain-expiry-");

    private final String prefix;
    private final String jobKeyPrefix;

    SubjectType(String prefix, String jobKeyPrefix) {
        this.prefix = prefix;
        this.jobKeyPrefix = jobKeyPrefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getJobKeyPrefix() {
        return jobKeyPrefix;
    }

    public static SubjectType fromPrefix(String value) {
        for (SubjectType type : values()) {
            if (type.prefix.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown subject type: " + value);
    }
}
