package com.company.uptime.queue;

public enum JobKind {
    SINGLE_CHECK("single-check"),
    BULK_CHECK("bulk-check"),
    USER_CHECK("check-user-domains"),
    RECURRING_CHECK("recurring-check");

    private final String value;

    JobKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
