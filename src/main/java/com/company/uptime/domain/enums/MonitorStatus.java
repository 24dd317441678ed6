package com.company.uptime.domain.enums;

public enum MonitorStatus {
    UP("Last check succeeded"),
    DOWN("Last check failed or timed out"),
    PENDING("No check has completed yet"),
    PAUSED("Monitoring is disabled");

    private final String description;

    MonitorStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static MonitorStatus fromString(String status) {
        if (status == null) {
            return PENDING;
        }
        try {
            return MonitorStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }
}
