package com.company.uptime.domain.enums;

public enum AlertType {
    MONITOR_DOWN,
    MONITOR_RECOVERED,
    DOMAIN_EXPIRING,
    DOMAIN_EXPIRED
}
