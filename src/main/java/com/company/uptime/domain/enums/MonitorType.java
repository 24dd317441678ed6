package com.company.uptime.domain.enums;

public enum MonitorType {
    HTTP,
    HTTPS,
    TCP,
    PING;

    public boolean isHttp() {
        return this == HTTP || this == HTTPS;
    }
}
