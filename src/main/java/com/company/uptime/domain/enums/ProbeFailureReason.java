package com.company.uptime.domain.enums;

public enum ProbeFailureReason {
    TIMEOUT,
    CONNECTION_REFUSED,
    DNS_FAILURE,
    INVALID_TARGET,
    WHOIS_LOOKUP,
    WHOIS_PARSE,
    UNSUPPORTED,
    IO
}
