package com.company.uptime.domain.enums;

public enum CheckOutcome {
    SUCCESS,
    FAILURE,
    TIMEOUT;

    public boolean isSuccessful() {
        return this == SUCCESS;
    }
}
