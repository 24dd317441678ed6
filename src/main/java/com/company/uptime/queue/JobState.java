package com.company.uptime.queue;

public enum JobState {
    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED;

    public boolean isPending() {
        return this == WAITING || this == ACTIVE;
    }
}
