package com.company.uptime.domain.enums;

/**
 * Scheduling lifecycle of a subject as derived from its queue.
 */
public enum ScheduleState {
    /** No queue, or a queue without its recurring registration. */
    UNSCHEDULED,
    /** Recurring registration present, nothing running. */
    SCHEDULED,
    /** A check job is currently active. */
    CHECKING
}
