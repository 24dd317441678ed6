package com.company.uptime.queue;

import com.company.uptime.domain.CheckResult;

/**
 * Handles jobs taken from a queue. A thrown exception fails the attempt.
 */
@FunctionalInterface
public interface Processor {
    CheckResult handle(Job job) throws Exception;
}
