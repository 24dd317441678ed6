package com.company.uptime.service;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.SubjectRef;

/**
 * Receives every probe outcome.
 */
public interface ResultSink {
    void recordResult(SubjectRef ref, CheckResult result);
}
