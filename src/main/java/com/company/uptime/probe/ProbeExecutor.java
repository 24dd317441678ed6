package com.company.uptime.probe;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Subject;

/**
 * Runs one check against one subject. Stateless, knows nothing about scheduling.
 */
public interface ProbeExecutor {

    /**
     * @throws com.company.uptime.exception.ProbeException when the target cannot be checked
     */
    CheckResult execute(Subject subject);
}
