package com.company.uptime.probe;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Subject;

public interface Probe {

    boolean supports(Subject subject);

    CheckResult probe(Subject subject);

    /** Tag value for probe metrics. */
    String kind();
}
