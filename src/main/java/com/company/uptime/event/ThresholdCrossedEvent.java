package com.company.uptime.event;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.enums.AlertType;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ThresholdCrossedEvent {
    private final String subjectKey;
    private final String userId;
    private final AlertType alertType;
    private final String message;
    private final CheckResult result;
}
