package com.company.uptime.exception;

import com.company.uptime.domain.enums.ProbeFailureReason;
import lombok.Getter;

@Getter
public class ProbeException extends RuntimeException {

    private final ProbeFailureReason reason;
    private final Integer statusCode;

    public ProbeException(ProbeFailureReason reason, String message) {
        this(reason, message, null, null);
    }

    public ProbeException(ProbeFailureReason reason, String message, Throwable cause) {
        this(reason, message, null, cause);
    }

    public ProbeException(ProbeFailureReason reason, String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.statusCode = statusCode;
    }
}
