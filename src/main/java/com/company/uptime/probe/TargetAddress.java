package com.company.uptime.probe;

import com.company.uptime.domain.enums.ProbeFailureReason;
import com.company.uptime.exception.ProbeException;
import lombok.Value;

/**
 * Host and optional port taken from a monitor target such as {@code tcp://db.internal:5432},
 * {@code db.internal:5432} or {@code example.com}.
 */
@Value
class TargetAddress {
    String host;
    Integer port;

    static TargetAddress parse(String target) {
        if (target == null || target.isBlank()) {
            throw new ProbeException(ProbeFailureReason.INVALID_TARGET, "Empty target");
        }
        String value = target.trim();
        int scheme = value.indexOf("://");
        if (scheme >= 0) {
            value = value.substring(scheme + 3);
        }
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }

        int colon = value.lastIndexOf(':');
        if (colon < 0) {
            return new TargetAddress(value, null);
        }
        int port;
        try {
            port = Integer.parseInt(value.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new ProbeException(ProbeFailureReason.INVALID_TARGET, "Invalid port in " + target, e);
        }
        if (port < 1 || port > 65535) {
            throw new ProbeException(ProbeFailureReason.INVALID_TARGET, "Port out of range in " + target);
        }
        return new TargetAddress(value.substring(0, colon), port);
    }
}
