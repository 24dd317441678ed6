package com.company.uptime.exception;

/**
 * The queue backend could not be reached or rejected an operation.
 */
public class QueueBackendException extends RuntimeException {
    public QueueBackendException(String message) {
        super(message);
    }

    public QueueBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
