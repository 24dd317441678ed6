package com.company.uptime.exception;

public class QueueClosedException extends RuntimeException {
    public QueueClosedException(String queueName) {
        super("Job queue is closed: " + queueName);
    }
}
