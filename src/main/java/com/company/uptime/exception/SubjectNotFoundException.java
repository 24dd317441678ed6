package com.company.uptime.exception;

public class SubjectNotFoundException extends RuntimeException {
    public SubjectNotFoundException(String subjectKey) {
        super("Subject not found: " + subjectKey);
    }
}
