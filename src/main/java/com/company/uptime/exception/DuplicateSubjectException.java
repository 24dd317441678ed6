package com.company.uptime.exception;

public class DuplicateSubjectException extends RuntimeException {
    public DuplicateSubjectException(String subjectKey) {
        super("Subject already exists: " + subjectKey);
    }
}
