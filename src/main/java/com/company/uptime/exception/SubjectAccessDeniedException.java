package com.company.uptime.exception;

public class SubjectAccessDeniedException extends RuntimeException {
    public SubjectAccessDeniedException(String subjectKey, String userId) {
        super("User " + userId + " does not own " + subjectKey);
    }
}
