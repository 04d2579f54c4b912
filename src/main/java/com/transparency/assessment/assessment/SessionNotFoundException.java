package com.transparency.assessment.assessment;

public class SessionNotFoundException extends AssessmentException {
    public SessionNotFoundException(String sessionId) {
        super("SESSION_NOT_FOUND", "Session " + sessionId + " not found");
    }
}
