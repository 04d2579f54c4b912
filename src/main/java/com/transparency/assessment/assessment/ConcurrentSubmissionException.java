package com.transparency.assessment.assessment;

/**
 * Raised when another submission advanced the session between our read and our write.
 * Nothing from the losing submission is persisted.
 */
public class ConcurrentSubmissionException extends AssessmentException {
    public ConcurrentSubmissionException(String sessionId, int questionIndex) {
        super("CONCURRENT_SUBMISSION",
                "Session " + sessionId + " was advanced past question " + questionIndex + " by another submission");
    }
}
