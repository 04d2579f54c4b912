package com.transparency.assessment.assessment;

public abstract class AssessmentException extends RuntimeException {
    private final String code;

    protected AssessmentException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
