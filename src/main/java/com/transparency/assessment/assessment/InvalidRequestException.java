package com.transparency.assessment.assessment;

import com.transparency.assessment.validation.ValidationError;

import java.util.List;

public class InvalidRequestException extends AssessmentException {
    private final List<ValidationError> errors;

    public InvalidRequestException(List<ValidationError> errors) {
        super("INVALID_REQUEST", errors.isEmpty() ? "Invalid request" : errors.get(0).message());
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> errors() {
        return errors;
    }
}
