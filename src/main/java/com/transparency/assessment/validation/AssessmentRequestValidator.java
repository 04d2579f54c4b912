package com.transparency.assessment.validation;

import com.transparency.assessment.assessment.AssessmentModels.RegisterCommand;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

@Component
public class AssessmentRequestValidator {
    static final int MAX_PRODUCT_KEY_LENGTH = 100;
    static final int MAX_FIELD_LENGTH = 255;
    static final int MAX_ANSWER_LENGTH = 20_000;

    private static final Pattern PRODUCT_KEY = Pattern.compile("[A-Za-z0-9._-]+");

    public List<ValidationError> validateRegistration(RegisterCommand command) {
        List<ValidationError> errors = new ArrayList<>();
        if (command == null) {
            errors.add(new ValidationError("MISSING_BODY", "body", "Registration body is required"));
            return errors;
        }

        required(command.companyName(), "company_name", MAX_FIELD_LENGTH, errors);
        required(command.productName(), "product_name", MAX_FIELD_LENGTH, errors);
        required(command.domain(), "domain", MAX_FIELD_LENGTH, errors);
        required(command.description(), "description", MAX_ANSWER_LENGTH, errors);

        String key = command.productKey();
        if (isBlank(key)) {
            errors.add(new ValidationError("MISSING_FIELD", "product_id", "product_id is required"));
        } else if (key.length() > MAX_PRODUCT_KEY_LENGTH) {
            errors.add(new ValidationError("FIELD_TOO_LONG", "product_id",
                    "product_id must be at most " + MAX_PRODUCT_KEY_LENGTH + " characters"));
        } else if (!PRODUCT_KEY.matcher(key).matches()) {
            errors.add(new ValidationError("INVALID_PRODUCT_KEY", "product_id",
                    "product_id may only contain letters, digits, '.', '_' and '-'"));
        }
        return errors;
    }

    public List<ValidationError> validateAnswer(String sessionId, String answerText) {
        List<ValidationError> errors = new ArrayList<>();
        sessionId(sessionId, errors);
        answer(answerText, "message", errors);
        return errors;
    }

    public List<ValidationError> validateBatch(String sessionId, List<String> answers) {
        List<ValidationError> errors = new ArrayList<>();
        sessionId(sessionId, errors);
        if (answers == null || answers.isEmpty()) {
            errors.add(new ValidationError("EMPTY_BATCH", "responses", "At least one response is required"));
        }
        return errors;
    }

    /** Checks the leading entries that will be scored; anything after them is discarded unread. */
    public List<ValidationError> validateBatchEntries(List<String> answers, int toProcess) {
        List<ValidationError> errors = new ArrayList<>();
        for (int i = 0; i < toProcess; i++) {
            answer(answers.get(i), "responses[" + i + "]", errors);
        }
        return errors;
    }

    private void sessionId(String sessionId, List<ValidationError> errors) {
        if (isBlank(sessionId)) {
            errors.add(new ValidationError("MISSING_FIELD", "session_id", "session_id is required"));
        }
    }

    private void answer(String text, String field, List<ValidationError> errors) {
        if (isBlank(text)) {
            errors.add(new ValidationError("EMPTY_ANSWER", field, field + " must not be empty"));
        } else if (text.length() > MAX_ANSWER_LENGTH) {
            errors.add(new ValidationError("ANSWER_TOO_LONG", field,
                    field + " must be at most " + MAX_ANSWER_LENGTH + " characters"));
        }
    }

    private void required(String value, String field, int maxLength, List<ValidationError> errors) {
        if (isBlank(value)) {
            errors.add(new ValidationError("MISSING_FIELD", field, field + " is required"));
        } else if (value.length() > maxLength) {
            errors.add(new ValidationError("FIELD_TOO_LONG", field,
                    field + " must be at most " + maxLength + " characters"));
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
