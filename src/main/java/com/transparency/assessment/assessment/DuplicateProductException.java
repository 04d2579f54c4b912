package com.transparency.assessment.assessment;

public class DuplicateProductException extends AssessmentException {
    public DuplicateProductException(String productKey) {
        super("DUPLICATE_PRODUCT", "Product with key " + productKey + " already exists");
    }
}
