package com.transparency.assessment.assessment;

public class ProductNotFoundException extends AssessmentException {
    public ProductNotFoundException(String productKey) {
        super("PRODUCT_NOT_FOUND", "Product " + productKey + " not found");
    }
}
