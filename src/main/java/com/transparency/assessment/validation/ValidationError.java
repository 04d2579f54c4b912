package com.transparency.assessment.validation;

public record ValidationError(String code, String field, String message) {}
