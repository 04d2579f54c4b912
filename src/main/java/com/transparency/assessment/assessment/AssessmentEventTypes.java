package com.transparency.assessment.assessment;

public final class AssessmentEventTypes {
    public static final String PRODUCT_REGISTERED = "product_registered";
    public static final String ANSWER_SUBMITTED = "answer_submitted";
    public static final String BATCH_SUBMITTED = "batch_submitted";
    public static final String ASSESSMENT_COMPLETED = "assessment_completed";
    public static final String SCORING_FALLBACK = "scoring_fallback";

    private AssessmentEventTypes() {}
}
