package com.transparency.assessment.report;

import com.transparency.assessment.assessment.AssessmentModels.AssessmentSession;
import com.transparency.assessment.domain.DomainModels.Product;

import java.util.List;

public class ReportModels {
    /** Everything a renderer may use; {@code session.finalScore()} is null while the session is active. */
    public record ReportRequest(Product product, AssessmentSession session, List<String> questions) {}

    public record RenderedReport(String document, boolean generated) {}
}
