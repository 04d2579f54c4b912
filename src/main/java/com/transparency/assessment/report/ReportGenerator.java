package com.transparency.assessment.report;

import com.transparency.assessment.report.ReportModels.ReportRequest;

public interface ReportGenerator {
    /**
     * Renders a standalone document for the answered part of a session.
     *
     * @throws ReportGenerationException if no usable document could be produced
     */
    String generate(ReportRequest request);
}
