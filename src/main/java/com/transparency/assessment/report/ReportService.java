package com.transparency.assessment.report;

import com.transparency.assessment.report.ReportModels.RenderedReport;
import com.transparency.assessment.report.ReportModels.ReportRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

@Service
public class ReportService {
    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    static final String PLACEHOLDER_MARKER = "report-generation-error";

    private final ReportGenerator generator;

    public ReportService(ReportGenerator generator) {
        this.generator = generator;
    }

    public RenderedReport render(ReportRequest request) {
        try {
            return new RenderedReport(generator.generate(request), true);
        } catch (RuntimeException e) {
            log.error("Report generation failed for session {}", request.session().sessionId(), e);
            return new RenderedReport(placeholder(e.getMessage()), false);
        }
    }

    static String placeholder(String reason) {
        String detail = reason == null ? "unknown error" : HtmlUtils.htmlEscape(reason);
        return """
                <!DOCTYPE html>
                <html>
                <head>
                    <meta name="%s" content="true">
                    <title>Report Generation Error</title>
                </head>
                <body>
                    <h1>Error Generating Report</h1>
                    <p>Unable to generate transparency report: %s</p>
                    <p>Please try again or contact support.</p>
                </body>
                </html>""".formatted(PLACEHOLDER_MARKER, detail);
    }
}
