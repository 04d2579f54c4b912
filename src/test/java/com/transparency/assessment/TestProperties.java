package com.transparency.assessment;

import com.transparency.assessment.config.AssessmentProperties;

import java.time.Duration;
import java.util.List;

public final class TestProperties {
    private TestProperties() {}

    public static AssessmentProperties withTimeouts(Duration scoringTimeout, Duration reportTimeout) {
        return new AssessmentProperties(
                new AssessmentProperties.Scoring(scoringTimeout, 50, 0.1, 50),
                new AssessmentProperties.Report(reportTimeout, 0.1, 8000),
                new AssessmentProperties.Llm("http://localhost:1", "test-key", "scoring-model", "report-model",
                        Duration.ofSeconds(5)),
                new AssessmentProperties.Executor(2, 1),
                new AssessmentProperties.Auth(List.of()));
    }

    public static AssessmentProperties defaults() {
        return withTimeouts(Duration.ofSeconds(2), Duration.ofSeconds(2));
    }
}
