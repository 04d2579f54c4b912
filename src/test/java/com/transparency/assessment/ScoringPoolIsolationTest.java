package com.transparency.assessment;

import com.transparency.assessment.assessment.AssessmentModels;
import com.transparency.assessment.assessment.AssessmentService;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = {
        "assessment.executor.scoring-pool-size=1",
        "assessment.executor.report-pool-size=1",
        "assessment.scoring.timeout=1s",
        "assessment.report.timeout=10s"
})
class ScoringPoolIsolationTest {
    @Autowired
    private AssessmentService assessmentService;

    @MockBean
    private ChatModel chatModel;

    private final ExecutorService callers = Executors.newFixedThreadPool(2);

    @AfterEach
    void shutdown() {
        callers.shutdownNow();
    }

    @Test
    void stalledReportsDoNotForceFallbackScores() throws Exception {
        CountDownLatch reportStarted = new CountDownLatch(1);
        CountDownLatch releaseReports = new CountDownLatch(1);
        when(chatModel.chat(any(ChatRequest.class))).thenAnswer(invocation -> {
            ChatRequest request = invocation.getArgument(0);
            if (LlmStubs.isReportPrompt(request)) {
                reportStarted.countDown();
                releaseReports.await(10, TimeUnit.SECONDS);
                return LlmStubs.reply(LlmStubs.REPORT_HTML);
            }
            return LlmStubs.reply("90");
        });
        String sessionId = assessmentService.registerProduct(new AssessmentModels.RegisterCommand(
                "Acme", "Tablet", "isolation-" + UUID.randomUUID(), "Pain relief", "pharma")).sessionId();

        List<Future<AssessmentModels.ReportView>> reports = List.of(
                callers.submit(() -> assessmentService.report(sessionId)),
                callers.submit(() -> assessmentService.report(sessionId)));
        assertTrue(reportStarted.await(5, TimeUnit.SECONDS));

        var step = assessmentService.submitAnswer(sessionId, "Paracetamol 500 mg, no other actives");

        releaseReports.countDown();
        assertEquals(90, step.score());
        assertFalse(step.fallbackScore());
        for (Future<AssessmentModels.ReportView> report : reports) {
            assertTrue(report.get(20, TimeUnit.SECONDS).reportGenerated());
        }
    }
}
