package com.transparency.assessment.assessment;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.transparency.assessment.domain.DomainModels.Product;
import com.transparency.assessment.domain.DomainModels.SessionStatus;

import java.time.Instant;
import java.util.List;

public class AssessmentModels {
    public record RegisterCommand(String companyName,
                                  String productName,
                                  String productKey,
                                  String description,
                                  String domain) {}

    public record AnswerRecord(int questionIndex,
                               String questionText,
                               String answerText,
                               int score,
                               boolean fallbackScore,
                               Instant answeredAt) {}

    public record AssessmentSession(String sessionId,
                                    String productKey,
                                    int currentQuestionIndex,
                                    List<AnswerRecord> answers,
                                    SessionStatus status,
                                    Double finalScore,
                                    Instant createdAt,
                                    Instant updatedAt,
                                    long version) {
        public List<Integer> scores() {
            return answers.stream().map(AnswerRecord::score).toList();
        }

        public int answeredCount() {
            return answers.size();
        }

        public boolean completed() {
            return status == SessionStatus.COMPLETED;
        }
    }

    public enum StepOutcome { ADVANCED, COMPLETED, ALREADY_COMPLETED }

    public record RegistrationResult(String sessionId,
                                     String productKey,
                                     String firstQuestion,
                                     List<String> remainingQuestions,
                                     String message) {}

    public record StepResult(String sessionId,
                             StepOutcome outcome,
                             Integer score,
                             Integer questionIndex,
                             boolean fallbackScore,
                             @JsonProperty("is_complete") boolean complete,
                             Double finalScore,
                             List<Integer> allScores,
                             List<String> remainingQuestions) {}

    public record BatchResult(String sessionId,
                              StepOutcome outcome,
                              int questionsAnswered,
                              int discardedAnswers,
                              int nextQuestionIndex,
                              @JsonProperty("is_complete") boolean complete,
                              Double finalScore,
                              List<Integer> allScores,
                              List<Integer> batchScores,
                              List<String> remainingQuestions) {}

    public record StatusView(String sessionId,
                             String productKey,
                             int currentQuestionIndex,
                             SessionStatus status,
                             Double finalScore,
                             int answeredCount,
                             String nextQuestion) {}

    public record ReportView(String sessionId,
                             String productKey,
                             SessionStatus status,
                             Double finalScore,
                             List<AnswerRecord> answers,
                             List<Integer> scores,
                             Instant createdAt,
                             Instant completedAt,
                             String reportDocument,
                             boolean reportGenerated) {}

    public record ProductDetails(Product product, List<StatusView> sessions) {}

    public record AssessmentEvent(String sessionId, String productKey, String eventType, Instant ts, String payload) {}
}
