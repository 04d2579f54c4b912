package com.transparency.assessment.assessment;

import com.transparency.assessment.assessment.AssessmentModels.AnswerRecord;
import com.transparency.assessment.assessment.AssessmentModels.AssessmentSession;
import com.transparency.assessment.domain.DomainModels.Question;
import com.transparency.assessment.domain.DomainModels.SessionStatus;
import com.transparency.assessment.scoring.ScoreResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
public class AssessmentStateMachine {
    private final QuestionBank questionBank;

    public AssessmentStateMachine(QuestionBank questionBank) {
        this.questionBank = questionBank;
    }

    public AssessmentSession start(String sessionId, String productKey, Instant now) {
        return new AssessmentSession(sessionId, productKey, 1, List.of(), SessionStatus.ACTIVE,
                null, now, now, 0L);
    }

    /** The question the next answer belongs to. */
    public Question pendingQuestion(AssessmentSession session) {
        requireActive(session);
        return questionBank.question(session.currentQuestionIndex());
    }

    public int remainingSlots(AssessmentSession session) {
        if (session.completed()) {
            return 0;
        }
        return questionBank.size() - session.currentQuestionIndex() + 1;
    }

    public AssessmentSession apply(AssessmentSession session, String answerText, ScoreResult score, Instant now) {
        Question question = pendingQuestion(session);

        List<AnswerRecord> answers = new ArrayList<>(session.answers());
        answers.add(new AnswerRecord(question.index(), question.text(), answerText,
                score.score(), score.fallback(), now));

        int next = question.index() + 1;
        if (next > questionBank.size()) {
            return new AssessmentSession(session.sessionId(), session.productKey(), next, List.copyOf(answers),
                    SessionStatus.COMPLETED, mean(answers), session.createdAt(), now, session.version());
        }
        return new AssessmentSession(session.sessionId(), session.productKey(), next, List.copyOf(answers),
                SessionStatus.ACTIVE, null, session.createdAt(), now, session.version());
    }

    public List<String> remainingQuestions(AssessmentSession session) {
        return session.completed() ? List.of() : questionBank.remainingFrom(session.currentQuestionIndex());
    }

    public String nextQuestion(AssessmentSession session) {
        return session.completed() ? null : questionBank.question(session.currentQuestionIndex()).text();
    }

    static double mean(List<AnswerRecord> answers) {
        return answers.stream().mapToInt(AnswerRecord::score).average().orElse(0.0);
    }

    private void requireActive(AssessmentSession session) {
        if (session.completed()) {
            throw new IllegalStateException("Session " + session.sessionId() + " is already completed");
        }
        if (session.currentQuestionIndex() != session.answeredCount() + 1) {
            throw new IllegalStateException("Session " + session.sessionId() + " is inconsistent: pointer "
                    + session.currentQuestionIndex() + " with " + session.answeredCount() + " answers");
        }
    }
}
