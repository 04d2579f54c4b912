package com.transparency.assessment.assessment;

import com.transparency.assessment.assessment.AssessmentModels.*;
import com.transparency.assessment.domain.DomainModels.Product;
import com.transparency.assessment.domain.DomainModels.Question;
import com.transparency.assessment.report.ReportModels.RenderedReport;
import com.transparency.assessment.report.ReportModels.ReportRequest;
import com.transparency.assessment.report.ReportService;
import com.transparency.assessment.repository.AssessmentEventJdbcRepository;
import com.transparency.assessment.repository.ProductJdbcRepository;
import com.transparency.assessment.repository.SessionJdbcRepository;
import com.transparency.assessment.scoring.AnswerScorer;
import com.transparency.assessment.scoring.ScoreResult;
import com.transparency.assessment.validation.AssessmentRequestValidator;
import com.transparency.assessment.validation.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
public class AssessmentService {
    private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);

    private final ProductJdbcRepository productRepository;
    private final SessionJdbcRepository sessionRepository;
    private final AssessmentEventJdbcRepository eventRepository;
    private final QuestionBank questionBank;
    private final AssessmentStateMachine stateMachine;
    private final AnswerScorer scorer;
    private final AssessmentRequestValidator validator;
    private final ReportService reportService;
    private final TransactionTemplate transactionTemplate;

    public AssessmentService(ProductJdbcRepository productRepository,
                             SessionJdbcRepository sessionRepository,
                             AssessmentEventJdbcRepository eventRepository,
                             QuestionBank questionBank,
                             AssessmentStateMachine stateMachine,
                             AnswerScorer scorer,
                             AssessmentRequestValidator validator,
                             ReportService reportService,
                             TransactionTemplate transactionTemplate) {
        this.productRepository = productRepository;
        this.sessionRepository = sessionRepository;
        this.eventRepository = eventRepository;
        this.questionBank = questionBank;
        this.stateMachine = stateMachine;
        this.scorer = scorer;
        this.validator = validator;
        this.reportService = reportService;
        this.transactionTemplate = transactionTemplate;
    }

    public RegistrationResult registerProduct(RegisterCommand command) {
        requireValid(validator.validateRegistration(command));
        String productKey = command.productKey();
        if (productRepository.exists(productKey)) {
            throw new DuplicateProductException(productKey);
        }

        Instant now = Instant.now();
        Product product = new Product(productKey, command.companyName(), command.productName(),
                command.description(), command.domain(), now);
        AssessmentSession session = stateMachine.start(UUID.randomUUID().toString(), productKey, now);
        try {
            transactionTemplate.executeWithoutResult(tx -> {
                productRepository.insert(product);
                sessionRepository.insertSession(session);
                eventRepository.saveEvents(List.of(event(session, AssessmentEventTypes.PRODUCT_REGISTERED, now,
                        "product=" + command.productName() + ",domain=" + command.domain())));
            });
        } catch (DuplicateKeyException e) {
            throw new DuplicateProductException(productKey);
        }
        log.info("Registered product {} with session {}", productKey, session.sessionId());

        return new RegistrationResult(session.sessionId(), productKey, questionBank.first().text(),
                questionBank.remainingFrom(2), "Product registered. Assessment started.");
    }

    public StepResult submitAnswer(String sessionId, String answerText) {
        requireValid(validator.validateAnswer(sessionId, answerText));
        try (MDC.MDCCloseable ignored = MDC.putCloseable("sessionId", sessionId)) {
            AssessmentSession before = loadSession(sessionId);
            if (before.completed()) {
                log.info("Answer rejected, session already completed with final score {}", before.finalScore());
                return alreadyCompleted(before);
            }

            Question question = stateMachine.pendingQuestion(before);
            ScoreResult score = scorer.score(question.text(), answerText, question.index());
            Instant now = Instant.now();
            AssessmentSession after = stateMachine.apply(before, answerText, score, now);

            List<AssessmentEvent> events = new ArrayList<>();
            events.add(event(after, AssessmentEventTypes.ANSWER_SUBMITTED, now,
                    "question=" + question.index() + ",score=" + score.score()));
            addOutcomeEvents(events, List.of(after.answers().get(after.answeredCount() - 1)), after, now);
            AssessmentSession winner = commit(before, after, events);
            if (winner != null) {
                log.info("Answer dropped, a concurrent submission completed the session");
                return alreadyCompleted(winner);
            }

            log.info("Question {} scored {}{}", question.index(), score.score(), score.fallback() ? " (fallback)" : "");
            return new StepResult(sessionId,
                    after.completed() ? StepOutcome.COMPLETED : StepOutcome.ADVANCED,
                    score.score(),
                    question.index(),
                    score.fallback(),
                    after.completed(),
                    after.finalScore(),
                    after.scores(),
                    after.completed() ? null : stateMachine.remainingQuestions(after));
        }
    }

    public BatchResult submitAnswers(String sessionId, List<String> answerTexts) {
        requireValid(validator.validateBatch(sessionId, answerTexts));
        try (MDC.MDCCloseable ignored = MDC.putCloseable("sessionId", sessionId)) {
            AssessmentSession before = loadSession(sessionId);
            if (before.completed()) {
                log.info("Batch rejected, session already completed with final score {}", before.finalScore());
                return alreadyCompletedBatch(before, answerTexts.size());
            }

            int toProcess = Math.min(answerTexts.size(), stateMachine.remainingSlots(before));
            requireValid(validator.validateBatchEntries(answerTexts, toProcess));
            int discarded = answerTexts.size() - toProcess;
            if (discarded > 0) {
                log.info("Discarding {} answers beyond the last question", discarded);
            }

            AssessmentSession after = before;
            List<Integer> batchScores = new ArrayList<>();
            for (String answerText : answerTexts.subList(0, toProcess)) {
                Question question = stateMachine.pendingQuestion(after);
                ScoreResult score = scorer.score(question.text(), answerText, question.index());
                after = stateMachine.apply(after, answerText, score, Instant.now());
                batchScores.add(score.score());
            }

            Instant now = after.updatedAt();
            List<AnswerRecord> appended = after.answers().subList(before.answeredCount(), after.answeredCount());
            List<AssessmentEvent> events = new ArrayList<>();
            events.add(event(after, AssessmentEventTypes.BATCH_SUBMITTED, now,
                    "from=" + before.currentQuestionIndex() + ",answered=" + toProcess + ",discarded=" + discarded));
            addOutcomeEvents(events, appended, after, now);
            AssessmentSession winner = commit(before, after, events);
            if (winner != null) {
                log.info("Batch dropped, a concurrent submission completed the session");
                return alreadyCompletedBatch(winner, answerTexts.size());
            }

            log.info("Batch scored questions {}-{}: {}", before.currentQuestionIndex(),
                    after.currentQuestionIndex() - 1, batchScores);
            return new BatchResult(sessionId,
                    after.completed() ? StepOutcome.COMPLETED : StepOutcome.ADVANCED,
                    toProcess,
                    discarded,
                    after.currentQuestionIndex(),
                    after.completed(),
                    after.finalScore(),
                    after.scores(),
                    List.copyOf(batchScores),
                    after.completed() ? null : stateMachine.remainingQuestions(after));
        }
    }

    public StatusView status(String sessionId) {
        return toStatus(loadSession(sessionId));
    }

    public ReportView report(String sessionId) {
        AssessmentSession session = loadSession(sessionId);
        Product product = productRepository.find(session.productKey())
                .orElseThrow(() -> new ProductNotFoundException(session.productKey()));

        List<String> questions = questionBank.all().stream().map(Question::text).toList();
        RenderedReport rendered = reportService.render(new ReportRequest(product, session, questions));

        return new ReportView(sessionId, product.productKey(), session.status(), session.finalScore(),
                session.answers(), session.scores(), session.createdAt(),
                session.completed() ? session.updatedAt() : null,
                rendered.document(), rendered.generated());
    }

    public List<AssessmentEvent> history(String sessionId) {
        loadSession(sessionId);
        return eventRepository.loadEvents(sessionId);
    }

    public List<Product> products() {
        return productRepository.findAll();
    }

    public ProductDetails product(String productKey) {
        Product product = productRepository.find(productKey)
                .orElseThrow(() -> new ProductNotFoundException(productKey));
        List<StatusView> sessions = sessionRepository.findSessionIds(productKey).stream()
                .map(this::status)
                .toList();
        return new ProductDetails(product, sessions);
    }

    /**
     * One transaction: conditional progress update, new answer rows, events.
     *
     * @return null once committed, or the stored session if a concurrent writer completed it first
     * @throws ConcurrentSubmissionException if a concurrent writer advanced the session and it is still active
     */
    private AssessmentSession commit(AssessmentSession before, AssessmentSession after, List<AssessmentEvent> events) {
        List<AnswerRecord> appended = after.answers().subList(before.answeredCount(), after.answeredCount());
        try {
            transactionTemplate.executeWithoutResult(tx -> {
                if (!sessionRepository.updateProgress(after, before.version())) {
                    throw new ConcurrentSubmissionException(before.sessionId(), before.currentQuestionIndex());
                }
                sessionRepository.appendAnswers(before.sessionId(), appended);
                eventRepository.saveEvents(events);
            });
            return null;
        } catch (ConcurrentSubmissionException e) {
            AssessmentSession current = loadSession(before.sessionId());
            if (current.completed()) {
                return current;
            }
            throw e;
        }
    }

    private StepResult alreadyCompleted(AssessmentSession session) {
        return new StepResult(session.sessionId(), StepOutcome.ALREADY_COMPLETED, null, null, false, true,
                session.finalScore(), session.scores(), null);
    }

    private BatchResult alreadyCompletedBatch(AssessmentSession session, int submitted) {
        return new BatchResult(session.sessionId(), StepOutcome.ALREADY_COMPLETED, 0, submitted,
                session.currentQuestionIndex(), true, session.finalScore(), session.scores(), List.of(), null);
    }

    private void addOutcomeEvents(List<AssessmentEvent> events, List<AnswerRecord> appended,
                                  AssessmentSession after, Instant now) {
        appended.stream()
                .filter(AnswerRecord::fallbackScore)
                .forEach(a -> events.add(event(after, AssessmentEventTypes.SCORING_FALLBACK, now,
                        "question=" + a.questionIndex() + ",score=" + a.score())));
        if (after.completed()) {
            events.add(event(after, AssessmentEventTypes.ASSESSMENT_COMPLETED, now,
                    "final_score=" + after.finalScore()));
        }
    }

    private AssessmentSession loadSession(String sessionId) {
        return sessionRepository.findSession(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private StatusView toStatus(AssessmentSession session) {
        return new StatusView(session.sessionId(), session.productKey(), session.currentQuestionIndex(),
                session.status(), session.finalScore(), session.answeredCount(), stateMachine.nextQuestion(session));
    }

    private AssessmentEvent event(AssessmentSession session, String type, Instant ts, String payload) {
        return new AssessmentEvent(session.sessionId(), session.productKey(), type, ts, payload);
    }

    private void requireValid(List<ValidationError> errors) {
        if (!errors.isEmpty()) {
            throw new InvalidRequestException(errors);
        }
    }
}
