package com.transparency.assessment.scoring;

import com.transparency.assessment.config.AssessmentProperties;
import com.transparency.assessment.config.LlmConfig;
import com.transparency.assessment.llm.LlmCallException;
import com.transparency.assessment.llm.TimedChatClient;
import com.transparency.assessment.llm.TimedChatClient.ChatOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class LlmAnswerScorer implements AnswerScorer {
    private static final Logger log = LoggerFactory.getLogger(LlmAnswerScorer.class);

    static final int MIN_SCORE = 1;
    static final int MAX_SCORE = 100;

    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,9}");

    private final TimedChatClient chatClient;
    private final ChatOptions options;
    private final int fallbackScore;

    public LlmAnswerScorer(@Qualifier(LlmConfig.SCORING_CLIENT) TimedChatClient chatClient,
                           AssessmentProperties properties) {
        this.chatClient = chatClient;
        AssessmentProperties.Scoring scoring = properties.scoring();
        this.options = new ChatOptions(properties.llm().scoringModel(), scoring.temperature(),
                scoring.maxTokens(), scoring.timeout());
        this.fallbackScore = clamp(scoring.fallbackScore());
    }

    @Override
    public ScoreResult score(String questionText, String answerText, int questionIndex) {
        String reply;
        try {
            reply = chatClient.complete(ScoringPrompts.render(questionIndex, questionText, answerText), options);
        } catch (LlmCallException e) {
            log.warn("Scoring question {} failed, using fallback score {}: {}", questionIndex, fallbackScore, e.getMessage());
            return ScoreResult.fallback(fallbackScore, e.getMessage());
        }

        OptionalInt parsed = parseScore(reply);
        if (parsed.isEmpty()) {
            log.warn("Scoring question {} returned no number, using fallback score {}: '{}'",
                    questionIndex, fallbackScore, abbreviate(reply));
            return ScoreResult.fallback(fallbackScore, "non-numeric reply");
        }
        int score = clamp(parsed.getAsInt());
        log.debug("Question {} scored {}", questionIndex, score);
        return ScoreResult.scored(score);
    }

    /** First integer in the reply, if any. */
    static OptionalInt parseScore(String reply) {
        if (reply == null) {
            return OptionalInt.empty();
        }
        Matcher m = INTEGER.matcher(reply);
        return m.find() ? OptionalInt.of(Integer.parseInt(m.group())) : OptionalInt.empty();
    }

    static int clamp(int score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
