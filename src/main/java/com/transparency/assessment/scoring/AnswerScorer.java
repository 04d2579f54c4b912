package com.transparency.assessment.scoring;

public interface AnswerScorer {
    /**
     * Scores a free-text answer to one assessment question.
     *
     * @return a score in [1,100]; implementations never throw, a failed call yields a fallback result
     */
    ScoreResult score(String questionText, String answerText, int questionIndex);
}
