package com.transparency.assessment.scoring;

/**
 * Score for one answer. {@code fallback} marks the fixed substitute score used when the
 * scoring service could not produce one; {@code failureReason} is null for genuine scores.
 */
public record ScoreResult(int score, boolean fallback, String failureReason) {
    public static ScoreResult scored(int score) {
        return new ScoreResult(score, false, null);
    }

    public static ScoreResult fallback(int score, String failureReason) {
        return new ScoreResult(score, true, failureReason);
    }
}
