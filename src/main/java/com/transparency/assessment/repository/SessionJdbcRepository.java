package com.transparency.assessment.repository;

import com.transparency.assessment.assessment.AssessmentModels.AnswerRecord;
import com.transparency.assessment.assessment.AssessmentModels.AssessmentSession;
import com.transparency.assessment.domain.DomainModels.SessionStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class SessionJdbcRepository {
    private static final String SESSION_COLUMNS =
            "session_id, product_key, current_question_index, status, final_score, created_at, updated_at, version";

    private final JdbcTemplate jdbcTemplate;

    public SessionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insertSession(AssessmentSession s) {
        jdbcTemplate.update(
                "INSERT INTO assessment_sessions(" + SESSION_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)",
                s.sessionId(), s.productKey(), s.currentQuestionIndex(), s.status().value(), s.finalScore(),
                s.createdAt().toString(), s.updatedAt().toString(), s.version());
    }

    public Optional<AssessmentSession> findSession(String sessionId) {
        List<SessionRow> rows = jdbcTemplate.query(
                "SELECT " + SESSION_COLUMNS + " FROM assessment_sessions WHERE session_id = ?",
                (rs, n) -> new SessionRow(
                        rs.getString(1), rs.getString(2), rs.getInt(3), SessionStatus.fromValue(rs.getString(4)),
                        (Double) rs.getObject(5), Instant.parse(rs.getString(6)), Instant.parse(rs.getString(7)),
                        rs.getLong(8)),
                sessionId);
        return rows.stream().findFirst().map(row -> row.toSession(loadAnswers(sessionId)));
    }

    public List<String> findSessionIds(String productKey) {
        return jdbcTemplate.queryForList(
                "SELECT session_id FROM assessment_sessions WHERE product_key = ? ORDER BY created_at",
                String.class, productKey);
    }

    public List<AnswerRecord> loadAnswers(String sessionId) {
        return jdbcTemplate.query(
                "SELECT question_index, question_text, answer_text, score, fallback_score, answered_at FROM session_answers WHERE session_id = ? ORDER BY question_index",
                (rs, n) -> new AnswerRecord(rs.getInt(1), rs.getString(2), rs.getString(3), rs.getInt(4),
                        rs.getBoolean(5), Instant.parse(rs.getString(6))),
                sessionId);
    }

    /**
     * Writes the advanced pointer and status only if the stored version still equals
     * {@code expectedVersion}, bumping it by one.
     *
     * @return false when another writer got there first
     */
    public boolean updateProgress(AssessmentSession s, long expectedVersion) {
        int updated = jdbcTemplate.update(
                "UPDATE assessment_sessions SET current_question_index = ?, status = ?, final_score = ?, updated_at = ?, version = version + 1 "
                        + "WHERE session_id = ? AND version = ?",
                s.currentQuestionIndex(), s.status().value(), s.finalScore(), s.updatedAt().toString(),
                s.sessionId(), expectedVersion);
        return updated == 1;
    }

    public void appendAnswers(String sessionId, List<AnswerRecord> answers) {
        answers.forEach(a -> jdbcTemplate.update(
                "INSERT INTO session_answers(session_id, question_index, question_text, answer_text, score, fallback_score, answered_at) VALUES (?,?,?,?,?,?,?)",
                sessionId, a.questionIndex(), a.questionText(), a.answerText(), a.score(), a.fallbackScore(),
                a.answeredAt().toString()));
    }

    private record SessionRow(String sessionId, String productKey, int currentQuestionIndex, SessionStatus status,
                              Double finalScore, Instant createdAt, Instant updatedAt, long version) {
        AssessmentSession toSession(List<AnswerRecord> answers) {
            return new AssessmentSession(sessionId, productKey, currentQuestionIndex, answers, status, finalScore,
                    createdAt, updatedAt, version);
        }
    }
}
