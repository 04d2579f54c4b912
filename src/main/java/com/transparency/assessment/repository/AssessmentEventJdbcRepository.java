package com.transparency.assessment.repository;

import com.transparency.assessment.assessment.AssessmentModels.AssessmentEvent;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class AssessmentEventJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public AssessmentEventJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void saveEvents(List<AssessmentEvent> events) {
        events.forEach(e -> jdbcTemplate.update(
                "INSERT INTO assessment_events(session_id, product_key, event_type, ts, payload) VALUES (?,?,?,?,?)",
                e.sessionId(), e.productKey(), e.eventType(), e.ts().toString(), e.payload()));
    }

    public List<AssessmentEvent> loadEvents(String sessionId) {
        return jdbcTemplate.query(
                "SELECT session_id, product_key, event_type, ts, payload FROM assessment_events WHERE session_id = ? ORDER BY id",
                (rs, n) -> new AssessmentEvent(rs.getString(1), rs.getString(2), rs.getString(3),
                        Instant.parse(rs.getString(4)), rs.getString(5)),
                sessionId);
    }
}
