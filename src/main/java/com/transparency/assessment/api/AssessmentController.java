package com.transparency.assessment.api;

import com.transparency.assessment.assessment.AssessmentModels;
import com.transparency.assessment.assessment.AssessmentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/assessment")
public class AssessmentController {
    private final AssessmentService assessmentService;

    public AssessmentController(AssessmentService assessmentService) {
        this.assessmentService = assessmentService;
    }

    @PostMapping("/respond")
    public ResponseEntity<AssessmentModels.StepResult> respond(@RequestBody AnswerRequest request) {
        return ResponseEntity.ok(assessmentService.submitAnswer(request.sessionId(), request.message()));
    }

    @PostMapping("/respond-batch")
    public ResponseEntity<AssessmentModels.BatchResult> respondBatch(@RequestBody BatchAnswerRequest request) {
        return ResponseEntity.ok(assessmentService.submitAnswers(request.sessionId(), request.responses()));
    }

    @GetMapping("/{sessionId}/status")
    public ResponseEntity<AssessmentModels.StatusView> status(@PathVariable String sessionId) {
        return ResponseEntity.ok(assessmentService.status(sessionId));
    }

    @GetMapping("/{sessionId}/report")
    public ResponseEntity<AssessmentModels.ReportView> report(@PathVariable String sessionId) {
        return ResponseEntity.ok(assessmentService.report(sessionId));
    }

    @GetMapping("/{sessionId}/events")
    public ResponseEntity<List<AssessmentModels.AssessmentEvent>> events(@PathVariable String sessionId) {
        return ResponseEntity.ok(assessmentService.history(sessionId));
    }

    public record AnswerRequest(String sessionId, String message) {}

    public record BatchAnswerRequest(String sessionId, List<String> responses) {}
}
