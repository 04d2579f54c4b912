package com.transparency.assessment.api;

import com.transparency.assessment.assessment.AssessmentModels;
import com.transparency.assessment.assessment.AssessmentService;
import com.transparency.assessment.domain.DomainModels;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/products")
public class ProductController {
    private final AssessmentService assessmentService;

    public ProductController(AssessmentService assessmentService) {
        this.assessmentService = assessmentService;
    }

    @PostMapping("/register")
    public ResponseEntity<AssessmentModels.RegistrationResult> register(@RequestBody RegisterRequest request) {
        AssessmentModels.RegisterCommand command = request == null ? null : new AssessmentModels.RegisterCommand(
                request.companyName(), request.productName(), request.productId(), request.description(), request.domain());
        return ResponseEntity.status(HttpStatus.CREATED).body(assessmentService.registerProduct(command));
    }

    @GetMapping
    public ResponseEntity<List<DomainModels.Product>> list() {
        return ResponseEntity.ok(assessmentService.products());
    }

    @GetMapping("/{productKey}")
    public ResponseEntity<AssessmentModels.ProductDetails> get(@PathVariable String productKey) {
        return ResponseEntity.ok(assessmentService.product(productKey));
    }

    public record RegisterRequest(String companyName,
                                  String productName,
                                  String productId,
                                  String description,
                                  String domain) {}
}
