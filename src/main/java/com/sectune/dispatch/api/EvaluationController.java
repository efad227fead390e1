package com.sectune.dispatch.api;

import com.sectune.core.evaluation.PerformanceEvaluator;
import com.sectune.core.model.PerformanceRecord;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for evaluating fine-tuned models.
 */
@RestController
@RequestMapping("/api/v1/models/{modelId}/evaluations")
public class EvaluationController {

    private final PerformanceEvaluator evaluator;

    public EvaluationController(PerformanceEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * POST: Runs an evaluation. 201 with the new record, or 204 when the
     * held-out sample was empty.
     */
    @PostMapping
    public ResponseEntity<PerformanceRecord> evaluate(@PathVariable String modelId) {
        return evaluator.evaluate(modelId)
                .map(record -> ResponseEntity.status(HttpStatus.CREATED).body(record))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping
    public ResponseEntity<List<PerformanceRecord>> history(@PathVariable String modelId) {
        return ResponseEntity.ok(evaluator.history(modelId));
    }
}
