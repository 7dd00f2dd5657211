package com.reviewengine.controller;

import com.reviewengine.core.issue.ReviewReport;
import com.reviewengine.core.repair.RepairResult;
import com.reviewengine.orchestrator.CodeReviewEngine;
import com.reviewengine.orchestrator.ReviewEngineException;
import com.reviewengine.orchestrator.dto.RepairResponse;
import com.reviewengine.orchestrator.dto.ReviewResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.Map;

@RestController
public class ReviewController {

    private static final Logger log = LoggerFactory.getLogger(ReviewController.class);

    private final CodeReviewEngine engine;

    public ReviewController(CodeReviewEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/review")
    public ResponseEntity<ReviewResponse> review(
            @RequestBody Map<String, Object> request
    ) {

        String source = sourceOf(request);

        if (source == null) {
            return ResponseEntity.badRequest().build();
        }

        Integer maxStatements = maxStatementsOf(request.get("maxFunctionStatements"));
        if (maxStatements != null && maxStatements < 0) {
            return ResponseEntity.badRequest().build();
        }

        ReviewReport report = maxStatements != null
                ? engine.review(source, maxStatements)
                : engine.review(source);

        return ResponseEntity.ok(ReviewResponse.from(report));
    }

    @PostMapping("/repair")
    public ResponseEntity<RepairResponse> repair(
            @RequestBody Map<String, Object> request
    ) {

        String source = sourceOf(request);

        if (source == null) {
            return ResponseEntity.badRequest().build();
        }

        RepairResult result = engine.repair(source);

        return ResponseEntity.ok(RepairResponse.from(result));
    }

    @ExceptionHandler(ReviewEngineException.class)
    public ResponseEntity<Map<String, String>> handleEngineFailure(ReviewEngineException e) {
        log.warn("[ReviewController] Rejected input: {}", e.getMessage());
        return ResponseEntity.unprocessableEntity().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(NumberFormatException.class)
    public ResponseEntity<Map<String, String>> handleBadNumber(NumberFormatException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "maxFunctionStatements must be an integer"));
    }

    private static String sourceOf(Map<String, Object> request) {
        Object source = request.get("source");
        if (!(source instanceof String) || ((String) source).trim().isEmpty()) {
            return null;
        }
        return (String) source;
    }

    private static Integer maxStatementsOf(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            // 3.0 is accepted, 3.7 and anything beyond int range are not
            try {
                return new BigDecimal(value.toString()).intValueExact();
            } catch (ArithmeticException e) {
                throw new NumberFormatException("not a whole int: " + value);
            }
        }
        return Integer.parseInt(value.toString().trim());
    }
}
