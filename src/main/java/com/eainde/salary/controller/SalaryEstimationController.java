package com.eainde.salary.controller;

import com.eainde.salary.extraction.ProfileExtractionException;
import com.eainde.salary.model.EstimationResult;
import com.eainde.salary.workflow.SalaryEstimationEngine;
import com.eainde.salary.workflow.SalaryEstimationException;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Log4j2
@RestController
@RequestMapping("/salary-estimates")
public class SalaryEstimationController {

    private final SalaryEstimationEngine engine;

    public SalaryEstimationController(SalaryEstimationEngine engine) {
        this.engine = engine;
    }

    @PostMapping(consumes = MediaType.TEXT_PLAIN_VALUE)
    public EstimationResult estimateFromText(@RequestBody String profileText) {
        return engine.run(profileText);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public EstimationResult estimateFromJson(@RequestBody EstimationRequest request) {
        return engine.run(request.profileText());
    }

    @GetMapping("/example")
    public EstimationResult estimateExample() {
        return engine.run(ExampleProfile.TEXT);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(ProfileExtractionException.class)
    public ResponseEntity<Map<String, String>> handleExtractionFailure(ProfileExtractionException e) {
        log.warn("Rejecting profile: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(SalaryEstimationException.class)
    public ResponseEntity<Map<String, String>> handleEstimationFailure(SalaryEstimationException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
