package com.judgmentbell.analysis.controller;

import com.judgmentbell.common.exception.AnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class AnalysisExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AnalysisExceptionHandler.class);

    @ExceptionHandler(AnalysisException.class)
    public ResponseEntity<Map<String, Object>> handleAnalysis(AnalysisException e) {
        log.warn("[Analysis] Analysis rejected. stage={} message={}", e.getStage(), e.getMessage());
        return ResponseEntity.unprocessableEntity().body(Map.of(
            "error", "ANALYSIS_FAILED",
            "stage", e.getStage(),
            "message", e.getMessage()
        ));
    }
}
