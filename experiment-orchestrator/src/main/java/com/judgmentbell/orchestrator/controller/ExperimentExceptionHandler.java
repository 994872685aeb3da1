package com.judgmentbell.orchestrator.controller;

import com.judgmentbell.common.exception.ExperimentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ExperimentExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ExperimentExceptionHandler.class);

    @ExceptionHandler(ExperimentException.class)
    public ResponseEntity<Map<String, Object>> handleExperiment(ExperimentException e) {
        HttpStatus status = switch (e.getReason()) {
            case UNKNOWN_RUN    -> HttpStatus.NOT_FOUND;
            case INVALID_STATE  -> HttpStatus.CONFLICT;
            case ORACLE_FAILURE -> HttpStatus.BAD_GATEWAY;
        };
        log.warn("[Experiment] Request rejected. runId={} reason={} message={}",
                 e.getRunId(), e.getReason(), e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getReason().name());
        body.put("runId", e.getRunId());
        body.put("message", e.getMessage());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidDesign(IllegalArgumentException e) {
        log.warn("[Experiment] Invalid design parameters: {}", e.getMessage());
        return ResponseEntity.unprocessableEntity().body(Map.of(
            "error", "INVALID_DESIGN",
            "message", String.valueOf(e.getMessage())
        ));
    }
}
