package com.patchpilot.orchestrator.api;

import com.patchpilot.orchestrator.OrchestratorException;
import com.patchpilot.orchestrator.admission.AdmissionDeniedException;
import com.patchpilot.orchestrator.lifecycle.InvalidTransitionException;
import com.patchpilot.orchestrator.lifecycle.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Maps domain exceptions to status codes. Bodies carry the exception's
 * code so scripts can branch on it without parsing the message.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(JobNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e.getCode(), e.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, Object>> invalidTransition(InvalidTransitionException e) {
        return body(HttpStatus.CONFLICT, e.getCode(), e.getMessage());
    }

    @ExceptionHandler(AdmissionDeniedException.class)
    public ResponseEntity<Map<String, Object>> admissionDenied(AdmissionDeniedException e) {
        log.info("Admission denied by {} gate: {}", e.getGate(), e.getMessage());
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.TOO_MANY_REQUESTS, e.getCode(), e.getMessage());
        response.getBody().put("gate", e.getGate());
        return response;
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, Object>> unknown(NoSuchElementException e) {
        return body(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    // AutonomousRunner.start while a run is active
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> conflict(IllegalStateException e) {
        return body(HttpStatus.CONFLICT, "CONFLICT", e.getMessage());
    }

    @ExceptionHandler(OrchestratorException.class)
    public ResponseEntity<Map<String, Object>> orchestratorFailure(OrchestratorException e) {
        log.warn("Request failed: [{}] {}", e.getCode(), e.getMessage());
        return body(HttpStatus.BAD_GATEWAY, e.getCode(), e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("code", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
