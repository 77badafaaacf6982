package com.neorag.controller;

import com.neorag.exception.ConnectivityException;
import com.neorag.exception.GenerationException;
import com.neorag.exception.NeoragException;
import com.neorag.exception.RetrievalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps query failures to JSON error bodies of the form {detail, code}.
 */
@Slf4j
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidInput(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableInput(ServerWebInputException ex) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", ex.getReason());
    }

    @ExceptionHandler(ConnectivityException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(ConnectivityException ex) {
        log.error("Backend {} unavailable: {}", ex.getBackend(), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler({RetrievalException.class, GenerationException.class})
    public ResponseEntity<Map<String, Object>> handleUpstreamFailure(NeoragException ex) {
        log.error("Query failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.BAD_GATEWAY, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(NeoragException.class)
    public ResponseEntity<Map<String, Object>> handleOther(NeoragException ex) {
        log.error("Unexpected failure: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getCode(), ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String code, String detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("detail", detail);
        body.put("code", code);
        return ResponseEntity.status(status).body(body);
    }
}
