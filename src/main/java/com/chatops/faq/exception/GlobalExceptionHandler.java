package com.chatops.faq.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(NotFoundException ex, HttpServletRequest req) {
        log.debug("[NOT-FOUND] {} - {}", req.getRequestURI(), ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, String>> handleInvalidTransition(InvalidTransitionException ex,
                                                                       HttpServletRequest req) {
        log.debug("[CONFLICT] {} - {}", req.getRequestURI(), ex.getMessage());
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", ex.getMessage());
        body.put("currentStatus", String.valueOf(ex.getCurrentStatus()));
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler({ConfigurationException.class, PersistenceException.class})
    public ResponseEntity<Map<String, String>> handleUnavailable(FaqReviewException ex, HttpServletRequest req) {
        log.error("[UNAVAILABLE] {} - {}", req.getRequestURI(), ex.getMessage(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler({ExternalServiceException.class, DeliveryException.class})
    public ResponseEntity<Map<String, String>> handleUpstream(FaqReviewException ex, HttpServletRequest req) {
        log.error("[UPSTREAM] {} - {}", req.getRequestURI(), ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex, HttpServletRequest req) {
        log.debug("[BAD-REQUEST] {} - {}", req.getRequestURI(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleNotReadable(HttpMessageNotReadableException ex,
                                                                 HttpServletRequest req) {
        log.debug("[NOT-READABLE] {} - {}", req.getRequestURI(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed JSON request");
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
