package com.crisisrelay.web;

import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.reactive.function.client.WebClientException;

import com.crisisrelay.protocol.ProtocolError;
import com.crisisrelay.protocol.ProtocolException;

/** Translates protocol and oracle-transport failures into {code, message} JSON bodies. */
@RestControllerAdvice
public class ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(ProtocolException.class)
    public ResponseEntity<Map<String, Object>> handleProtocol(ProtocolException ex) {
        return ResponseEntity.status(statusOf(ex.getError()))
                .body(body(ex.getError().name(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadInput(IllegalArgumentException ex) {
        return body("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(WebClientException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleOracleTransport(WebClientException ex) {
        log.warn("Oracle transport failure: {}", ex.getMessage());
        return body("ORACLE_UNAVAILABLE", "Oracle could not be reached");
    }

    @ExceptionHandler(TimeoutException.class)
    @ResponseStatus(HttpStatus.GATEWAY_TIMEOUT)
    public Map<String, Object> handleTimeout(TimeoutException ex) {
        return body("ORACLE_TIMEOUT", "Oracle did not answer in time");
    }

    static HttpStatus statusOf(ProtocolError error) {
        return switch (error) {
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case NOT_FOUND, UNKNOWN_REQUEST -> HttpStatus.NOT_FOUND;
            case THRESHOLD_NOT_SET, THRESHOLD_ALREADY_SET, NOT_HIGH_RISK, ALREADY_REVEALED, ALREADY_RESOLVED -> HttpStatus.CONFLICT;
            case INVALID_PROOF, MALFORMED_PAYLOAD -> HttpStatus.UNPROCESSABLE_ENTITY;
            case DUPLICATE_REQUEST -> HttpStatus.BAD_GATEWAY;
        };
    }

    private static Map<String, Object> body(String code, String message) {
        return Map.of("code", code, "message", message == null ? "" : message);
    }
}
