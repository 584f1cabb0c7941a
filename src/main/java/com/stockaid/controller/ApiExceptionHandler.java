package com.stockaid.controller;

import com.stockaid.exception.ApiCacheException;
import com.stockaid.exception.ApiConfigurationException;
import com.stockaid.exception.ApiNotFoundException;
import com.stockaid.exception.MissingArgumentException;
import com.stockaid.exception.MissingKeyException;
import com.stockaid.exception.TransportException;
import com.stockaid.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps API cache errors to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ApiNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ApiNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "not_found", e);
    }

    @ExceptionHandler(MissingArgumentException.class)
    public ResponseEntity<ErrorResponse> handleMissingArgument(MissingArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, "missing_argument", e);
    }

    @ExceptionHandler(MissingKeyException.class)
    public ResponseEntity<ErrorResponse> handleMissingKey(MissingKeyException e) {
        log.error("Key chain is missing '{}'", e.getKeyName());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "missing_key", e);
    }

    @ExceptionHandler(TransportException.class)
    public ResponseEntity<ErrorResponse> handleTransport(TransportException e) {
        log.error("Provider request failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "transport_error", e);
    }

    @ExceptionHandler(ApiConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ApiConfigurationException e) {
        log.error("Configuration error: {}", e.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "configuration_error", e);
    }

    @ExceptionHandler(ApiCacheException.class)
    public ResponseEntity<ErrorResponse> handleOther(ApiCacheException e) {
        log.error("API call failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "error", e);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, Exception e) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, e.getMessage()));
    }
}
