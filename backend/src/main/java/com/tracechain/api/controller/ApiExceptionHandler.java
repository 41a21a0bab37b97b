package com.tracechain.api.controller;

import com.tracechain.anchoring.AnchorTargetNotFoundException;
import com.tracechain.api.dto.ErrorBody;
import com.tracechain.bridge.UnknownBridgeException;
import com.tracechain.ledger.LedgerConfigurationException;
import com.tracechain.ledger.LedgerConnectivityException;
import com.tracechain.ledger.LedgerRejectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps validation, lookup and ledger failures to {@link ErrorBody} responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && msg.matches("[A-Z_]+"))
                .orElse(ErrorBody.VALIDATION_ERROR);
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ErrorBody.INVALID_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler({ UnknownBridgeException.class, AnchorTargetNotFoundException.class })
    public ResponseEntity<ErrorBody> handleNotFound(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of(ErrorBody.NOT_FOUND, ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorBody> handleConflict(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorBody.of(ErrorBody.CONFLICT, ex.getMessage()));
    }

    @ExceptionHandler(LedgerConfigurationException.class)
    public ResponseEntity<ErrorBody> handleConfiguration(LedgerConfigurationException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of(ErrorBody.LEDGER_NOT_CONFIGURED, ex.getMessage()));
    }

    @ExceptionHandler(LedgerConnectivityException.class)
    public ResponseEntity<ErrorBody> handleConnectivity(LedgerConnectivityException ex) {
        log.warn("Ledger unreachable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBody.of(ErrorBody.LEDGER_UNAVAILABLE, ex.getMessage()));
    }

    @ExceptionHandler(LedgerRejectionException.class)
    public ResponseEntity<ErrorBody> handleRejection(LedgerRejectionException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorBody.of(ErrorBody.LEDGER_REJECTED, ex.getMessage()));
    }
}
