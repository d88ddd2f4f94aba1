package com.chaincustody.api.controller;

import com.chaincustody.api.dto.ErrorBody;
import com.chaincustody.chain.UnsupportedChainException;
import com.chaincustody.deposit.monitor.MonitorNotFoundException;
import com.chaincustody.domain.SettlementErrorCode;
import com.chaincustody.domain.SettlementException;
import com.chaincustody.http.UpstreamException;
import com.chaincustody.node.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps validation, domain and upstream failures to ErrorBody responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(SettlementException.class)
    public ResponseEntity<ErrorBody> handleSettlement(SettlementException ex) {
        return ResponseEntity.status(statusOf(ex.getErrorCode()))
                .body(ErrorBody.of(ex.getErrorCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(UnsupportedChainException.class)
    public ResponseEntity<ErrorBody> handleUnsupportedChain(UnsupportedChainException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(SettlementErrorCode.UNSUPPORTED_CHAIN.name(), ex.getMessage()));
    }

    @ExceptionHandler(MonitorNotFoundException.class)
    public ResponseEntity<ErrorBody> handleMonitorNotFound(MonitorNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("MONITOR_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler({RpcException.class, UpstreamException.class})
    public ResponseEntity<ErrorBody> handleUpstream(RuntimeException ex) {
        log.warn("Upstream failure serving request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBody.of("UPSTREAM_UNAVAILABLE", ex.getMessage()));
    }

    static HttpStatus statusOf(SettlementErrorCode code) {
        return switch (code) {
            case WALLET_NOT_FOUND, TOKEN_NOT_FOUND, TRANSACTION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_BROADCAST -> HttpStatus.CONFLICT;
            default -> HttpStatus.BAD_REQUEST;
        };
    }
}
