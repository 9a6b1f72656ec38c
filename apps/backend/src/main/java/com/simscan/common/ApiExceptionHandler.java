package com.simscan.common;

import com.simscan.error.ForbiddenException;
import com.simscan.error.InsufficientCreditException;
import com.simscan.error.InvalidStateException;
import com.simscan.error.NotFoundException;
import com.simscan.error.SimScanException;
import com.simscan.error.StorageException;
import com.simscan.error.UnauthorizedException;
import com.simscan.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SimScanException.class)
    public ResponseEntity<Map<String, Object>> domain(SimScanException ex) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            log.error("Request failed reason={}", ex.reason(), ex);
        } else {
            log.debug("Request rejected reason={} message={}", ex.reason(), ex.getMessage());
        }
        return body(status, ex.reason(), ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> validation(WebExchangeBindException ex) {
        Map<String, String> fields = new HashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", "validation_error",
                "message", "invalid_request",
                "fields", fields,
                "ts", Instant.now().toString()
        ));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> badInput(ServerWebInputException ex) {
        return body(HttpStatus.BAD_REQUEST, "validation_error",
                ex.getReason() == null ? "invalid_request" : ex.getReason());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> framework(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return body(status, "http_" + status.value(), ex.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> unexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal Server Error");
    }

    static HttpStatus statusOf(SimScanException ex) {
        if (ex instanceof ValidationException) return HttpStatus.BAD_REQUEST;
        if (ex instanceof UnauthorizedException) return HttpStatus.UNAUTHORIZED;
        if (ex instanceof ForbiddenException) return HttpStatus.FORBIDDEN;
        if (ex instanceof InsufficientCreditException) return HttpStatus.PAYMENT_REQUIRED;
        if (ex instanceof NotFoundException) return HttpStatus.NOT_FOUND;
        if (ex instanceof InvalidStateException) return HttpStatus.CONFLICT;
        if (ex instanceof StorageException) return HttpStatus.SERVICE_UNAVAILABLE;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String reason, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "status", "error",
                "reason", reason,
                "message", message == null ? reason : message,
                "ts", Instant.now().toString()
        ));
    }
}
