package com.cyberx.vpnpool.api.exception;

import com.cyberx.vpnpool.common.wireguard.MalformedConfigException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({BadRequestException.class, IllegalArgumentException.class, MalformedConfigException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException e) {
        log.warn("Bad request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Malformed request: " + e.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing caller identity header: {}", e.getHeaderName());
        return error(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Missing required header " + e.getHeaderName());
    }

    @ExceptionHandler(CredentialNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(CredentialNotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(StillAssignedException.class)
    public ResponseEntity<ErrorResponse> handleStillAssigned(StillAssignedException e) {
        log.warn("Credential {} still assigned: {}", e.getCredentialId(), e.getMessage());
        return error(HttpStatus.CONFLICT, "STILL_ASSIGNED", e.getMessage());
    }

    @ExceptionHandler(CredentialRevokedException.class)
    public ResponseEntity<ErrorResponse> handleRevoked(CredentialRevokedException e) {
        log.warn("Credential {} revoked: {}", e.getCredentialId(), e.getMessage());
        return error(HttpStatus.CONFLICT, "CREDENTIAL_REVOKED", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = ((FieldError) error).getField();
            String errorMessage = error.getDefaultMessage();
            errors.put(fieldName, errorMessage);
        });

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("errorCode", "VALIDATION_ERROR");
        response.put("message", "Validation failed");
        response.put("errors", errors);
        response.put("timestamp", LocalDateTime.now(ZoneOffset.UTC));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolation(DataIntegrityViolationException e) {
        // Typically two imports racing on the same file_hash; the loser rolled back and can retry
        log.warn("Data integrity violation: {}", e.getMostSpecificCause().getMessage());
        return error(HttpStatus.CONFLICT, "CONFLICT",
            "Concurrent modification detected. Nothing was changed; please retry.");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException e) {
        log.error("Database access error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "DATABASE_ERROR", "Database error occurred. Please try again.");
    }

    @ExceptionHandler(TransactionException.class)
    public ResponseEntity<ErrorResponse> handleTransactionException(TransactionException e) {
        log.error("Transaction error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "TRANSACTION_ERROR", "Transaction error occurred. Please try again.");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
            e.getMessage() != null ? e.getMessage() : "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String errorCode, String message) {
        return ResponseEntity.status(status)
            .body(new ErrorResponse(errorCode, message, LocalDateTime.now(ZoneOffset.UTC)));
    }

    /**
     * Body of every non-2xx answer. Validation failures add a per-field {@code errors} map.
     */
    @Getter
    @RequiredArgsConstructor
    public static class ErrorResponse {
        private final boolean success = false;
        private final String errorCode;
        private final String message;
        private final LocalDateTime timestamp;
    }
}
