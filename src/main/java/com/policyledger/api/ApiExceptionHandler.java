package com.policyledger.api;

import com.policyledger.audit.ConcurrentAppendException;
import com.policyledger.audit.SealedLogException;
import com.policyledger.chain.ChainIntegrityException;
import com.policyledger.contract.ValidationException;
import com.policyledger.policy.engine.PolicyConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error responses.
 *
 * All errors follow the machine-readable format:
 * {
 *   "error_code": "VALIDATION_ERROR",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 * Chain integrity violations also carry {@code first_invalid_sequence}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(ValidationException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        return errorResponse("VALIDATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NotFoundException ex) {
        return errorResponse("NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(PolicyConflictException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handlePolicyConflict(PolicyConflictException ex) {
        log.warn("Policy conflict: {}", ex.getMessage());
        return errorResponse("POLICY_CONFLICT", ex.getMessage());
    }

    @ExceptionHandler(SealedLogException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleSealed(SealedLogException ex) {
        log.warn("Append rejected: {}", ex.getMessage());
        return errorResponse("LOG_SEALED", ex.getMessage());
    }

    @ExceptionHandler(ChainIntegrityException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleChainIntegrity(ChainIntegrityException ex) {
        log.warn("Chain integrity violation: {}", ex.getMessage());
        Map<String, Object> body = errorResponse("CHAIN_INTEGRITY_VIOLATION", ex.getMessage());
        body.put("first_invalid_sequence", ex.getFirstInvalidSequence());
        return body;
    }

    @ExceptionHandler(ConcurrentAppendException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleConcurrentAppend(ConcurrentAppendException ex) {
        log.warn("Append contention: {}", ex.getMessage());
        return errorResponse("CONCURRENT_APPEND", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
