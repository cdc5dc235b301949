package com.contextbus.api;

import com.contextbus.orchestration.InvalidSubmissionException;
import com.contextbus.scheduler.PhaseOrderViolationException;
import com.contextbus.session.AlreadyRunningException;
import com.contextbus.session.UnknownSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * All errors follow the machine-readable format:
 * {
 *   "error_code": "ALREADY_RUNNING",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AlreadyRunningException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleAlreadyRunning(AlreadyRunningException ex) {
        log.info("Submission rejected: {}", ex.getMessage());
        Map<String, Object> body = errorResponse("ALREADY_RUNNING", ex.getMessage());
        body.put("active_session_id", ex.getActiveSessionId());
        return body;
    }

    @ExceptionHandler(UnknownSessionException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleUnknownSession(UnknownSessionException ex) {
        return errorResponse("UNKNOWN_SESSION", ex.getMessage());
    }

    @ExceptionHandler(InvalidSubmissionException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidSubmission(InvalidSubmissionException ex) {
        log.warn("Invalid submission: {}", ex.getMessage());
        return errorResponse("INVALID_SUBMISSION", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
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

    @ExceptionHandler(PhaseOrderViolationException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handlePhaseOrder(PhaseOrderViolationException ex) {
        log.error("Phase order violation: {}", ex.getMessage());
        return errorResponse("PHASE_ORDER_VIOLATION", ex.getMessage());
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
