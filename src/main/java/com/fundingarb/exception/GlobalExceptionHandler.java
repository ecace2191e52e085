package com.fundingarb.exception;

import com.fundingarb.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps engine failures onto {@link ApiErrorResponse}. Every engine error carries its symbol, venue
 * and whether the call may be retried as-is; a failed rollback is flagged for manual intervention.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.VALIDATION_ERROR, "Malformed request body", null, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.NOT_FOUND, ex.getMessage(), null, request);
    }

    @ExceptionHandler(RollbackException.class)
    public ResponseEntity<ApiErrorResponse> handleRollback(RollbackException ex, HttpServletRequest request) {
        log.error("EXPOSURE REMAINS on {} {} after failed rollback: {}", ex.getVenue(), ex.getSymbol(),
                ex.getMessage(), ex);
        Map<String, Object> details = engineDetails(ex);
        details.put("manualInterventionRequired", true);
        return buildResponse(ex.getErrorCode(), ex.getMessage(), details, request);
    }

    @ExceptionHandler(TradeExecutionException.class)
    public ResponseEntity<ApiErrorResponse> handleExecution(TradeExecutionException ex, HttpServletRequest request) {
        log.warn("Execution failure on {} ({}): {}", ex.getSymbol(), ex.getErrorCode().getCode(), ex.getMessage());
        return buildResponse(ex.getErrorCode(), ex.getMessage(), engineDetails(ex), request);
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleBase(BaseException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.getHttpStatus() >= 500) {
            log.error("Server error: {}", ex.getMessage(), ex);
        } else {
            log.warn("Client error: {}", ex.getMessage());
        }
        return buildResponse(errorCode, ex.getMessage(), engineDetails(ex), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error", ex);
        return buildResponse(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    private Map<String, Object> engineDetails(BaseException ex) {
        Map<String, Object> details = new HashMap<>(ex.getDetails());
        if (ex.getSymbol() != null) {
            details.put("symbol", ex.getSymbol());
        }
        if (ex.getVenue() != null) {
            details.put("venue", ex.getVenue());
        }
        details.put("retryable", ex.isRetryable());
        return details;
    }

    private ResponseEntity<ApiErrorResponse> buildResponse(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        ApiErrorResponse response = ApiErrorResponse.of(errorCode, message, details, request.getRequestURI());
        return ResponseEntity.status(errorCode.getHttpStatus()).body(response);
    }
}
