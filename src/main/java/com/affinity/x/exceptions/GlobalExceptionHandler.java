package com.affinity.x.exceptions;

import com.affinity.x.dto.MatchResponse;
import com.affinity.x.dto.PerformanceBlock;
import com.affinity.x.monitoring.RequestTimingFilter;
import com.affinity.x.utils.basic.ErrorUtility;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;


/**
 * Global exception handler for handling various exceptions in the application.
 * <p>
 * Every error leaves as a {@link MatchResponse} envelope with {@code success=false}, a stable
 * {@link ErrorCode}, a client-safe message and the elapsed time of the request. Stack traces
 * are logged, never returned.
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final String GENERIC_ERROR_MESSAGE = "An unexpected error occurred";

    /**
     * Handles every {@link ServiceException} with the status and code the exception carries.
     *
     * @param e       the {@link ServiceException} to be handled.
     * @param request the failed request.
     * @return a {@link ResponseEntity} containing the error envelope.
     */
    @ExceptionHandler(ServiceException.class)
    public ResponseEntity<MatchResponse<Void>> handleServiceException(ServiceException e, HttpServletRequest request) {
        if (e.getStatus().is5xxServerError()) {
            log.error("Request {} failed with code={}", request.getRequestURI(), e.getErrorCode(), e);
        } else {
            log.warn("Request {} rejected with code={}: {}", request.getRequestURI(), e.getErrorCode(), e.getMessage());
        }
        return envelope(e.getErrorCode(), e.getMessage(), e.getStatus(), request);
    }

    /**
     * Handles {@link MethodArgumentNotValidException} and returns a HTTP 400 Bad Request response with validation errors.
     *
     * @param ex      the {@link MethodArgumentNotValidException} to be handled.
     * @param request the failed request.
     * @return a {@link ResponseEntity} containing the validation errors and a HTTP 400 status.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<MatchResponse<Void>> handleValidationException(MethodArgumentNotValidException ex, HttpServletRequest request) {
        BindingResult bindingResult = ex.getBindingResult();
        StringBuilder errorMessage = new StringBuilder("Invalid request parameters:");

        for (FieldError fieldError : bindingResult.getFieldErrors()) {
            errorMessage.append(" Field '").append(fieldError.getField())
                    .append("' ").append(fieldError.getDefaultMessage()).append(";");
        }
        return envelope(ErrorCode.INVALID_INPUT, errorMessage.toString(), HttpStatus.BAD_REQUEST, request);
    }

    /**
     * Handles unreadable request bodies such as malformed JSON, bad UUIDs or unknown enum values.
     *
     * @param e       the {@link HttpMessageNotReadableException} to be handled.
     * @param request the failed request.
     * @return a {@link ResponseEntity} with a HTTP 400 status.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<MatchResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException e, HttpServletRequest request) {
        log.warn("Unreadable body for {}: {}", request.getRequestURI(), e.getMostSpecificCause().getMessage());
        return envelope(ErrorCode.INVALID_INPUT, "Malformed request body", HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<MatchResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException e, HttpServletRequest request) {
        return envelope(ErrorCode.INVALID_INPUT, "Invalid value for parameter '" + e.getName() + "'", HttpStatus.BAD_REQUEST, request);
    }

    /**
     * Handles anything not mapped above as a HTTP 500 with a generic message.
     *
     * @param e       the unexpected exception.
     * @param request the failed request.
     * @return a {@link ResponseEntity} with a HTTP 500 status.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<MatchResponse<Void>> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("Unexpected failure for {}", request.getRequestURI(), e);
        return envelope(ErrorCode.INTERNAL_ERROR, GENERIC_ERROR_MESSAGE, HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    private ResponseEntity<MatchResponse<Void>> envelope(ErrorCode code, String message, HttpStatus status, HttpServletRequest request) {
        PerformanceBlock performance = PerformanceBlock.builder()
                .responseTimeMs(RequestTimingFilter.elapsedMs(request))
                .cacheUsed(false)
                .build();
        MatchResponse<Void> body = MatchResponse.failure(ErrorUtility.getError(code, message, status), performance);
        return new ResponseEntity<>(body, status);
    }
}
