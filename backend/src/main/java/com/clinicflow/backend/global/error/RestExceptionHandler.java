package com.clinicflow.backend.global.error;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@ControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblemException(ProblemException ex, HttpServletRequest request) {
        HttpStatus status = resolveStatus(ex.getStatusCode());
        ProblemResponse body = ProblemResponse.of(
                status,
                ex.getCode(),
                ex.getDetailMessage(),
                request.getRequestURI(),
                ex.getProperties()
        );
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (ex instanceof RetryableProblemException retryable) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryable.getRetryAfterSeconds()));
        }
        return builder.body(body);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleResponseStatusException(ResponseStatusException ex,
                                                                         HttpServletRequest request) {
        HttpStatus status = resolveStatus(ex.getStatusCode());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        ProblemResponse body = ProblemResponse.of(status, message, message, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(MethodArgumentNotValidException ex,
                                                                     HttpServletRequest request) {
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String detail = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : "Validation failed";
        ProblemResponse body = ProblemResponse.of(status, ErrorCode.VALIDATION_ERROR.name(), detail,
                request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ProblemResponse> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemResponse body = ProblemResponse.of(status, ErrorCode.VALIDATION_ERROR.name(), ex.getMessage(),
                request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ProblemResponse> handleOptimisticLock(ObjectOptimisticLockingFailureException ex,
                                                                HttpServletRequest request) {
        HttpStatus status = HttpStatus.CONFLICT;
        ProblemResponse body = ProblemResponse.of(status, ErrorCode.VERSION_CONFLICT.name(),
                "The record was modified by another request", request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemResponse body = ProblemResponse.of(status, ErrorCode.INTERNAL_ERROR.name(),
                "Unexpected server error", request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    private static HttpStatus resolveStatus(HttpStatusCode statusCode) {
        return statusCode instanceof HttpStatus httpStatus
                ? httpStatus
                : HttpStatus.valueOf(statusCode.value());
    }
}
