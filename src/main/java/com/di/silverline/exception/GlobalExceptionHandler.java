package com.di.silverline.exception;

import com.di.silverline.util.MdcPropagation;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the REST layer to a structured body. Bad input (unparseable date,
 * invalid strategy) is a 400, anything else a 500. Per-table failures never get here; they are
 * reported inside the run summary.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class,
            IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("[CONTROLLER] bad request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, ErrorKind.UNKNOWN, e);
    }

    @ExceptionHandler(InvalidStrategyException.class)
    public ResponseEntity<ErrorResponse> handleInvalidStrategy(InvalidStrategyException e) {
        log.warn("[CONTROLLER] {}", e.getMessage());
        ResponseEntity<ErrorResponse> response = build(HttpStatus.BAD_REQUEST, e.getKind(), e);
        response.getBody().getDetails().put("problemsByTable", e.getProblemsByTable());
        return response;
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        ErrorKind kind = ErrorKind.categorize(e);
        log.error("[CONTROLLER] unhandled {} [{}]", e.getClass().getSimpleName(), kind, e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, kind, e);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, ErrorKind kind, Exception e) {
        ErrorResponse body = new ErrorResponse();
        body.setTimestamp(Instant.now().toString());
        body.setStatus(status.value());
        body.setError(status.getReasonPhrase());
        body.setMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        body.setErrorKind(kind.name());
        body.setRunId(MDC.get(MdcPropagation.RUN_ID));
        body.getDetails().put("exceptionType", e.getClass().getName());
        return ResponseEntity.status(status).body(body);
    }

    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorKind;
        private String runId;
        private Map<String, Object> details = new LinkedHashMap<>();
    }
}
