package com.showapp.common.exception;

import com.showapp.common.web.RequestTraceInterceptor;
import com.showapp.show.dto.common.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.*;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        log.debug("Not found: code={} message={}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(buildError(ex.getMessage(), ex.getErrorCode(), ex.getDetails()));
    }

    // A path segment that cannot even be converted (e.g. a non-numeric year) names nothing we have.
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        boolean year = "year".equals(ex.getName());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put(ex.getName(), String.valueOf(ex.getValue()));

        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(buildError(
                        year ? "We don't have shows for that year" : "Not found",
                        year ? ShowErrorCodes.YEAR_NOT_FOUND : NotFoundException.DEFAULT_CODE,
                        details));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(buildError("Not found", NotFoundException.DEFAULT_CODE, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex) {
        log.warn("Unexpected error while handling request", ex);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildError("Unexpected error", "INTERNAL_SERVER_ERROR", details));
    }

    private ErrorResponse buildError(String message, String errorCode, Map<String, Object> details) {
        return ErrorResponse.builder()
                .message(message)
                .errorCode(errorCode)
                .details((details == null || details.isEmpty()) ? null : details)
                .traceId(getOrCreateTraceId())
                .build();
    }

    private String getOrCreateTraceId() {
        String traceId = MDC.get(RequestTraceInterceptor.TRACE_ID);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
            MDC.put(RequestTraceInterceptor.TRACE_ID, traceId);
        }
        return traceId;
    }
}
