package com.fintech.fxreconciliation.controller;

import com.fintech.fxreconciliation.dto.ErrorResponse;
import com.fintech.fxreconciliation.exception.CsvParseException;
import com.fintech.fxreconciliation.exception.ReconciliationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

/**
 * Maps rejected uploads to 400 responses with an {@link ErrorResponse} body.
 * Anything unexpected becomes a 500 with the same body shape.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handle malformed CSV rows
     */
    @ExceptionHandler(CsvParseException.class)
    public ResponseEntity<ErrorResponse> handleCsvParseError(CsvParseException ex, HttpServletRequest request) {
        log.warn("Rejected {} upload at row {}: {}", ex.getRecordKind(), ex.getRowNumber(), ex.getMessage());
        return badRequest(ex.getRecordKind() + " CSV error", ex.getMessage(), request);
    }

    /**
     * Handle empty or unreadable uploads
     */
    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<ErrorResponse> handleReconciliationError(ReconciliationException ex,
                                                                   HttpServletRequest request) {
        log.warn("Rejected reconciliation request: {}", ex.getMessage());
        return badRequest("Reconciliation Error", ex.getMessage(), request);
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MultipartException.class})
    public ResponseEntity<ErrorResponse> handleMultipartError(Exception ex, HttpServletRequest request) {
        log.warn("Invalid multipart request: {}", ex.getMessage());
        return badRequest("Invalid Upload", ex.getMessage(), request);
    }

    /**
     * Handle everything else. Framework exceptions that already carry a status
     * (unknown path, wrong method, unsupported media type) keep it.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpectedError(Exception ex, HttpServletRequest request) {
        if (ex instanceof org.springframework.web.ErrorResponse) {
            int code = ((org.springframework.web.ErrorResponse) ex).getStatusCode().value();
            HttpStatus status = HttpStatus.valueOf(code);
            log.warn("Request to {} failed with {}: {}", request.getRequestURI(), status.value(), ex.getMessage());
            return respond(status, status.getReasonPhrase(), ex.getMessage(), request);
        }
        log.error("Unexpected error processing {}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", request);
    }

    private ResponseEntity<ErrorResponse> badRequest(String error, String message, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, error, message, request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                  HttpServletRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(request.getRequestURI())
                .build();

        return ResponseEntity.status(status).body(errorResponse);
    }
}
