package com.dmarcradar.api.controller;

import com.dmarcradar.api.dto.ErrorBody;
import com.dmarcradar.classification.sender.ThirdPartySenderException;
import com.dmarcradar.ingestion.InvalidReportInputException;
import com.dmarcradar.reprocessing.ReprocessingJobNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps domain and validation failures to ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && msg.matches("[A-Z_]+"))
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(InvalidReportInputException.class)
    public ResponseEntity<ErrorBody> handleInvalidReport(InvalidReportInputException ex) {
        log.info("Rejected report upload: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REPORT", ex.getMessage()));
    }

    @ExceptionHandler(ThirdPartySenderException.class)
    public ResponseEntity<ErrorBody> handleSender(ThirdPartySenderException ex) {
        HttpStatus status = ThirdPartySenderException.SENDER_NOT_FOUND.equals(ex.getErrorCode())
                ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(ReprocessingJobNotFoundException.class)
    public ResponseEntity<ErrorBody> handleJobNotFound(ReprocessingJobNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("JOB_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }
}
