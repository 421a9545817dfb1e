package com.z254.magi.api;

import com.z254.magi.api.dto.ApiResponses;
import com.z254.magi.exception.DependencyNotReadyException;
import com.z254.magi.exception.InvalidRequestException;
import com.z254.magi.exception.ResourceNotFoundException;
import com.z254.magi.exception.StepFailedException;
import com.z254.magi.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.stream.Collectors;

/**
 * Maps failures to the {@code {ok: false, error}} envelope.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ApiResponses.Failure> handleInvalidRequest(InvalidRequestException e) {
        return respond(HttpStatus.BAD_REQUEST, new ApiResponses.Failure(e.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiResponses.Failure> handleBind(WebExchangeBindException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return respond(HttpStatus.BAD_REQUEST,
                new ApiResponses.Failure(message.isEmpty() ? "Request validation failed" : message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiResponses.Failure> handleInput(ServerWebInputException e) {
        return respond(HttpStatus.BAD_REQUEST, new ApiResponses.Failure(
                e.getReason() != null ? e.getReason() : "Malformed request"));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponses.Failure> handleNotFound(ResourceNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, new ApiResponses.Failure(e.getMessage()));
    }

    @ExceptionHandler(DependencyNotReadyException.class)
    public ResponseEntity<ApiResponses.Failure> handleNotReady(DependencyNotReadyException e) {
        return respond(HttpStatus.CONFLICT, new ApiResponses.Failure(e.getMessage()));
    }

    @ExceptionHandler(StepFailedException.class)
    public ResponseEntity<ApiResponses.Failure> handleStepFailed(StepFailedException e) {
        log.warn("Step {} failed: {}", e.getStep(), e.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                new ApiResponses.Failure(e.getMessage(), e.getDiagnostics()));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ApiResponses.Failure> handleStorage(StorageException e) {
        log.error("Storage failure", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, new ApiResponses.Failure(e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponses.Failure> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, new ApiResponses.Failure("Internal error"));
    }

    private static ResponseEntity<ApiResponses.Failure> respond(HttpStatus status, ApiResponses.Failure body) {
        return ResponseEntity.status(status).body(body);
    }
}
