package com.scholary.captions.api;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions thrown by the API to error responses.
 *
 * <p>Invalid requests (bad format name, malformed source, failed validation) are 400; a full job
 * queue is 503.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  /** Error body returned for every handled exception. */
  public record ErrorResponse(String error, Map<String, String> details) {}

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    Map<String, String> errors = new LinkedHashMap<>();
    for (FieldError error : ex.getBindingResult().getFieldErrors()) {
      errors.put(error.getField(), error.getDefaultMessage());
    }
    LOGGER.warn("Validation failed: {}", errors);
    return ResponseEntity.badRequest().body(new ErrorResponse("Validation failed", errors));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    LOGGER.warn("Invalid request: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse(ex.getMessage(), Map.of()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("Malformed request body", Map.of()));
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<ErrorResponse> handleRejected(TaskRejectedException ex) {
    LOGGER.warn("Job queue full: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ErrorResponse("Too many caption jobs in progress, try again later", Map.of()));
  }
}
