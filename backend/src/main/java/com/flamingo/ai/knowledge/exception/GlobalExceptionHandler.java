package com.flamingo.ai.knowledge.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn("Document not found [{}]: {}", errorId, ex.getDocumentId());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.DOCUMENT_NOT_FOUND,
        "Document not found",
        ex.getDocumentId(),
        request);
  }

  @ExceptionHandler(DuplicateDocumentException.class)
  public ResponseEntity<ApiError> handleDuplicate(
      DuplicateDocumentException ex, HttpServletRequest request) {

    incrementErrorCounter("document_duplicate");
    String errorId = generateErrorId();
    log.info("Duplicate document rejected [{}]: existing={}", errorId, ex.getExistingDocumentId());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.DOCUMENT_DUPLICATE,
        ex.getUserMessage(),
        ex.getExistingDocumentId(),
        request);
  }

  @ExceptionHandler(DocumentStateConflictException.class)
  public ResponseEntity<ApiError> handleStateConflict(
      DocumentStateConflictException ex, HttpServletRequest request) {

    incrementErrorCounter("document_state_conflict");
    String errorId = generateErrorId();
    log.warn("Document state conflict [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.DOCUMENT_STATE_CONFLICT,
        ex.getMessage(),
        ex.getDocumentId(),
        request);
  }

  @ExceptionHandler(ExtractionFailureException.class)
  public ResponseEntity<ApiError> handleExtractionFailure(
      ExtractionFailureException ex, HttpServletRequest request) {

    incrementErrorCounter("document_extraction");
    String errorId = generateErrorId();
    log.warn("Extraction failure [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_EXTRACTION_ERROR,
        ex.getMessage(),
        ex.getDocumentId(),
        request);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("document_processing");
    String errorId = generateErrorId();
    log.error("Document processing error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_PROCESSING_ERROR,
        ex.getUserMessage(),
        ex.getDocumentId(),
        request);
  }

  @ExceptionHandler(ProcessingCancelledException.class)
  public ResponseEntity<ApiError> handleCancelled(
      ProcessingCancelledException ex, HttpServletRequest request) {

    incrementErrorCounter("processing_cancelled");
    String errorId = generateErrorId();
    log.info("Processing cancelled [{}]: {}", errorId, ex.getDocumentId());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.DOCUMENT_STATE_CONFLICT,
        ex.getMessage(),
        ex.getDocumentId(),
        request);
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<ApiError> handleTaskRejected(
      TaskRejectedException ex, HttpServletRequest request) {

    incrementErrorCounter("processing_queue_full");
    String errorId = generateErrorId();
    log.warn("Processing executor saturated [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.PROCESSING_QUEUE_FULL,
        "Processing queue is full. Please try again later.",
        null,
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), null, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        null,
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      UUID resourceId,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .resourceId(resourceId != null ? resourceId.toString() : null)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
