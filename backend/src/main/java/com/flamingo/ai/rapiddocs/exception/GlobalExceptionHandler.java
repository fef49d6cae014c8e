package com.flamingo.ai.rapiddocs.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(GenerationValidationException.class)
  public ResponseEntity<ApiError> handleGenerationValidation(
      GenerationValidationException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Generation request rejected [{}]: {}", errorId, ex.getErrors());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(ex.getErrors().isEmpty() ? "Validation failed" : ex.getErrors().get(0))
                .details(ex.getErrors())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    List<String> details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .sorted()
            .toList();
    String message = details.isEmpty() ? "Validation failed" : details.get(0);

    log.warn("Validation error [{}]: {}", errorId, message);

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(message)
                .details(details)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message("Request body is missing or malformed")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(CriticalStageException.class)
  public ResponseEntity<ApiError> handleCriticalStage(
      CriticalStageException ex, HttpServletRequest request) {

    String errorId = generateErrorId();
    DataImportException importFailure = findCause(ex, DataImportException.class);
    if (importFailure != null) {
      incrementErrorCounter("import_error");
      log.warn(
          "Import failed [{}] in job {}: {}", errorId, ex.getJobId(), importFailure.getMessage());
      return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
          .body(
              ApiError.builder()
                  .errorId(errorId)
                  .code(ApiError.IMPORT_FAILED)
                  .message(importFailure.getMessage())
                  .jobId(ex.getJobId())
                  .path(request.getRequestURI())
                  .timestamp(Instant.now())
                  .build());
    }

    LlmServiceException llmFailure = findCause(ex, LlmServiceException.class);
    if (llmFailure != null) {
      return llmFailure(llmFailure, errorId, ex.getJobId(), request);
    }

    incrementErrorCounter("generation_error");
    log.error("Generation failed [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.GENERATION_FAILED)
                .message(ex.getUserMessage())
                .jobId(ex.getJobId())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {
    return llmFailure(ex, generateErrorId(), null, request);
  }

  private ResponseEntity<ApiError> llmFailure(
      LlmServiceException ex, String errorId, String jobId, HttpServletRequest request) {

    boolean rateLimited = ex.isRateLimited();
    incrementErrorCounter(rateLimited ? "llm_rate_limited" : "llm_error");
    log.error("LLM provider failed [{}] in job {}: {}", errorId, jobId, ex.getMessage(), ex);

    HttpStatus status = rateLimited ? HttpStatus.TOO_MANY_REQUESTS : HttpStatus.BAD_GATEWAY;
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(rateLimited ? ApiError.LLM_RATE_LIMITED : ApiError.LLM_UNAVAILABLE)
                .message(ex.getUserMessage())
                .jobId(jobId)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(DataImportException.class)
  public ResponseEntity<ApiError> handleDataImport(
      DataImportException ex, HttpServletRequest request) {

    incrementErrorCounter("import_error");
    String errorId = generateErrorId();
    log.warn("Import failed [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.IMPORT_FAILED)
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(GeneratedFileNotFoundException.class)
  public ResponseEntity<ApiError> handleFileNotFound(
      GeneratedFileNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("file_not_found");
    String errorId = generateErrorId();
    log.warn("Generated file not found [{}]: {}", errorId, ex.getFileName());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.FILE_NOT_FOUND)
                .message("File not found")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private static <T extends Throwable> T findCause(Throwable ex, Class<T> type) {
    Throwable current = ex.getCause();
    while (current != null) {
      if (type.isInstance(current)) {
        return type.cast(current);
      }
      current = current.getCause();
    }
    return null;
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
