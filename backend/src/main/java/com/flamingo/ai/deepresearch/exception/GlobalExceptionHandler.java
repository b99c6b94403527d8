package com.flamingo.ai.deepresearch.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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

  @ExceptionHandler(ResearchSessionNotFoundException.class)
  public ResponseEntity<ApiError> handleSessionNotFound(
      ResearchSessionNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("session_not_found");
    String errorId = generateErrorId();
    log.warn("Research session not found [{}]: {}", errorId, ex.getSessionId());

    return build(
        HttpStatus.NOT_FOUND, errorId, ApiError.SESSION_NOT_FOUND, "Session not found", request);
  }

  @ExceptionHandler(InvalidSessionStateException.class)
  public ResponseEntity<ApiError> handleInvalidState(
      InvalidSessionStateException ex, HttpServletRequest request) {

    incrementErrorCounter("session_state_conflict");
    String errorId = generateErrorId();
    log.warn(
        "Command rejected [{}]: session={}, state={}: {}",
        errorId,
        ex.getSessionId(),
        ex.getState(),
        ex.getMessage());

    return build(
        HttpStatus.CONFLICT, errorId, ApiError.SESSION_STATE_CONFLICT, ex.getMessage(), request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "llm_rate_limited" : "llm_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    String code = ex.isRateLimited() ? ApiError.LLM_RATE_LIMITED : ApiError.LLM_UNAVAILABLE;
    return build(HttpStatus.SERVICE_UNAVAILABLE, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(SchemaValidationException.class)
  public ResponseEntity<ApiError> handleSchema(
      SchemaValidationException ex, HttpServletRequest request) {

    incrementErrorCounter("llm_schema_error");
    String errorId = generateErrorId();
    log.error("Structured output error [{}] ({}): {}", errorId, ex.getSchema(), ex.getMessage());

    return build(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.LLM_SCHEMA_ERROR,
        "The AI service returned an unreadable response.",
        request);
  }

  @ExceptionHandler({SearchProviderException.class, AllProvidersFailedException.class})
  public ResponseEntity<ApiError> handleSearch(RuntimeException ex, HttpServletRequest request) {

    incrementErrorCounter("search_error");
    String errorId = generateErrorId();
    log.error("Search error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SEARCH_FAILED,
        "Search is temporarily unavailable. Please try again.",
        request);
  }

  @ExceptionHandler(IndexWriteException.class)
  public ResponseEntity<ApiError> handleIndexWrite(
      IndexWriteException ex, HttpServletRequest request) {

    incrementErrorCounter("index_write_error");
    String errorId = generateErrorId();
    log.error("Index write error [{}] backend={}: {}", errorId, ex.getBackend(), ex.getMessage());

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.INDEX_WRITE_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(StageFatalException.class)
  public ResponseEntity<ApiError> handleStageFatal(
      StageFatalException ex, HttpServletRequest request) {

    incrementErrorCounter("stage_fatal");
    String errorId = generateErrorId();
    log.error("Stage {} failed [{}]: {}", ex.getStage(), errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.STAGE_FATAL, ex.getMessage(), request);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, IllegalArgumentException.class})
  public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex instanceof MethodArgumentNotValidException invalid
            ? invalid.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .orElse("Validation failed")
            : ex.getMessage();

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
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
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
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
