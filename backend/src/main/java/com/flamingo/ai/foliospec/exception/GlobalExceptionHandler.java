package com.flamingo.ai.foliospec.exception;

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
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentConversionException.class)
  public ResponseEntity<ApiError> handleDocumentConversion(
      DocumentConversionException ex, HttpServletRequest request) {

    incrementErrorCounter("document_conversion");
    String errorId = generateErrorId();
    log.error(
        "Document conversion error [{}] for {}: {}",
        errorId,
        ex.getDocumentId(),
        ex.getMessage(),
        ex);

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.CONVERSION_FAILED)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(BlobStoreException.class)
  public ResponseEntity<ApiError> handleBlobStore(
      BlobStoreException ex, HttpServletRequest request) {

    incrementErrorCounter("blob_store");
    String errorId = generateErrorId();
    log.error(
        "Blob store error [{}] on {}/{}: {}",
        errorId,
        ex.getBucket(),
        ex.getKey(),
        ex.getMessage(),
        ex);

    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.STORAGE_UNAVAILABLE)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
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

    return badRequest(errorId, message, request);
  }

  @ExceptionHandler(MissingServletRequestPartException.class)
  public ResponseEntity<ApiError> handleMissingPart(
      MissingServletRequestPartException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Missing request part [{}]: {}", errorId, ex.getRequestPartName());

    return badRequest(errorId, ex.getRequestPartName() + ": is required", request);
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

  private ResponseEntity<ApiError> badRequest(
      String errorId, String message, HttpServletRequest request) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
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
