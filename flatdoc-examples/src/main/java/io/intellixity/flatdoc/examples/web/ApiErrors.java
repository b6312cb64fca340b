package io.intellixity.flatdoc.examples.web;

import io.intellixity.flatdoc.persistence.error.DocumentNotFoundException;
import io.intellixity.flatdoc.persistence.error.FlatdocException;
import io.intellixity.flatdoc.persistence.error.InvalidArgumentException;
import io.intellixity.flatdoc.persistence.error.InvalidConditionException;
import io.intellixity.flatdoc.persistence.error.SchemaConflictException;
import io.intellixity.flatdoc.persistence.error.StorageFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps engine errors to HTTP statuses with a small JSON body. */
@RestControllerAdvice
public final class ApiErrors {
  private static final Logger log = LoggerFactory.getLogger(ApiErrors.class);

  public record ApiError(String error, String message) {}

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> notFound(DocumentNotFoundException e) {
    return body(HttpStatus.NOT_FOUND, "not_found", e);
  }

  @ExceptionHandler({InvalidArgumentException.class, InvalidConditionException.class})
  public ResponseEntity<ApiError> badRequest(FlatdocException e) {
    return body(HttpStatus.BAD_REQUEST, e instanceof InvalidConditionException ? "invalid_condition" : "invalid_argument", e);
  }

  @ExceptionHandler(SchemaConflictException.class)
  public ResponseEntity<ApiError> conflict(SchemaConflictException e) {
    return body(HttpStatus.CONFLICT, "schema_conflict", e);
  }

  @ExceptionHandler(StorageFailureException.class)
  public ResponseEntity<ApiError> storage(StorageFailureException e) {
    log.error("flatdoc.http storage_failure op={} table={}", e.operation(), e.table(), e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiError("storage_failure", "Storage operation " + e.operation() + " failed"));
  }

  private static ResponseEntity<ApiError> body(HttpStatus status, String kind, FlatdocException e) {
    log.debug("flatdoc.http {} status={} message={}", kind, status.value(), e.getMessage());
    return ResponseEntity.status(status).body(new ApiError(kind, e.getMessage()));
  }
}
