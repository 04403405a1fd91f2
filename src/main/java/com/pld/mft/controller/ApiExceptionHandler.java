package com.pld.mft.controller;

import com.pld.mft.catalog.exception.DomainViolationException;
import com.pld.mft.catalog.exception.ReferentialIntegrityViolationException;
import com.pld.mft.catalog.exception.RowNotFoundException;
import com.pld.mft.catalog.exception.SchemaViolationException;
import com.pld.mft.catalog.exception.UniquenessViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@Slf4j
@RestControllerAdvice(basePackageClasses = ApiExceptionHandler.class)
public class ApiExceptionHandler {

  @ExceptionHandler(DomainViolationException.class)
  public ResponseEntity<Map<String, Object>> handleDomainViolation(DomainViolationException e) {
    log.warn("Domain violation: {}", e.getMessage());
    return ResponseEntity.badRequest().body(violationBody(e));
  }

  @ExceptionHandler({
    ReferentialIntegrityViolationException.class,
    UniquenessViolationException.class
  })
  public ResponseEntity<Map<String, Object>> handleConflict(SchemaViolationException e) {
    log.warn("Write rejected: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(violationBody(e));
  }

  @ExceptionHandler(RowNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(RowNotFoundException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorBody(e.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadableBody(
      HttpMessageNotReadableException e) {
    log.warn("Unreadable request body: {}", e.getMessage());
    return ResponseEntity.badRequest()
        .body(errorBody("Request body is not valid JSON for this resource."));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
    log.warn("Bad request: {}", e.getMessage());
    return ResponseEntity.badRequest().body(errorBody(e.getMessage()));
  }

  @ExceptionHandler(SecurityException.class)
  public ResponseEntity<Map<String, Object>> handleSecurity(SecurityException e) {
    log.warn("Upload rejected by file checks: {}", e.getMessage());
    return ResponseEntity.badRequest().body(errorBody("The uploaded file failed security checks."));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<Map<String, Object>> handleMaxUploadSize(MaxUploadSizeExceededException e) {
    log.warn("Upload too large: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(errorBody("The uploaded file exceeds the size limit."));
  }

  @ExceptionHandler({MultipartException.class, MissingServletRequestPartException.class})
  public ResponseEntity<Map<String, Object>> handleMultipartException(Exception e) {
    log.warn("Malformed multipart request: {}", e.getMessage());
    return ResponseEntity.badRequest()
        .body(errorBody("The multipart request could not be processed."));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
    log.error("Request failed", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(errorBody("An unexpected error occurred. Contact the administrator."));
  }

  private Map<String, Object> violationBody(SchemaViolationException e) {
    Map<String, Object> body = new LinkedHashMap<>(errorBody(e.getMessage()));
    body.put("table", e.getTable());
    body.put("column", e.getColumn());
    body.put("value", e.getRejectedValue());
    return body;
  }

  private Map<String, Object> errorBody(String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", false);
    body.put("message", message);
    return body;
  }
}
