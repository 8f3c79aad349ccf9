package com.hybridchat.ai.api;

import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * JSON error bodies for the chat and memory endpoints.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<Map<String, Object>> handleBadRequest(
      Exception ex,
      HttpServletRequest request) {
    HttpStatus status = HttpStatus.BAD_REQUEST;
    return ResponseEntity.status(status).body(body(status, ex.getMessage(), request));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleUnexpected(
      Exception ex,
      HttpServletRequest request) {
    log.error("Request failed path={}", request.getRequestURI(), ex);
    HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
    return ResponseEntity.status(status).body(body(status, "Error: " + ex.getMessage(), request));
  }

  private static Map<String, Object> body(HttpStatus status, String message, HttpServletRequest request) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("status", status.value());
    out.put("error", status.getReasonPhrase());
    out.put("message", message);
    out.put("path", request.getRequestURI());
    out.put("timestamp", Instant.now().toString());
    return out;
  }
}
