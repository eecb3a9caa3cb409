package com.fever.assessment.controller;

import com.fever.assessment.service.ConversationNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures of the assessment API to HTTP statuses. Dialogue failures never get here; the
 * conversation degrades to local mode instead.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
  private static final int MAX_MESSAGE_LENGTH = 300;

  @ExceptionHandler(ConversationNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(ConversationNotFoundException ex,
                                                            HttpServletRequest request) {
    log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
        resolvePath(request), resolveMethod(request), ex.getClass().getSimpleName(),
        ex.getMessage());
    return body(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler({
      MethodArgumentNotValidException.class,
      BindException.class,
      HttpMessageNotReadableException.class,
      IllegalArgumentException.class
  })
  public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex,
                                                              HttpServletRequest request) {
    String message = truncate(ex.getMessage() == null ? "Invalid request" : ex.getMessage());
    log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
        resolvePath(request), resolveMethod(request), ex.getClass().getSimpleName(), message);
    return body(HttpStatus.BAD_REQUEST, message);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, String>> handleUnknown(Exception ex,
                                                           HttpServletRequest request) {
    log.error("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
        resolvePath(request), resolveMethod(request), ex.getClass().getSimpleName(),
        truncate(ex.getMessage()), ex);
    return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error");
  }

  private static ResponseEntity<Map<String, String>> body(HttpStatus status, String message) {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("error", status.getReasonPhrase());
    body.put("message", message);
    return ResponseEntity.status(status).body(body);
  }

  private static String resolvePath(HttpServletRequest request) {
    return request == null ? "-" : request.getRequestURI();
  }

  private static String resolveMethod(HttpServletRequest request) {
    return request == null ? "-" : request.getMethod();
  }

  private static String truncate(String text) {
    if (text == null || text.length() <= MAX_MESSAGE_LENGTH) {
      return text;
    }
    return text.substring(0, MAX_MESSAGE_LENGTH);
  }
}
