package io.books4all.gateway.auth;

import jakarta.validation.ConstraintViolationException;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

@RestControllerAdvice(basePackages = "io.books4all.gateway")
public class AuthExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(AuthExceptionHandler.class);

  private final Clock clock;

  public AuthExceptionHandler(Clock clock) {
    this.clock = clock;
  }

  @ExceptionHandler(AuthException.class)
  public ResponseEntity<Map<String, Object>> onAuthError(AuthException e) {
    if (!e.getDetails().isEmpty()) {
      log.debug("request rejected: code={} details={}", e.getCode(), e.getDetails());
    }
    HttpHeaders headers = new HttpHeaders();
    AuthErrorResponses.applyHeaders(e, headers);
    return ResponseEntity.status(e.getHttpStatus())
        .headers(headers)
        .body(AuthErrorResponses.body(e, clock));
  }

  @ExceptionHandler({
    ConstraintViolationException.class,
    BindException.class,
    WebExchangeBindException.class,
    ServerWebInputException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<Map<String, Object>> onBadRequest(Exception e) {
    return ResponseEntity.badRequest()
        .body(
            Map.of(
                "ok", false,
                "code", AuthErrorCode.BAD_REQUEST.name(),
                "message", e.getMessage() == null ? "Invalid request" : e.getMessage(),
                "timestamp", clock.millis()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> onUnknown(Exception e) {
    log.error("gateway internal error", e);
    return ResponseEntity.status(500)
        .body(
            Map.of(
                "ok", false,
                "code", "INTERNAL_ERROR",
                "message", "Internal server error",
                "timestamp", clock.millis()));
  }
}
