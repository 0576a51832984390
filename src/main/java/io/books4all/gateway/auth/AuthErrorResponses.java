package io.books4all.gateway.auth;

import java.time.Clock;
import java.util.Map;
import org.springframework.http.HttpHeaders;

/** Shared JSON body and headers for rejected requests, used by the controller advice and the filter. */
public final class AuthErrorResponses {
  public static final String BEARER_CHALLENGE = "Bearer";

  private AuthErrorResponses() {}

  /** Code shown to clients. Token failures are reported as plain authentication failures. */
  public static AuthErrorCode publicCode(AuthException e) {
    return e.getCode() == AuthErrorCode.TOKEN_INVALID ? AuthErrorCode.UNAUTHENTICATED : e.getCode();
  }

  public static Map<String, Object> body(AuthException e, Clock clock) {
    return Map.of(
        "ok", false,
        "code", publicCode(e).name(),
        "message", e.getMessage() == null ? "request rejected" : e.getMessage(),
        "retryAfterSeconds", e.getRetryAfterSeconds() == null ? 0 : e.getRetryAfterSeconds(),
        "timestamp", clock.millis());
  }

  public static void applyHeaders(AuthException e, HttpHeaders headers) {
    if (e.isAuthenticationFailure()) {
      headers.set(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE);
    }
    if (e.getRetryAfterSeconds() != null && e.getRetryAfterSeconds() > 0) {
      headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
    }
  }
}
