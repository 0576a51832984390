package io.books4all.gateway.auth;

import java.util.Map;

/**
 * Terminal rejection of the current request. None of these are retried internally; only {@link
 * AuthErrorCode#RATE_LIMITED} is meant to be retried by the caller after {@link
 * #getRetryAfterSeconds()}.
 */
public class AuthException extends RuntimeException {
  private final AuthErrorCode code;
  private final int httpStatus;
  private final Integer retryAfterSeconds;
  private final Map<String, Object> details;

  public AuthException(AuthErrorCode code, String message, int httpStatus) {
    this(code, message, httpStatus, null, Map.of());
  }

  public AuthException(AuthErrorCode code, String message, int httpStatus, Integer retryAfterSeconds) {
    this(code, message, httpStatus, retryAfterSeconds, Map.of());
  }

  public AuthException(
      AuthErrorCode code,
      String message,
      int httpStatus,
      Integer retryAfterSeconds,
      Map<String, Object> details) {
    super(message);
    this.code = code;
    this.httpStatus = httpStatus;
    this.retryAfterSeconds = retryAfterSeconds;
    this.details = details == null ? Map.of() : details;
  }

  public static AuthException unauthenticated(String message) {
    return new AuthException(AuthErrorCode.UNAUTHENTICATED, message, 401);
  }

  public static AuthException invalidToken() {
    return new AuthException(AuthErrorCode.TOKEN_INVALID, "invalid token", 401);
  }

  public static AuthException disabled() {
    return new AuthException(AuthErrorCode.ACCOUNT_DISABLED, "account is disabled", 403);
  }

  public static AuthException emailNotVerified() {
    return new AuthException(AuthErrorCode.EMAIL_NOT_VERIFIED, "email not verified", 403);
  }

  public static AuthException badCredentials() {
    return new AuthException(AuthErrorCode.UNAUTHENTICATED, "incorrect email or password", 401);
  }

  public AuthErrorCode getCode() {
    return code;
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  public Integer getRetryAfterSeconds() {
    return retryAfterSeconds;
  }

  public Map<String, Object> getDetails() {
    return details;
  }

  public boolean isAuthenticationFailure() {
    return httpStatus == 401;
  }
}
