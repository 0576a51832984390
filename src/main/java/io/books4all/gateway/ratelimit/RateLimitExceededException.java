package io.books4all.gateway.ratelimit;

import io.books4all.gateway.auth.AuthErrorCode;
import io.books4all.gateway.auth.AuthException;
import java.util.Map;

public class RateLimitExceededException extends AuthException {
  private final RateLimitDecision decision;

  private RateLimitExceededException(
      AuthErrorCode code, String message, int httpStatus, RateLimitDecision decision, String scope) {
    super(
        code,
        message,
        httpStatus,
        (int) Math.max(1, decision.retryAfterSeconds()),
        Map.of("scope", scope));
    this.decision = decision;
  }

  public static RateLimitExceededException from(RateLimitDecision decision, String scope) {
    if (decision.storeUnavailable()) {
      return new RateLimitExceededException(
          AuthErrorCode.RATE_LIMITER_UNAVAILABLE, "rate limiter unavailable", 503, decision, scope);
    }
    return new RateLimitExceededException(
        AuthErrorCode.RATE_LIMITED,
        "Rate limit exceeded. Try again in " + decision.retryAfterSeconds() + " seconds.",
        429,
        decision,
        scope);
  }

  public RateLimitDecision getDecision() {
    return decision;
  }
}
