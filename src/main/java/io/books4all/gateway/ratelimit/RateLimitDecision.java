package io.books4all.gateway.ratelimit;

public record RateLimitDecision(
    boolean admitted,
    int limit,
    int remaining,
    long retryAfterSeconds,
    long resetEpochSeconds,
    boolean storeUnavailable) {

  public static RateLimitDecision admit(int limit, int remaining, long resetEpochSeconds) {
    return new RateLimitDecision(true, limit, remaining, 0, resetEpochSeconds, false);
  }

  public static RateLimitDecision reject(int limit, long retryAfterSeconds, long nowEpochSeconds) {
    return new RateLimitDecision(
        false, limit, 0, retryAfterSeconds, nowEpochSeconds + retryAfterSeconds, false);
  }

  public static RateLimitDecision unavailable(
      RateLimitFailureMode mode, int limit, long periodSeconds, long nowEpochSeconds) {
    if (mode == RateLimitFailureMode.OPEN) {
      return new RateLimitDecision(true, limit, limit, 0, nowEpochSeconds + periodSeconds, true);
    }
    return new RateLimitDecision(
        false, limit, 0, periodSeconds, nowEpochSeconds + periodSeconds, true);
  }
}
