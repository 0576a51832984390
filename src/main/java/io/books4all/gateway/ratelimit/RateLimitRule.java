package io.books4all.gateway.ratelimit;

/** Quota of {@code maxCalls} requests per trailing {@code periodSeconds}. */
public record RateLimitRule(int maxCalls, long periodSeconds) {
  public RateLimitRule {
    if (maxCalls < 1) throw new IllegalArgumentException("maxCalls must be >= 1");
    if (periodSeconds < 1) throw new IllegalArgumentException("periodSeconds must be >= 1");
  }
}
