package io.books4all.gateway.ratelimit;

/** What the limiter does when the shared store cannot be reached. */
public enum RateLimitFailureMode {
  /** Admit the request. */
  OPEN,
  /** Reject the request. */
  CLOSED
}
