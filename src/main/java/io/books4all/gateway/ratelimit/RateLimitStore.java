package io.books4all.gateway.ratelimit;

/**
 * Shared store holding one ordered set of request timestamps per key. Implementations must run
 * {@link #record} as a single atomic unit with respect to other calls for the same key.
 */
public interface RateLimitStore {

  /**
   * Drops members scored at or below {@code windowStart}, counts the survivors, adds a member
   * scored {@code now}, sets the key expiry to {@code periodSeconds} and reports the pre-insert count
   * with the lowest surviving score.
   */
  WindowSnapshot record(String key, double now, double windowStart, long periodSeconds);

  void delete(String key);

  /** {@code oldestScore} is null when the set held no member. */
  record WindowSnapshot(long countBeforeInsert, Double oldestScore) {}
}
