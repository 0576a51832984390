package io.books4all.gateway.ratelimit;

import io.books4all.gateway.auth.GateMetrics;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sliding-window rate limiter over a shared {@link RateLimitStore}.
 *
 * <p>Each evaluation trims the key's timestamps to the trailing period, counts what is left, records
 * the current request and refreshes the key expiry, all in one atomic store call. A request is
 * rejected when the count taken before recording it has already reached the quota. Rejected
 * requests are recorded too, so a client that keeps hammering stays limited.
 *
 * <p>Blocking: {@link #evaluate} performs network I/O and must run off the event loop.
 */
@Service
public class SlidingWindowRateLimiter {
  private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);
  public static final String GLOBAL_ENDPOINT = "global";
  private static final int ENDPOINT_HASH_HEX_CHARS = 16;

  private final RateLimitStore store;
  private final RateLimitProperties properties;
  private final Clock clock;
  private final GateMetrics metrics;

  public SlidingWindowRateLimiter(
      RateLimitStore store, RateLimitProperties properties, Clock clock, GateMetrics metrics) {
    this.store = store;
    this.properties = properties;
    this.clock = clock;
    this.metrics = metrics;
  }

  public RateLimitDecision evaluate(String identifier, String endpoint, RateLimitRule rule) {
    return evaluate(identifier, endpoint, rule.maxCalls(), rule.periodSeconds());
  }

  public RateLimitDecision evaluate(
      String identifier, String endpoint, int maxCalls, long periodSeconds) {
    if (!properties.isEnabled()) {
      return RateLimitDecision.admit(maxCalls, maxCalls, clock.instant().getEpochSecond() + periodSeconds);
    }
    if (maxCalls < 1 || periodSeconds < 1) {
      throw new IllegalArgumentException("maxCalls and periodSeconds must be >= 1");
    }

    double now = clock.millis() / 1000.0;
    long nowSeconds = (long) Math.floor(now);
    String key = keyFor(identifier, endpoint);

    RateLimitStore.WindowSnapshot snapshot;
    try {
      snapshot = store.record(key, now, now - periodSeconds, periodSeconds);
    } catch (RuntimeException e) {
      RateLimitFailureMode mode = properties.getFailureMode();
      log.warn("rate limit store unavailable, failing {}: key={}", mode, key, e);
      metrics.limiterStoreUnavailable(mode.name().toLowerCase());
      return RateLimitDecision.unavailable(mode, maxCalls, periodSeconds, nowSeconds);
    }

    long count = snapshot.countBeforeInsert();
    if (count >= maxCalls) {
      return RateLimitDecision.reject(maxCalls, retryAfter(now, snapshot.oldestScore(), periodSeconds), nowSeconds);
    }
    int remaining = (int) (maxCalls - count - 1);
    return RateLimitDecision.admit(maxCalls, remaining, nowSeconds + periodSeconds);
  }

  /** Blanket per-client ceiling shared by every route. */
  public RateLimitDecision evaluateGlobal(String identifier, int maxCalls, long periodSeconds) {
    return evaluate(identifier, GLOBAL_ENDPOINT, maxCalls, periodSeconds);
  }

  public RateLimitDecision evaluateGlobal(String identifier) {
    return evaluate(identifier, GLOBAL_ENDPOINT, properties.getGlobal().rule());
  }

  public boolean isExempt(String path) {
    if (path == null) return false;
    return properties.getGlobal().getExemptPaths().stream().anyMatch(path::startsWith);
  }

  /** Administrative override: forgets every recorded request for the key. */
  public void reset(String identifier, String endpoint) {
    String key = keyFor(identifier, endpoint);
    store.delete(key);
    log.info("rate limit window reset: key={}", key);
  }

  public String keyFor(String identifier, String endpoint) {
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("identifier required");
    }
    String path = endpoint == null ? "" : endpoint;
    return properties.getKeyPrefix() + identifier + ":" + sha256Hex(path).substring(0, ENDPOINT_HASH_HEX_CHARS);
  }

  static long retryAfter(double now, Double oldestScore, long periodSeconds) {
    if (oldestScore == null) return periodSeconds;
    return (long) Math.ceil(periodSeconds - (now - oldestScore)) + 1;
  }

  private static String sha256Hex(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] out = digest.digest(value.getBytes(StandardCharsets.UTF_8));
      StringBuilder sb = new StringBuilder();
      for (byte b : out) {
        sb.append(String.format("%02x", b));
      }
      return sb.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
  }
}
