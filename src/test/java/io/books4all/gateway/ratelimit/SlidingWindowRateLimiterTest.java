package io.books4all.gateway.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.books4all.gateway.auth.AuthProperties;
import io.books4all.gateway.auth.GateMetrics;
import io.books4all.gateway.support.InMemoryRateLimitStore;
import io.books4all.gateway.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.data.redis.RedisConnectionFailureException;

class SlidingWindowRateLimiterTest {
  private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

  private MutableClock clock;
  private RateLimitProperties properties;
  private InMemoryRateLimitStore store;
  private SimpleMeterRegistry meterRegistry;
  private SlidingWindowRateLimiter limiter;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    properties = new RateLimitProperties();
    store = new InMemoryRateLimitStore();
    meterRegistry = new SimpleMeterRegistry();
    limiter = newLimiter(store);
  }

  @AfterEach
  void tearDown() {
    if (executor != null) executor.shutdownNow();
  }

  private SlidingWindowRateLimiter newLimiter(RateLimitStore backing) {
    return new SlidingWindowRateLimiter(
        backing, properties, clock, new GateMetrics(meterRegistry, new AuthProperties()));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 3, 10, 50})
  void burstUpToLimitIsAdmittedAndNextIsRejected(int maxCalls) {
    for (int i = 0; i < maxCalls; i++) {
      RateLimitDecision decision = limiter.evaluate("ip:10.0.0.1", "/books", maxCalls, 60);
      assertThat(decision.admitted()).isTrue();
      assertThat(decision.remaining()).isEqualTo(maxCalls - i - 1);
      assertThat(decision.retryAfterSeconds()).isZero();
    }

    RateLimitDecision rejected = limiter.evaluate("ip:10.0.0.1", "/books", maxCalls, 60);

    assertThat(rejected.admitted()).isFalse();
    assertThat(rejected.remaining()).isZero();
    assertThat(rejected.retryAfterSeconds()).isPositive();
  }

  @Test
  void loginScenarioCountsDownThenRejectsWithinWindow() {
    List<Integer> remaining = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      RateLimitDecision decision = limiter.evaluate("ip:203.0.113.7", "/login", 5, 60);
      assertThat(decision.admitted()).isTrue();
      remaining.add(decision.remaining());
      clock.advanceSeconds(2);
    }

    RateLimitDecision sixth = limiter.evaluate("ip:203.0.113.7", "/login", 5, 60);

    assertThat(remaining).containsExactly(4, 3, 2, 1, 0);
    assertThat(sixth.admitted()).isFalse();
    assertThat(sixth.remaining()).isZero();
    // oldest request is 10s old: ceil(60 - 10) + 1
    assertThat(sixth.retryAfterSeconds()).isEqualTo(51).isBetween(1L, 60L);
    assertThat(sixth.resetEpochSeconds()).isEqualTo(START.getEpochSecond() + 10 + 51);
  }

  @Test
  void windowSlidesOncePeriodHasPassedSinceOldestRequest() {
    for (int i = 0; i < 3; i++) {
      limiter.evaluate("user:alice", "/orders", 3, 10);
    }
    assertThat(limiter.evaluate("user:alice", "/orders", 3, 10).admitted()).isFalse();

    clock.advanceSeconds(10);
    RateLimitDecision afterWindow = limiter.evaluate("user:alice", "/orders", 3, 10);

    assertThat(afterWindow.admitted()).isTrue();
    assertThat(afterWindow.remaining()).isEqualTo(2);
  }

  @Test
  void partiallyExpiredWindowFreesOnlyTheOldSlots() {
    limiter.evaluate("user:bob", "/orders", 2, 10);
    clock.advanceSeconds(6);
    limiter.evaluate("user:bob", "/orders", 2, 10);
    clock.advanceSeconds(2);

    RateLimitDecision full = limiter.evaluate("user:bob", "/orders", 2, 10);
    assertThat(full.admitted()).isFalse();
    // oldest surviving request is 8s old: ceil(10 - 8) + 1
    assertThat(full.retryAfterSeconds()).isEqualTo(3);

    clock.advanceSeconds(3);
    // t=11: the t=0 request left the window, the rejected t=8 attempt still counts
    RateLimitDecision decision = limiter.evaluate("user:bob", "/orders", 2, 10);
    assertThat(decision.admitted()).isFalse();
  }

  @Test
  void concurrentBurstAdmitsExactlyTheLimit() throws Exception {
    int limit = 25;
    executor = Executors.newFixedThreadPool(16);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<RateLimitDecision>> futures = new ArrayList<>();
    for (int i = 0; i < limit * 2; i++) {
      futures.add(
          executor.submit(
              () -> {
                start.await();
                return limiter.evaluate("ip:198.51.100.9", "/books", limit, 60);
              }));
    }
    start.countDown();

    int admitted = 0;
    int rejected = 0;
    for (Future<RateLimitDecision> future : futures) {
      if (future.get(10, TimeUnit.SECONDS).admitted()) admitted++;
      else rejected++;
    }

    assertThat(admitted).isEqualTo(limit);
    assertThat(rejected).isEqualTo(limit);
  }

  @Test
  void limitsAreIndependentPerEndpoint() {
    limiter.evaluate("ip:10.0.0.2", "/login", 1, 60);
    assertThat(limiter.evaluate("ip:10.0.0.2", "/login", 1, 60).admitted()).isFalse();

    assertThat(limiter.evaluate("ip:10.0.0.2", "/books", 1, 60).admitted()).isTrue();
    assertThat(limiter.evaluate("ip:10.0.0.3", "/login", 1, 60).admitted()).isTrue();
  }

  @Test
  void disabledLimiterNeverTouchesTheStore() {
    properties.setEnabled(false);
    SlidingWindowRateLimiter disabled =
        newLimiter(
            new RateLimitStore() {
              @Override
              public WindowSnapshot record(String key, double now, double windowStart, long periodSeconds) {
                throw new AssertionError("store must not be called when rate limiting is off");
              }

              @Override
              public void delete(String key) {
                throw new AssertionError("store must not be called when rate limiting is off");
              }
            });

    for (int i = 0; i < 1000; i++) {
      RateLimitDecision decision = disabled.evaluate("ip:10.0.0.4", "/books", 7, 60);
      assertThat(decision.admitted()).isTrue();
      assertThat(decision.remaining()).isEqualTo(7);
    }
  }

  @Test
  void storeFailureAdmitsWhenFailingOpen() {
    properties.setFailureMode(RateLimitFailureMode.OPEN);
    SlidingWindowRateLimiter failing = newLimiter(brokenStore());

    RateLimitDecision decision = failing.evaluate("ip:10.0.0.5", "/books", 10, 60);

    assertThat(decision.admitted()).isTrue();
    assertThat(decision.storeUnavailable()).isTrue();
    assertThat(decision.remaining()).isEqualTo(10);
    assertThat(meterRegistry.counter("gate.ratelimit.store_unavailable", "mode", "open").count())
        .isEqualTo(1.0);
  }

  @Test
  void storeFailureRejectsWhenFailingClosed() {
    properties.setFailureMode(RateLimitFailureMode.CLOSED);
    SlidingWindowRateLimiter failing = newLimiter(brokenStore());

    RateLimitDecision decision = failing.evaluate("ip:10.0.0.5", "/books", 10, 60);

    assertThat(decision.admitted()).isFalse();
    assertThat(decision.storeUnavailable()).isTrue();
    assertThat(decision.retryAfterSeconds()).isEqualTo(60);
  }

  @Test
  void resetClearsTheWindow() {
    limiter.evaluate("user:carol", "/admin", 1, 60);
    assertThat(limiter.evaluate("user:carol", "/admin", 1, 60).admitted()).isFalse();

    limiter.reset("user:carol", "/admin");

    assertThat(store.size(limiter.keyFor("user:carol", "/admin"))).isZero();
    assertThat(limiter.evaluate("user:carol", "/admin", 1, 60).admitted()).isTrue();
  }

  @Test
  void keysAreScopedByIdentifierAndHashedEndpoint() {
    String key = limiter.keyFor("ip:1.2.3.4", "/api/v1/books/very/long/path/segment");

    assertThat(key).startsWith("rate_limit:ip:1.2.3.4:");
    assertThat(key.substring("rate_limit:ip:1.2.3.4:".length())).hasSize(16).matches("[0-9a-f]+");
    assertThat(limiter.keyFor("ip:1.2.3.4", "/a")).isNotEqualTo(limiter.keyFor("ip:1.2.3.4", "/b"));
    assertThatThrownBy(() -> limiter.keyFor(" ", "/a")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void globalEvaluationSharesOneWindowAcrossRoutes() {
    properties.getGlobal().setCalls(2);
    limiter.evaluateGlobal("ip:10.0.0.6");
    limiter.evaluateGlobal("ip:10.0.0.6");

    assertThat(limiter.evaluateGlobal("ip:10.0.0.6").admitted()).isFalse();
    assertThat(store.size(limiter.keyFor("ip:10.0.0.6", SlidingWindowRateLimiter.GLOBAL_ENDPOINT)))
        .isEqualTo(3);
  }

  @Test
  void healthAndDocsAreExempt() {
    assertThat(limiter.isExempt("/health")).isTrue();
    assertThat(limiter.isExempt("/docs/index.html")).isTrue();
    assertThat(limiter.isExempt("/api/v1/books")).isFalse();
    assertThat(limiter.isExempt(null)).isFalse();
  }

  @Test
  void retryAfterFallsBackToPeriodWithoutOldestMember() {
    assertThat(SlidingWindowRateLimiter.retryAfter(100.0, null, 60)).isEqualTo(60);
    assertThat(SlidingWindowRateLimiter.retryAfter(100.0, 70.5, 60)).isEqualTo(32);
  }

  private static RateLimitStore brokenStore() {
    return new RateLimitStore() {
      @Override
      public WindowSnapshot record(String key, double now, double windowStart, long periodSeconds) {
        throw new RedisConnectionFailureException("connection refused");
      }

      @Override
      public void delete(String key) {
        throw new RedisConnectionFailureException("connection refused");
      }
    };
  }
}
