package io.books4all.gateway.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

class RedisRateLimitStoreTest {
  private StringRedisTemplate redis;
  private RedisRateLimitStore store;

  @BeforeEach
  void setUp() {
    redis = mock(StringRedisTemplate.class);
    store = new RedisRateLimitStore(redis);
  }

  @Test
  @SuppressWarnings({"unchecked", "rawtypes"})
  void passesWindowArgumentsAndParsesResult() {
    when(redis.execute(any(RedisScript.class), anyList(), any(Object[].class)))
        .thenReturn((List) List.of(3L, "1767225590.500000"));

    RateLimitStore.WindowSnapshot snapshot =
        store.record("rate_limit:ip:1.2.3.4:abc", 1767225600.25, 1767225540.25, 60);

    assertEquals(3, snapshot.countBeforeInsert());
    assertEquals(Double.valueOf(1767225590.5), snapshot.oldestScore());
    ArgumentCaptor<Object> args = ArgumentCaptor.forClass(Object.class);
    verify(redis)
        .execute(
            eq(RedisRateLimitStore.SLIDING_WINDOW_SCRIPT),
            eq(List.of("rate_limit:ip:1.2.3.4:abc")),
            args.capture(),
            args.capture(),
            args.capture(),
            args.capture());
    List<Object> argv = args.getAllValues();
    assertEquals("1767225540.250000", argv.get(0));
    assertEquals("1767225600.250000", argv.get(1));
    assertTrue(((String) argv.get(2)).startsWith("1767225600.250000-"));
    assertEquals("60", argv.get(3));
  }

  @Test
  @SuppressWarnings({"unchecked", "rawtypes"})
  void missingOldestScoreIsNull() {
    when(redis.execute(any(RedisScript.class), anyList(), any(Object[].class)))
        .thenReturn((List) List.of(0L));

    assertNull(store.record("k", 10.0, 0.0, 10).oldestScore());
  }

  @Test
  @SuppressWarnings({"unchecked", "rawtypes"})
  void emptyScriptResultIsAnError() {
    when(redis.execute(any(RedisScript.class), anyList(), any(Object[].class)))
        .thenReturn((List) List.of());

    assertThrows(IllegalStateException.class, () -> store.record("k", 10.0, 0.0, 10));
  }

  @Test
  void scoresUseFixedPointFormatting() {
    assertEquals("1.500000", RedisRateLimitStore.score(1.5));
  }
}
