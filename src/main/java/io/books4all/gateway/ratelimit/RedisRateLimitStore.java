package io.books4all.gateway.ratelimit;

import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.scripting.support.ResourceScriptSource;
import org.springframework.stereotype.Component;

/** Runs trim, count, add and expire in one Lua script so racing requests see a linear count. */
@Component
public class RedisRateLimitStore implements RateLimitStore {
  static final RedisScript<List> SLIDING_WINDOW_SCRIPT = loadScript();

  private final StringRedisTemplate redis;

  public RedisRateLimitStore(StringRedisTemplate redis) {
    this.redis = redis;
  }

  @Override
  @SuppressWarnings("unchecked")
  public WindowSnapshot record(String key, double now, double windowStart, long periodSeconds) {
    String nowText = score(now);
    List<Object> result =
        redis.execute(
            SLIDING_WINDOW_SCRIPT,
            List.of(key),
            score(windowStart),
            nowText,
            nowText + "-" + UUID.randomUUID(),
            String.valueOf(periodSeconds));
    if (result == null || result.isEmpty()) {
      throw new IllegalStateException("sliding window script returned no result for " + key);
    }
    long count = Long.parseLong(String.valueOf(result.get(0)));
    Double oldest = result.size() > 1 ? Double.valueOf(String.valueOf(result.get(1))) : null;
    return new WindowSnapshot(count, oldest);
  }

  @Override
  public void delete(String key) {
    redis.delete(key);
  }

  static String score(double epochSeconds) {
    return String.format(Locale.ROOT, "%.6f", epochSeconds);
  }

  private static RedisScript<List> loadScript() {
    DefaultRedisScript<List> script = new DefaultRedisScript<>();
    script.setScriptSource(new ResourceScriptSource(new ClassPathResource("scripts/sliding_window.lua")));
    script.setResultType(List.class);
    return script;
  }
}
