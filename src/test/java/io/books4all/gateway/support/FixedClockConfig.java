package io.books4all.gateway.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/** Clock for web slice tests, which do not load the application configuration. */
@TestConfiguration
public class FixedClockConfig {
  public static final Instant NOW = Instant.parse("2026-05-01T08:30:00Z");

  @Bean
  public Clock clock() {
    return Clock.fixed(NOW, ZoneOffset.UTC);
  }
}
