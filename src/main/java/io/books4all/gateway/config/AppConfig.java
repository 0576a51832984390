package io.books4all.gateway.config;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsConfigurationSource;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

@Configuration
public class AppConfig {

  @Bean
  public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
    return new StringRedisTemplate(cf);
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Runs ahead of the admission filter so that rejected requests still carry CORS headers and
   * browsers can read the error body, {@code Retry-After} and the quota headers.
   */
  @Bean
  public CorsWebFilter corsWebFilter(@Value("${app.cors.allowedOrigins:*}") String allowedOrigins) {
    CorsConfiguration config = new CorsConfiguration();
    config.setAllowCredentials(false);
    if (allowedOrigins == null || allowedOrigins.isBlank() || "*".equals(allowedOrigins.trim())) {
      config.addAllowedOriginPattern("*");
    } else {
      List<String> origins =
          Arrays.stream(allowedOrigins.split(","))
              .map(String::trim)
              .filter(s -> !s.isEmpty())
              .toList();
      origins.forEach(config::addAllowedOrigin);
    }
    config.addAllowedHeader("*");
    config.addAllowedMethod("*");
    // Browsers only let scripts read quota headers that are listed here.
    config.addExposedHeader("X-RateLimit-Limit");
    config.addExposedHeader("X-RateLimit-Remaining");
    config.addExposedHeader("X-RateLimit-Reset");
    config.addExposedHeader(HttpHeaders.RETRY_AFTER);
    config.setMaxAge(Duration.ofHours(1));

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return new OrderedCorsWebFilter(source);
  }

  public static class OrderedCorsWebFilter extends CorsWebFilter implements Ordered {
    public static final int ORDER = Ordered.HIGHEST_PRECEDENCE;

    public OrderedCorsWebFilter(CorsConfigurationSource source) {
      super(source);
    }

    @Override
    public int getOrder() {
      return ORDER;
    }
  }
}
