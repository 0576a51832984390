package io.books4all.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.books4all.gateway.auth.AccessPolicy;
import io.books4all.gateway.gate.AdmissionPipeline;
import io.books4all.gateway.gate.AdmissionWebFilter;
import io.books4all.gateway.gate.RoutePolicy;
import io.books4all.gateway.gate.RoutePolicyRegistry;
import io.books4all.gateway.ratelimit.RateLimitProperties;
import io.books4all.gateway.ratelimit.RateLimitRule;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;

/** Route table of the public API. Unlisted routes fall back to optional identity and the default limit. */
@Configuration
public class GatewayRoutesConfig {

  @Bean
  public RoutePolicyRegistry routePolicyRegistry(RateLimitProperties limits) {
    RateLimitRule standard = limits.defaultRule();
    RateLimitRule login = limits.loginRule();
    RateLimitRule strict = limits.strictRule();

    return RoutePolicyRegistry.builder(RoutePolicy.optional(standard))
        .route(HttpMethod.POST, "/api/v1/auth/login", RoutePolicy.anonymous(login))
        .route(HttpMethod.POST, "/api/v1/auth/register", RoutePolicy.anonymous(strict))
        .route(HttpMethod.POST, "/api/v1/auth/refresh", RoutePolicy.anonymous(strict))
        .route(HttpMethod.POST, "/api/v1/auth/password-reset/**", RoutePolicy.anonymous(strict))
        .route(HttpMethod.POST, "/api/v1/auth/verify-email", RoutePolicy.anonymous(strict))
        .route(HttpMethod.GET, "/api/v1/auth/me", RoutePolicy.authenticated(standard))
        .route("/api/v1/admin/**", RoutePolicy.roles(AccessPolicy.ADMIN_ONLY, strict))
        .route(HttpMethod.GET, "/api/v1/books/**", RoutePolicy.optional(standard))
        .route("/api/v1/books/**", RoutePolicy.roles(AccessPolicy.SELLER_OR_ADMIN, standard).verifiedOnly())
        .route("/api/v1/orders/**", RoutePolicy.roles(AccessPolicy.ANY_ROLE, standard).verifiedOnly())
        .route("/api/v1/reviews/**", RoutePolicy.roles(AccessPolicy.ANY_ROLE, standard).verifiedOnly())
        .route("/api/v1/messages/**", RoutePolicy.roles(AccessPolicy.ANY_ROLE, standard).verifiedOnly())
        .build();
  }

  @Bean
  public AdmissionWebFilter admissionWebFilter(
      AdmissionPipeline pipeline, RoutePolicyRegistry routes, ObjectMapper objectMapper, Clock clock) {
    return new AdmissionWebFilter(pipeline, routes, objectMapper, clock);
  }
}
