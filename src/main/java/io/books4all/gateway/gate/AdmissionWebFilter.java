package io.books4all.gateway.gate;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.books4all.gateway.auth.AuthErrorResponses;
import io.books4all.gateway.auth.AuthException;
import io.books4all.gateway.ratelimit.RateLimitDecision;
import io.books4all.gateway.ratelimit.RateLimitExceededException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.cors.reactive.CorsUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Gates every request: global ceiling, then the matched route's identity, role and rate-limit
 * checks. Admitted requests carry the principal in {@link AdmissionAttributes#PRINCIPAL} and the
 * quota headers; rejected requests get the JSON error body and never reach a handler.
 */
public class AdmissionWebFilter implements WebFilter, Ordered {
  private static final Logger log = LoggerFactory.getLogger(AdmissionWebFilter.class);
  public static final String HEADER_LIMIT = "X-RateLimit-Limit";
  public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
  public static final String HEADER_RESET = "X-RateLimit-Reset";
  public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

  private final AdmissionPipeline pipeline;
  private final RoutePolicyRegistry routes;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public AdmissionWebFilter(
      AdmissionPipeline pipeline, RoutePolicyRegistry routes, ObjectMapper objectMapper, Clock clock) {
    this.pipeline = pipeline;
    this.routes = routes;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public int getOrder() {
    return ORDER;
  }

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    ServerHttpRequest request = exchange.getRequest();
    if (CorsUtils.isPreFlightRequest(request) || pipeline.isExempt(request)) {
      return chain.filter(exchange);
    }
    RoutePolicy policy = routes.resolve(request.getMethod(), request.getPath().pathWithinApplication());
    return pipeline
        .checkGlobal(request)
        .then(pipeline.admit(request, policy))
        .map(
            admission -> {
              admission
                  .principalIfAny()
                  .ifPresent(p -> exchange.getAttributes().put(AdmissionAttributes.PRINCIPAL, p));
              applyQuotaHeaders(exchange.getResponse().getHeaders(), admission.decision());
              return true;
            })
        .onErrorResume(AuthException.class, e -> reject(exchange, e).thenReturn(false))
        .flatMap(admitted -> admitted ? chain.filter(exchange) : Mono.empty());
  }

  static void applyQuotaHeaders(HttpHeaders headers, RateLimitDecision decision) {
    headers.set(HEADER_LIMIT, String.valueOf(decision.limit()));
    headers.set(HEADER_REMAINING, String.valueOf(decision.admitted() ? decision.remaining() : 0));
    headers.set(HEADER_RESET, String.valueOf(decision.resetEpochSeconds()));
  }

  private Mono<Void> reject(ServerWebExchange exchange, AuthException e) {
    log.debug(
        "request rejected: path={} code={} details={}",
        exchange.getRequest().getPath().value(),
        e.getCode(),
        e.getDetails());
    ServerHttpResponse response = exchange.getResponse();
    response.setStatusCode(HttpStatus.valueOf(e.getHttpStatus()));
    HttpHeaders headers = response.getHeaders();
    AuthErrorResponses.applyHeaders(e, headers);
    if (e instanceof RateLimitExceededException limited) {
      applyQuotaHeaders(headers, limited.getDecision());
    }
    headers.setContentType(MediaType.APPLICATION_JSON);
    return Mono.fromCallable(() -> objectMapper.writeValueAsBytes(AuthErrorResponses.body(e, clock)))
        .flatMap(bytes -> response.writeWith(Mono.just(response.bufferFactory().wrap(bytes))));
  }
}
