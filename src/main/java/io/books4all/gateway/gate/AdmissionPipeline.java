package io.books4all.gateway.gate;

import io.books4all.gateway.auth.AuthException;
import io.books4all.gateway.auth.GateMetrics;
import io.books4all.gateway.auth.IdentityResolver;
import io.books4all.gateway.auth.Principal;
import io.books4all.gateway.ratelimit.ClientIdentifiers;
import io.books4all.gateway.ratelimit.RateLimitDecision;
import io.books4all.gateway.ratelimit.RateLimitExceededException;
import io.books4all.gateway.ratelimit.RateLimitProperties;
import io.books4all.gateway.ratelimit.SlidingWindowRateLimiter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs identity resolution, the verified-email check, the route's role check and the route's rate
 * limit, in that order. The first failing stage ends admission; later stages never run.
 */
@Service
public class AdmissionPipeline {
  static final String SCOPE_GLOBAL = "global";
  static final String SCOPE_ROUTE = "route";

  private final IdentityResolver identityResolver;
  private final SlidingWindowRateLimiter limiter;
  private final RateLimitProperties rateLimitProperties;
  private final GateMetrics metrics;

  public AdmissionPipeline(
      IdentityResolver identityResolver,
      SlidingWindowRateLimiter limiter,
      RateLimitProperties rateLimitProperties,
      GateMetrics metrics) {
    this.identityResolver = identityResolver;
    this.limiter = limiter;
    this.rateLimitProperties = rateLimitProperties;
    this.metrics = metrics;
  }

  public Mono<Admission> admit(ServerHttpRequest request, RoutePolicy policy) {
    return Mono.fromCallable(() -> admitBlocking(request, policy))
        .subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * Blanket per-client ceiling keyed on network origin. Completes empty when the global limit is
   * off or the path is exempt.
   */
  public Mono<RateLimitDecision> checkGlobal(ServerHttpRequest request) {
    if (!rateLimitProperties.getGlobal().isEnabled() || isExempt(request)) {
      return Mono.empty();
    }
    return Mono.fromCallable(
            () -> {
              RateLimitDecision decision = limiter.evaluateGlobal(ClientIdentifiers.forRequest(request));
              return requireAdmitted(decision, SCOPE_GLOBAL);
            })
        .subscribeOn(Schedulers.boundedElastic());
  }

  public boolean isExempt(ServerHttpRequest request) {
    return limiter.isExempt(request.getPath().pathWithinApplication().value());
  }

  Admission admitBlocking(ServerHttpRequest request, RoutePolicy policy) {
    Principal principal = resolveIdentity(request, policy.identity());
    if (policy.verifiedEmail() && !principal.emailVerified()) {
      metrics.forbidden();
      throw AuthException.emailNotVerified();
    }
    if (policy.access() != null) {
      try {
        policy.access().require(principal);
      } catch (AuthException e) {
        metrics.forbidden();
        throw e;
      }
    }
    String identifier =
        principal == null ? ClientIdentifiers.forRequest(request) : ClientIdentifiers.forPrincipal(principal);
    RateLimitDecision decision =
        limiter.evaluate(identifier, request.getPath().pathWithinApplication().value(), policy.rateLimit());
    return new Admission(principal, requireAdmitted(decision, SCOPE_ROUTE));
  }

  private Principal resolveIdentity(ServerHttpRequest request, IdentityRequirement requirement) {
    if (requirement == IdentityRequirement.NONE) return null;
    String token =
        IdentityResolver.bearerToken(request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION))
            .orElse(null);
    if (requirement == IdentityRequirement.OPTIONAL) {
      return identityResolver.resolveOptional(token).orElse(null);
    }
    try {
      return identityResolver.resolveRequired(token);
    } catch (AuthException e) {
      metrics.authRejected(e.getCode());
      throw e;
    }
  }

  private RateLimitDecision requireAdmitted(RateLimitDecision decision, String scope) {
    if (decision.admitted()) return decision;
    metrics.rateLimited(scope);
    throw RateLimitExceededException.from(decision, scope);
  }
}
