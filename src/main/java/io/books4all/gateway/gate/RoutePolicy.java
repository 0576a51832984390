package io.books4all.gateway.gate;

import io.books4all.gateway.auth.AccessPolicy;
import io.books4all.gateway.ratelimit.RateLimitRule;
import java.util.Objects;

/**
 * Per-route admission settings. A route with an access policy or a verified-email requirement
 * always requires an authenticated principal.
 */
public record RoutePolicy(
    IdentityRequirement identity, AccessPolicy access, RateLimitRule rateLimit, boolean verifiedEmail) {
  public RoutePolicy {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(rateLimit, "rateLimit");
    if (access != null && identity != IdentityRequirement.REQUIRED) {
      throw new IllegalArgumentException("a role-restricted route must require identity");
    }
    if (verifiedEmail && identity != IdentityRequirement.REQUIRED) {
      throw new IllegalArgumentException("a verified-email route must require identity");
    }
  }

  public RoutePolicy(IdentityRequirement identity, AccessPolicy access, RateLimitRule rateLimit) {
    this(identity, access, rateLimit, false);
  }

  public static RoutePolicy anonymous(RateLimitRule rateLimit) {
    return new RoutePolicy(IdentityRequirement.NONE, null, rateLimit);
  }

  public static RoutePolicy optional(RateLimitRule rateLimit) {
    return new RoutePolicy(IdentityRequirement.OPTIONAL, null, rateLimit);
  }

  public static RoutePolicy authenticated(RateLimitRule rateLimit) {
    return new RoutePolicy(IdentityRequirement.REQUIRED, null, rateLimit);
  }

  public static RoutePolicy roles(AccessPolicy access, RateLimitRule rateLimit) {
    return new RoutePolicy(IdentityRequirement.REQUIRED, Objects.requireNonNull(access, "access"), rateLimit);
  }

  /** Same route, additionally refusing principals whose email address is unconfirmed. */
  public RoutePolicy verifiedOnly() {
    return new RoutePolicy(identity, access, rateLimit, true);
  }
}
