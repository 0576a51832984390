package io.books4all.gateway.gate;

import io.books4all.gateway.auth.Principal;
import io.books4all.gateway.ratelimit.RateLimitDecision;
import java.util.Optional;

/** Outcome of a request that passed every admission stage. {@code principal} is null for anonymous callers. */
public record Admission(Principal principal, RateLimitDecision decision) {
  public Optional<Principal> principalIfAny() {
    return Optional.ofNullable(principal);
  }
}
