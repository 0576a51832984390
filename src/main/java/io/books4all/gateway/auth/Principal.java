package io.books4all.gateway.auth;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * The authenticated actor behind a request. Loaded from the {@link PrincipalStore} on every request
 * and never cached across requests.
 */
public record Principal(UUID id, Role role, boolean active, boolean emailVerified, Instant deletedAt) {
  public Principal {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(role, "role");
  }

  public static Principal active(UUID id, Role role) {
    return new Principal(id, role, true, true, null);
  }

  /** Freshly registered principal whose email address has not been confirmed yet. */
  public static Principal unverified(UUID id, Role role) {
    return new Principal(id, role, true, false, null);
  }

  public Principal withEmailVerified() {
    return new Principal(id, role, active, true, deletedAt);
  }

  public boolean deleted() {
    return deletedAt != null;
  }

  /** Only a live, enabled principal may be treated as authenticated. */
  public boolean canAuthenticate() {
    return active && !deleted();
  }
}
