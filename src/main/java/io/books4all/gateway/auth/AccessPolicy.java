package io.books4all.gateway.auth;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Role allow-list attached to a route. Roles are listed explicitly; there is no implied hierarchy,
 * so a route open to sellers and admins names both.
 */
public final class AccessPolicy {
  public static final AccessPolicy ADMIN_ONLY = of(Set.of(Role.ADMIN));
  public static final AccessPolicy SELLER_OR_ADMIN = of(Set.of(Role.SELLER, Role.ADMIN));
  public static final AccessPolicy ANY_ROLE = of(EnumSet.allOf(Role.class));

  private final Set<Role> allowedRoles;

  private AccessPolicy(Set<Role> allowedRoles) {
    this.allowedRoles = Collections.unmodifiableSet(EnumSet.copyOf(allowedRoles));
  }

  public static AccessPolicy of(Set<Role> allowedRoles) {
    if (allowedRoles == null || allowedRoles.isEmpty()) {
      throw new IllegalArgumentException("access policy needs at least one role");
    }
    return new AccessPolicy(allowedRoles);
  }

  public static AccessPolicy of(Role first, Role... rest) {
    return of(EnumSet.of(first, rest));
  }

  public Set<Role> allowedRoles() {
    return allowedRoles;
  }

  public boolean permits(Role role) {
    return allowedRoles.contains(role);
  }

  /** Returns the principal unchanged when its role is allowed. */
  public Principal require(Principal principal) {
    if (principal == null) {
      throw AuthException.unauthenticated("not authenticated");
    }
    if (!permits(principal.role())) {
      throw new AuthException(
          AuthErrorCode.FORBIDDEN,
          "forbidden",
          403,
          null,
          Map.of("requiredRoles", roleCodes(), "role", principal.role().code()));
    }
    return principal;
  }

  private String roleCodes() {
    return allowedRoles.stream().map(Role::code).sorted().collect(Collectors.joining(","));
  }

  @Override
  public String toString() {
    return "AccessPolicy[" + roleCodes() + "]";
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof AccessPolicy other && allowedRoles.equals(other.allowedRoles);
  }

  @Override
  public int hashCode() {
    return allowedRoles.hashCode();
  }
}
