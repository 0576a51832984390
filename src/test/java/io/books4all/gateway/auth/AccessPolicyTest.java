package io.books4all.gateway.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AccessPolicyTest {

  @Test
  void emptyRoleSetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> AccessPolicy.of(Set.of()));
    assertThrows(IllegalArgumentException.class, () -> AccessPolicy.of((Set<Role>) null));
  }

  @Test
  void noImpliedHierarchy() {
    AccessPolicy sellersOnly = AccessPolicy.of(Role.SELLER);

    assertTrue(sellersOnly.permits(Role.SELLER));
    assertFalse(sellersOnly.permits(Role.ADMIN));
    assertTrue(AccessPolicy.SELLER_OR_ADMIN.permits(Role.ADMIN));
    assertFalse(AccessPolicy.SELLER_OR_ADMIN.permits(Role.BUYER));
  }

  @Test
  void allowedPrincipalPassesThrough() {
    Principal admin = Principal.active(UUID.randomUUID(), Role.ADMIN);

    assertSame(admin, AccessPolicy.ADMIN_ONLY.require(admin));
  }

  @Test
  void disallowedRoleIsForbiddenWithDetails() {
    Principal buyer = Principal.active(UUID.randomUUID(), Role.BUYER);

    AuthException e =
        assertThrows(AuthException.class, () -> AccessPolicy.SELLER_OR_ADMIN.require(buyer));

    assertEquals(AuthErrorCode.FORBIDDEN, e.getCode());
    assertEquals(403, e.getHttpStatus());
    assertEquals("admin,seller", e.getDetails().get("requiredRoles"));
    assertEquals("buyer", e.getDetails().get("role"));
  }

  @Test
  void missingPrincipalIsUnauthenticated() {
    AuthException e = assertThrows(AuthException.class, () -> AccessPolicy.ANY_ROLE.require(null));

    assertEquals(401, e.getHttpStatus());
  }

  @Test
  void policiesWithSameRolesAreEqual() {
    assertEquals(AccessPolicy.ADMIN_ONLY, AccessPolicy.of(Role.ADMIN));
    assertEquals(AccessPolicy.ANY_ROLE, AccessPolicy.of(Role.BUYER, Role.SELLER, Role.ADMIN));
  }
}
