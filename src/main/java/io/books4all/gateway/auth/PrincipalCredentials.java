package io.books4all.gateway.auth;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/** Login credentials of a principal. The email is stored normalized; the password only as a bcrypt hash. */
public record PrincipalCredentials(UUID principalId, String email, String passwordHash) {
  public PrincipalCredentials {
    Objects.requireNonNull(principalId, "principalId");
    Objects.requireNonNull(passwordHash, "passwordHash");
    email = normalizeEmail(email);
  }

  public PrincipalCredentials withPasswordHash(String newHash) {
    return new PrincipalCredentials(principalId, email, newHash);
  }

  public static String normalizeEmail(String email) {
    if (email == null || email.isBlank()) throw new IllegalArgumentException("email required");
    return email.trim().toLowerCase(Locale.ROOT);
  }
}
