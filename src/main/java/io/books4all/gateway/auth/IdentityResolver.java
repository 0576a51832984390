package io.books4all.gateway.auth;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;

/** Turns a bearer access token into a {@link Principal} by consulting the {@link PrincipalStore}. */
@Service
public class IdentityResolver {
  private static final String BEARER_PREFIX = "bearer ";

  private final TokenCodec tokenCodec;
  private final PrincipalStore principals;

  public IdentityResolver(TokenCodec tokenCodec, PrincipalStore principals) {
    this.tokenCodec = tokenCodec;
    this.principals = principals;
  }

  /**
   * Extracts the token from an {@code Authorization} header value. Empty when the header is absent
   * or uses another scheme.
   */
  public static Optional<String> bearerToken(String authorizationHeader) {
    if (authorizationHeader == null) return Optional.empty();
    String value = authorizationHeader.trim();
    if (value.length() <= BEARER_PREFIX.length()) return Optional.empty();
    if (!value.substring(0, BEARER_PREFIX.length()).toLowerCase(Locale.ROOT).equals(BEARER_PREFIX)) {
      return Optional.empty();
    }
    String token = value.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }

  public Principal resolveRequired(String token) {
    if (token == null || token.isBlank()) {
      throw AuthException.unauthenticated("not authenticated");
    }
    UUID id = subjectOf(token).orElseThrow(() -> AuthException.unauthenticated("invalid or expired token"));
    Principal principal =
        principals
            .findByIdIgnoringActive(id)
            .orElseThrow(() -> AuthException.unauthenticated("principal not found"));
    if (!principal.canAuthenticate()) {
      throw AuthException.disabled();
    }
    return principal;
  }

  /** Anonymous callers, bad tokens and disabled or missing principals all resolve to empty. */
  public Optional<Principal> resolveOptional(String token) {
    if (token == null || token.isBlank()) return Optional.empty();
    return subjectOf(token).flatMap(principals::findActiveById).filter(Principal::canAuthenticate);
  }

  private Optional<UUID> subjectOf(String token) {
    try {
      TokenAssertion assertion = tokenCodec.verify(token, TokenKind.ACCESS);
      return Optional.of(UUID.fromString(assertion.subject()));
    } catch (AuthException | IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
