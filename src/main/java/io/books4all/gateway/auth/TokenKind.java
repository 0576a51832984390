package io.books4all.gateway.auth;

/**
 * Value of the {@code type} claim. Session tokens name a principal id and carry its role; the
 * single-purpose email tokens name an email address and carry no role.
 */
public enum TokenKind {
  ACCESS("access", true),
  REFRESH("refresh", true),
  PASSWORD_RESET("password_reset", false),
  EMAIL_VERIFICATION("email_verification", false);

  private final String claim;
  private final boolean session;

  TokenKind(String claim, boolean session) {
    this.claim = claim;
    this.session = session;
  }

  /** Value written to the {@code type} claim. */
  public String claim() {
    return claim;
  }

  public boolean isSession() {
    return session;
  }

  public static TokenKind fromClaim(String value) {
    if (value == null) throw new IllegalArgumentException("token type required");
    for (TokenKind kind : values()) {
      if (kind.claim.equals(value)) return kind;
    }
    throw new IllegalArgumentException("unsupported token type: " + value);
  }
}
