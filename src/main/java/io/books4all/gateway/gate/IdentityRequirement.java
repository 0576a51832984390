package io.books4all.gateway.gate;

public enum IdentityRequirement {
  /** Token is ignored; the caller is limited by network origin. */
  NONE,
  /** A valid token upgrades the caller to a principal; anything else stays anonymous. */
  OPTIONAL,
  /** A valid access token for an active principal is mandatory. */
  REQUIRED
}
