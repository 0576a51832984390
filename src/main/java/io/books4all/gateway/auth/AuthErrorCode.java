package io.books4all.gateway.auth;

public enum AuthErrorCode {
  UNAUTHENTICATED,
  TOKEN_INVALID,
  ACCOUNT_DISABLED,
  EMAIL_NOT_VERIFIED,
  FORBIDDEN,
  EMAIL_ALREADY_REGISTERED,
  RATE_LIMITED,
  RATE_LIMITER_UNAVAILABLE,
  BAD_REQUEST
}
