package io.books4all.gateway.auth;

public record TokenPair(
    String accessToken, String refreshToken, String tokenType, long expiresInSeconds) {
  public static final String BEARER = "bearer";

  public TokenPair(String accessToken, String refreshToken, long expiresInSeconds) {
    this(accessToken, refreshToken, BEARER, expiresInSeconds);
  }
}
