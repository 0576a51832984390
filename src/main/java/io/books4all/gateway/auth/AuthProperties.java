package io.books4all.gateway.auth;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.auth")
public class AuthProperties {
  private long accessTokenTtlSeconds = 900;
  private long refreshTokenTtlSeconds = 604_800;
  private long passwordResetTtlSeconds = 3_600;
  private long emailVerificationTtlSeconds = 86_400;
  private int passwordHashStrength = 12;
  private boolean metricsEnabled = true;

  private Jwt jwt = new Jwt();

  public long getAccessTokenTtlSeconds() {
    return accessTokenTtlSeconds;
  }

  public void setAccessTokenTtlSeconds(long accessTokenTtlSeconds) {
    this.accessTokenTtlSeconds = accessTokenTtlSeconds;
  }

  public long getRefreshTokenTtlSeconds() {
    return refreshTokenTtlSeconds;
  }

  public void setRefreshTokenTtlSeconds(long refreshTokenTtlSeconds) {
    this.refreshTokenTtlSeconds = refreshTokenTtlSeconds;
  }

  public long getPasswordResetTtlSeconds() {
    return passwordResetTtlSeconds;
  }

  public void setPasswordResetTtlSeconds(long passwordResetTtlSeconds) {
    this.passwordResetTtlSeconds = passwordResetTtlSeconds;
  }

  public long getEmailVerificationTtlSeconds() {
    return emailVerificationTtlSeconds;
  }

  public void setEmailVerificationTtlSeconds(long emailVerificationTtlSeconds) {
    this.emailVerificationTtlSeconds = emailVerificationTtlSeconds;
  }

  /** bcrypt log rounds. */
  public int getPasswordHashStrength() {
    return passwordHashStrength;
  }

  public void setPasswordHashStrength(int passwordHashStrength) {
    this.passwordHashStrength = passwordHashStrength;
  }

  public boolean isMetricsEnabled() {
    return metricsEnabled;
  }

  public void setMetricsEnabled(boolean metricsEnabled) {
    this.metricsEnabled = metricsEnabled;
  }

  public Jwt getJwt() {
    return jwt;
  }

  public void setJwt(Jwt jwt) {
    this.jwt = jwt;
  }

  public static class Jwt {
    private String issuer = "books4all-api";
    private String audience = "books4all-clients";
    private String secret = "replace-me-dev-secret-at-least-32-bytes";

    public String getIssuer() {
      return issuer;
    }

    public void setIssuer(String issuer) {
      this.issuer = issuer;
    }

    public String getAudience() {
      return audience;
    }

    public void setAudience(String audience) {
      this.audience = audience;
    }

    public String getSecret() {
      return secret;
    }

    public void setSecret(String secret) {
      this.secret = secret;
    }
  }
}
