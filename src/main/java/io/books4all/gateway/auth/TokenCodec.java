package io.books4all.gateway.auth;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies the HS256 tokens: the access/refresh session pair and the single-purpose
 * password-reset and email-verification tokens, whose subject is an email address.
 *
 * <p>Every verification failure (signature, structure, expiry, issuer, kind) surfaces as the same
 * {@link AuthErrorCode#TOKEN_INVALID} with the same message. Expiry claims are whole seconds and
 * are checked without leeway.
 */
@Service
public class TokenCodec {
  private static final Logger log = LoggerFactory.getLogger(TokenCodec.class);
  private static final int MIN_SECRET_BYTES = 32;
  static final String CLAIM_ROLE = "role";
  static final String CLAIM_TYPE = "type";

  private final AuthProperties authProperties;
  private final Clock clock;
  private final JWSSigner signer;
  private final JWSVerifier verifier;

  public TokenCodec(AuthProperties authProperties, Clock clock) {
    this.authProperties = authProperties;
    this.clock = clock;
    String secret = authProperties.getJwt().getSecret();
    byte[] secretBytes = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
    if (secretBytes.length < MIN_SECRET_BYTES) {
      throw new IllegalStateException("AUTH_JWT_SECRET must be at least 32 bytes");
    }
    try {
      this.signer = new MACSigner(secretBytes);
      this.verifier = new MACVerifier(secretBytes);
    } catch (JOSEException e) {
      throw new IllegalStateException("failed to initialize jwt signer", e);
    }
  }

  public String issue(UUID principalId, Role role, TokenKind kind, long ttlSeconds) {
    return issue(principalId, role, kind, ttlSeconds, null);
  }

  public String issue(
      UUID principalId, Role role, TokenKind kind, long ttlSeconds, String revocationId) {
    if (principalId == null || role == null || kind == null) {
      throw new IllegalArgumentException("principal id, role and kind are required");
    }
    if (!kind.isSession()) {
      throw new IllegalArgumentException(kind.claim() + " tokens are issued for an email address");
    }
    return sign(principalId.toString(), role, kind, ttlSeconds, revocationId);
  }

  /** Password-reset or email-verification token naming the normalized email address. */
  public String issueEmailToken(String email, TokenKind kind) {
    if (kind == null || kind.isSession()) {
      throw new IllegalArgumentException("email tokens are password_reset or email_verification");
    }
    long ttl =
        kind == TokenKind.PASSWORD_RESET
            ? authProperties.getPasswordResetTtlSeconds()
            : authProperties.getEmailVerificationTtlSeconds();
    return sign(PrincipalCredentials.normalizeEmail(email), null, kind, ttl, UUID.randomUUID().toString());
  }

  private String sign(String subject, Role role, TokenKind kind, long ttlSeconds, String revocationId) {
    if (ttlSeconds <= 0) {
      throw new IllegalArgumentException("ttlSeconds must be positive");
    }
    Instant now = clock.instant();
    JWTClaimsSet.Builder claims =
        new JWTClaimsSet.Builder()
            .issuer(authProperties.getJwt().getIssuer())
            .audience(authProperties.getJwt().getAudience())
            .subject(subject)
            .issueTime(Date.from(now.truncatedTo(ChronoUnit.SECONDS)))
            .expirationTime(Date.from(expiryFor(now, ttlSeconds)))
            .claim(CLAIM_TYPE, kind.claim());
    if (role != null) {
      claims.claim(CLAIM_ROLE, role.code());
    }
    if (revocationId != null && !revocationId.isBlank()) {
      claims.jwtID(revocationId);
    }
    try {
      SignedJWT jwt =
          new SignedJWT(
              new JWSHeader.Builder(JWSAlgorithm.HS256).type(JOSEObjectType.JWT).build(),
              claims.build());
      jwt.sign(signer);
      return jwt.serialize();
    } catch (JOSEException e) {
      throw new IllegalStateException("failed to sign " + kind.claim() + " token", e);
    }
  }

  public TokenPair issuePair(UUID principalId, Role role) {
    long accessTtl = authProperties.getAccessTokenTtlSeconds();
    String access =
        issue(principalId, role, TokenKind.ACCESS, accessTtl, UUID.randomUUID().toString());
    String refresh =
        issue(
            principalId,
            role,
            TokenKind.REFRESH,
            authProperties.getRefreshTokenTtlSeconds(),
            UUID.randomUUID().toString());
    return new TokenPair(access, refresh, accessTtl);
  }

  public TokenAssertion verify(String token, TokenKind expectedKind) {
    if (token == null || token.isBlank()) {
      throw AuthException.invalidToken();
    }
    try {
      SignedJWT jwt = SignedJWT.parse(token);
      if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
        return reject("unexpected algorithm");
      }
      if (!jwt.verify(verifier)) {
        return reject("bad signature");
      }
      JWTClaimsSet claims = jwt.getJWTClaimsSet();
      if (!authProperties.getJwt().getIssuer().equals(claims.getIssuer())) {
        return reject("issuer mismatch");
      }
      if (claims.getAudience() == null
          || !claims.getAudience().contains(authProperties.getJwt().getAudience())) {
        return reject("audience mismatch");
      }
      Date issued = claims.getIssueTime();
      Date expires = claims.getExpirationTime();
      if (issued == null || expires == null || !expires.after(issued)) {
        return reject("missing or inverted timestamps");
      }
      Instant expiresAt = expires.toInstant();
      if (!expiresAt.isAfter(clock.instant())) {
        return reject("expired");
      }
      String subject = claims.getSubject();
      if (subject == null || subject.isBlank()) {
        return reject("missing subject");
      }
      TokenKind kind = TokenKind.fromClaim(claims.getStringClaim(CLAIM_TYPE));
      if (kind != expectedKind) {
        return reject("kind mismatch");
      }
      String roleClaim = claims.getStringClaim(CLAIM_ROLE);
      Role role;
      if (kind.isSession()) {
        role = Role.fromCode(roleClaim);
      } else if (roleClaim != null) {
        return reject("role on email token");
      } else {
        role = null;
      }
      return new TokenAssertion(
          subject, role, kind, issued.toInstant(), expiresAt, claims.getJWTID());
    } catch (AuthException e) {
      throw e;
    } catch (Exception e) {
      return reject("malformed: " + e.getClass().getSimpleName());
    }
  }

  /** Claims carry whole seconds; rounding the expiry up keeps the full ttl for sub-second issue times. */
  static Instant expiryFor(Instant issuedAt, long ttlSeconds) {
    Instant expiry = issuedAt.plusSeconds(ttlSeconds);
    Instant whole = expiry.truncatedTo(ChronoUnit.SECONDS);
    return whole.equals(expiry) ? whole : whole.plusSeconds(1);
  }

  private static TokenAssertion reject(String reason) {
    log.debug("token rejected: {}", reason);
    throw AuthException.invalidToken();
  }
}
