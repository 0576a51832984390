package io.books4all.gateway.auth;

import io.books4all.gateway.auth.dto.AuthDtos;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AuthService {
  private static final Logger log = LoggerFactory.getLogger(AuthService.class);

  private final TokenCodec tokenCodec;
  private final PrincipalStore principals;
  private final PasswordHasher passwordHasher;
  private final AuthMailer mailer;
  private final GateMetrics metrics;

  public AuthService(
      TokenCodec tokenCodec,
      PrincipalStore principals,
      PasswordHasher passwordHasher,
      AuthMailer mailer,
      GateMetrics metrics) {
    this.tokenCodec = tokenCodec;
    this.principals = principals;
    this.passwordHasher = passwordHasher;
    this.mailer = mailer;
    this.metrics = metrics;
  }

  /**
   * Checks email and password and issues a token pair. Unknown email and wrong password fail with
   * the same 401 so registered addresses cannot be enumerated.
   */
  public AuthDtos.TokenResponse login(AuthDtos.LoginRequest request) {
    Optional<PrincipalCredentials> credentials = principals.findCredentialsByEmail(request.email());
    String hash = credentials.map(PrincipalCredentials::passwordHash).orElse(null);
    if (!passwordHasher.matches(request.password(), hash) || credentials.isEmpty()) {
      metrics.loginFailed();
      throw AuthException.badCredentials();
    }
    Principal principal =
        principals
            .findByIdIgnoringActive(credentials.get().principalId())
            .orElseThrow(AuthException::badCredentials);
    TokenPair pair = issueTokens(principal);
    log.info("login succeeded: principal={}", principal.id());
    return toResponse(pair);
  }

  /**
   * Creates an unverified buyer or seller and mails an email-verification token. Admins are never
   * self-registered.
   */
  public AuthDtos.TokenResponse register(AuthDtos.RegisterRequest request) {
    Role role = request.role() == null || request.role().isBlank() ? Role.BUYER : Role.fromCode(request.role());
    if (role == Role.ADMIN) {
      throw new AuthException(AuthErrorCode.BAD_REQUEST, "role must be buyer or seller", 400);
    }
    Principal principal = Principal.unverified(UUID.randomUUID(), role);
    PrincipalCredentials credentials =
        new PrincipalCredentials(principal.id(), request.email(), passwordHasher.hash(request.password()));
    if (!principals.createCredentials(credentials)) {
      throw new AuthException(AuthErrorCode.EMAIL_ALREADY_REGISTERED, "email already registered", 409);
    }
    principals.save(principal);
    mailer.sendEmailVerification(
        credentials.email(), tokenCodec.issueEmailToken(credentials.email(), TokenKind.EMAIL_VERIFICATION));
    log.info("principal registered: principal={} role={}", principal.id(), role.code());
    return toResponse(issueTokens(principal));
  }

  /** Token pair for a principal whose credentials were already checked by the caller. */
  public TokenPair issueTokens(Principal principal) {
    if (!principal.canAuthenticate()) {
      throw AuthException.disabled();
    }
    return tokenCodec.issuePair(principal.id(), principal.role());
  }

  /**
   * Exchanges a refresh token for a new pair. The role is taken from the current principal record,
   * not from the presented token, so role changes apply at the next refresh.
   */
  public AuthDtos.TokenResponse refresh(AuthDtos.RefreshRequest request) {
    TokenAssertion assertion = tokenCodec.verify(request.refreshToken(), TokenKind.REFRESH);
    UUID id = parseSubject(assertion.subject());
    Principal principal =
        principals
            .findByIdIgnoringActive(id)
            .orElseThrow(() -> AuthException.unauthenticated("principal not found"));
    TokenPair pair = issueTokens(principal);
    metrics.tokenRefreshed();
    log.debug("tokens refreshed: principal={}", principal.id());
    return toResponse(pair);
  }

  /** Mails a reset token when the email is registered. The outcome is never revealed to the caller. */
  public void requestPasswordReset(AuthDtos.PasswordResetRequest request) {
    Optional<PrincipalCredentials> credentials = principals.findCredentialsByEmail(request.email());
    if (credentials.isEmpty()) {
      log.debug("password reset requested for unknown email");
      return;
    }
    String email = credentials.get().email();
    mailer.sendPasswordReset(email, tokenCodec.issueEmailToken(email, TokenKind.PASSWORD_RESET));
  }

  public void resetPassword(AuthDtos.PasswordResetConfirmRequest request) {
    TokenAssertion assertion = tokenCodec.verify(request.token(), TokenKind.PASSWORD_RESET);
    PrincipalCredentials credentials =
        principals.findCredentialsByEmail(assertion.subject()).orElseThrow(AuthException::invalidToken);
    principals.updateCredentials(credentials.withPasswordHash(passwordHasher.hash(request.newPassword())));
    log.info("password reset: principal={}", credentials.principalId());
  }

  public void verifyEmail(AuthDtos.EmailVerificationRequest request) {
    TokenAssertion assertion = tokenCodec.verify(request.token(), TokenKind.EMAIL_VERIFICATION);
    PrincipalCredentials credentials =
        principals.findCredentialsByEmail(assertion.subject()).orElseThrow(AuthException::invalidToken);
    Principal principal =
        principals
            .findByIdIgnoringActive(credentials.principalId())
            .orElseThrow(AuthException::invalidToken);
    if (!principal.emailVerified()) {
      principals.save(principal.withEmailVerified());
      log.info("email verified: principal={}", principal.id());
    }
  }

  public AuthDtos.MeResponse me(Principal principal) {
    return new AuthDtos.MeResponse(
        principal.id().toString(), principal.role().code(), principal.active(), principal.emailVerified());
  }

  public static AuthDtos.TokenResponse toResponse(TokenPair pair) {
    return new AuthDtos.TokenResponse(
        pair.accessToken(), pair.refreshToken(), pair.tokenType(), pair.expiresInSeconds());
  }

  private static UUID parseSubject(String subject) {
    try {
      return UUID.fromString(subject);
    } catch (IllegalArgumentException e) {
      throw AuthException.invalidToken();
    }
  }
}
