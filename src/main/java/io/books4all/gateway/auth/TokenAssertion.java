package io.books4all.gateway.auth;

import java.time.Instant;

/** Verified token claims. {@code role} is null for password-reset and email-verification tokens. */
public record TokenAssertion(
    String subject,
    Role role,
    TokenKind kind,
    Instant issuedAt,
    Instant expiresAt,
    String revocationId) {}
