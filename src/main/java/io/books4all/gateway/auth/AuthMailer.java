package io.books4all.gateway.auth;

/** Outbound delivery of the password-reset and email-verification tokens. */
public interface AuthMailer {

  void sendPasswordReset(String email, String token);

  void sendEmailVerification(String email, String token);
}
