package io.books4all.gateway.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Fallback used until a mail transport is wired in. Token values are never logged. */
@Component
public class LoggingAuthMailer implements AuthMailer {
  private static final Logger log = LoggerFactory.getLogger(LoggingAuthMailer.class);

  @Override
  public void sendPasswordReset(String email, String token) {
    log.warn("no mail transport configured, password reset mail dropped: email={}", email);
  }

  @Override
  public void sendEmailVerification(String email, String token) {
    log.warn("no mail transport configured, verification mail dropped: email={}", email);
  }
}
