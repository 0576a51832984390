package io.books4all.gateway.auth;

import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

/** bcrypt hashing of login passwords. */
@Component
public class PasswordHasher {
  private final BCryptPasswordEncoder encoder;
  // compared against when the email is unknown so both login failures cost one bcrypt round
  private final String unknownAccountHash;

  public PasswordHasher(AuthProperties authProperties) {
    this.encoder = new BCryptPasswordEncoder(authProperties.getPasswordHashStrength());
    this.unknownAccountHash = encoder.encode("unknown-account");
  }

  public String hash(String rawPassword) {
    if (rawPassword == null || rawPassword.isEmpty()) {
      throw new IllegalArgumentException("password required");
    }
    return encoder.encode(rawPassword);
  }

  public boolean matches(String rawPassword, String hash) {
    if (rawPassword == null) return false;
    return encoder.matches(rawPassword, hash == null ? unknownAccountHash : hash);
  }
}
