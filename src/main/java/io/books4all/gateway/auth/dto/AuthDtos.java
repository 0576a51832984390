package io.books4all.gateway.auth.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public final class AuthDtos {
  private AuthDtos() {}

  public record LoginRequest(@NotBlank @Email String email, @NotBlank String password) {}

  /** {@code role} defaults to buyer; only buyer and seller may self-register. */
  public record RegisterRequest(
      @NotBlank @Email String email, @NotBlank @Size(min = 8, max = 72) String password, String role) {}

  public record RefreshRequest(@NotBlank String refreshToken) {}

  public record PasswordResetRequest(@NotBlank @Email String email) {}

  public record PasswordResetConfirmRequest(
      @NotBlank String token, @NotBlank @Size(min = 8, max = 72) String newPassword) {}

  public record EmailVerificationRequest(@NotBlank String token) {}

  public record TokenResponse(
      String accessToken, String refreshToken, String tokenType, long expiresIn) {}

  public record MeResponse(String id, String role, boolean active, boolean emailVerified) {}

  public record RateLimitResetRequest(@NotBlank String identifier, @NotBlank String endpoint) {}
}
