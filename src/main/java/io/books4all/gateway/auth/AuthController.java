package io.books4all.gateway.auth;

import io.books4all.gateway.auth.dto.AuthDtos;
import io.books4all.gateway.gate.AdmissionAttributes;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@Validated
public class AuthController {
  private final AuthService authService;

  public AuthController(AuthService authService) {
    this.authService = authService;
  }

  @PostMapping(path = "/api/v1/auth/login", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<AuthDtos.TokenResponse> login(@Valid @RequestBody AuthDtos.LoginRequest request) {
    return Mono.fromCallable(() -> authService.login(request)).subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping(path = "/api/v1/auth/register", produces = MediaType.APPLICATION_JSON_VALUE)
  @ResponseStatus(HttpStatus.CREATED)
  public Mono<AuthDtos.TokenResponse> register(@Valid @RequestBody AuthDtos.RegisterRequest request) {
    return Mono.fromCallable(() -> authService.register(request)).subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping(path = "/api/v1/auth/refresh", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<AuthDtos.TokenResponse> refresh(@Valid @RequestBody AuthDtos.RefreshRequest request) {
    return Mono.fromCallable(() -> authService.refresh(request))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping(path = "/api/v1/auth/password-reset/request")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public Mono<Void> requestPasswordReset(@Valid @RequestBody AuthDtos.PasswordResetRequest request) {
    return Mono.fromRunnable(() -> authService.requestPasswordReset(request))
        .subscribeOn(Schedulers.boundedElastic())
        .then();
  }

  @PostMapping(path = "/api/v1/auth/password-reset/confirm")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public Mono<Void> confirmPasswordReset(@Valid @RequestBody AuthDtos.PasswordResetConfirmRequest request) {
    return Mono.fromRunnable(() -> authService.resetPassword(request))
        .subscribeOn(Schedulers.boundedElastic())
        .then();
  }

  @PostMapping(path = "/api/v1/auth/verify-email")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public Mono<Void> verifyEmail(@Valid @RequestBody AuthDtos.EmailVerificationRequest request) {
    return Mono.fromRunnable(() -> authService.verifyEmail(request))
        .subscribeOn(Schedulers.boundedElastic())
        .then();
  }

  @GetMapping(path = "/api/v1/auth/me", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<AuthDtos.MeResponse> me(ServerWebExchange exchange) {
    return Mono.fromCallable(() -> authService.me(AdmissionAttributes.requirePrincipal(exchange)));
  }
}
