package io.books4all.gateway.controller;

import io.books4all.gateway.auth.AccessPolicy;
import io.books4all.gateway.auth.dto.AuthDtos;
import io.books4all.gateway.gate.AdmissionAttributes;
import io.books4all.gateway.ratelimit.SlidingWindowRateLimiter;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping(path = "/api/v1/admin/rate-limits")
@Validated
public class AdminRateLimitController {
  private final SlidingWindowRateLimiter limiter;

  public AdminRateLimitController(SlidingWindowRateLimiter limiter) {
    this.limiter = limiter;
  }

  @PostMapping("/reset")
  public Mono<ResponseEntity<Void>> reset(
      @Valid @RequestBody AuthDtos.RateLimitResetRequest request, ServerWebExchange exchange) {
    return Mono.fromCallable(
            () -> {
              AccessPolicy.ADMIN_ONLY.require(AdmissionAttributes.requirePrincipal(exchange));
              limiter.reset(request.identifier(), request.endpoint());
              return ResponseEntity.noContent().<Void>build();
            })
        .subscribeOn(Schedulers.boundedElastic());
  }
}
