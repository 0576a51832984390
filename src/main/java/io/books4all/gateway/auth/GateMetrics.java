package io.books4all.gateway.auth;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class GateMetrics {
  private final MeterRegistry meterRegistry;
  private final AuthProperties authProperties;

  public GateMetrics(MeterRegistry meterRegistry, AuthProperties authProperties) {
    this.meterRegistry = meterRegistry;
    this.authProperties = authProperties;
  }

  public void authRejected(AuthErrorCode code) {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("gate.auth.rejected", "reason", code.name().toLowerCase()).increment();
  }

  public void forbidden() {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("gate.auth.forbidden").increment();
  }

  public void loginFailed() {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("gate.auth.login_failed").increment();
  }

  public void tokenRefreshed() {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("gate.auth.token_refreshed").increment();
  }

  public void rateLimited(String scope) {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("gate.ratelimit.rejected", "scope", scope).increment();
  }

  public void limiterStoreUnavailable(String failureMode) {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("gate.ratelimit.store_unavailable", "mode", failureMode).increment();
  }
}
