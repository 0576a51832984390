package io.books4all.gateway.ratelimit;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.rate-limit")
public class RateLimitProperties {
  private boolean enabled = true;
  private RateLimitFailureMode failureMode = RateLimitFailureMode.OPEN;
  private String keyPrefix = "rate_limit:";
  private int defaultCalls = 100;
  private long defaultPeriodSeconds = 60;
  private int loginCalls = 5;
  private long loginPeriodSeconds = 900;
  private int strictCalls = 10;
  private long strictPeriodSeconds = 60;

  private Global global = new Global();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public RateLimitFailureMode getFailureMode() {
    return failureMode;
  }

  public void setFailureMode(RateLimitFailureMode failureMode) {
    this.failureMode = failureMode;
  }

  public String getKeyPrefix() {
    return keyPrefix;
  }

  public void setKeyPrefix(String keyPrefix) {
    this.keyPrefix = keyPrefix;
  }

  public int getDefaultCalls() {
    return defaultCalls;
  }

  public void setDefaultCalls(int defaultCalls) {
    this.defaultCalls = defaultCalls;
  }

  public long getDefaultPeriodSeconds() {
    return defaultPeriodSeconds;
  }

  public void setDefaultPeriodSeconds(long defaultPeriodSeconds) {
    this.defaultPeriodSeconds = defaultPeriodSeconds;
  }

  public int getLoginCalls() {
    return loginCalls;
  }

  public void setLoginCalls(int loginCalls) {
    this.loginCalls = loginCalls;
  }

  public long getLoginPeriodSeconds() {
    return loginPeriodSeconds;
  }

  public void setLoginPeriodSeconds(long loginPeriodSeconds) {
    this.loginPeriodSeconds = loginPeriodSeconds;
  }

  public int getStrictCalls() {
    return strictCalls;
  }

  public void setStrictCalls(int strictCalls) {
    this.strictCalls = strictCalls;
  }

  public long getStrictPeriodSeconds() {
    return strictPeriodSeconds;
  }

  public void setStrictPeriodSeconds(long strictPeriodSeconds) {
    this.strictPeriodSeconds = strictPeriodSeconds;
  }

  public Global getGlobal() {
    return global;
  }

  public void setGlobal(Global global) {
    this.global = global;
  }

  public RateLimitRule defaultRule() {
    return new RateLimitRule(defaultCalls, defaultPeriodSeconds);
  }

  public RateLimitRule loginRule() {
    return new RateLimitRule(loginCalls, loginPeriodSeconds);
  }

  public RateLimitRule strictRule() {
    return new RateLimitRule(strictCalls, strictPeriodSeconds);
  }

  public static class Global {
    private boolean enabled = true;
    private int calls = 300;
    private long periodSeconds = 60;
    private List<String> exemptPaths =
        new ArrayList<>(List.of("/health", "/docs", "/redoc", "/openapi.json", "/actuator/health"));

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getCalls() {
      return calls;
    }

    public void setCalls(int calls) {
      this.calls = calls;
    }

    public long getPeriodSeconds() {
      return periodSeconds;
    }

    public void setPeriodSeconds(long periodSeconds) {
      this.periodSeconds = periodSeconds;
    }

    public List<String> getExemptPaths() {
      return exemptPaths;
    }

    public void setExemptPaths(List<String> exemptPaths) {
      this.exemptPaths = exemptPaths == null ? new ArrayList<>() : new ArrayList<>(exemptPaths);
    }

    public RateLimitRule rule() {
      return new RateLimitRule(calls, periodSeconds);
    }
  }
}
