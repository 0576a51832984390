package io.books4all.gateway.gate;

import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpMethod;
import org.springframework.http.server.PathContainer;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;

/** Ordered route table; the first matching entry wins, otherwise the default policy applies. */
public final class RoutePolicyRegistry {
  private final List<Entry> entries;
  private final RoutePolicy defaultPolicy;

  private RoutePolicyRegistry(List<Entry> entries, RoutePolicy defaultPolicy) {
    this.entries = List.copyOf(entries);
    this.defaultPolicy = defaultPolicy;
  }

  public static Builder builder(RoutePolicy defaultPolicy) {
    return new Builder(defaultPolicy);
  }

  public RoutePolicy resolve(HttpMethod method, String path) {
    return resolve(method, PathContainer.parsePath(path == null ? "" : path));
  }

  public RoutePolicy resolve(HttpMethod method, PathContainer path) {
    for (Entry entry : entries) {
      if (entry.matches(method, path)) return entry.policy();
    }
    return defaultPolicy;
  }

  public RoutePolicy defaultPolicy() {
    return defaultPolicy;
  }

  private record Entry(HttpMethod method, PathPattern pattern, RoutePolicy policy) {
    boolean matches(HttpMethod requestMethod, PathContainer path) {
      return (method == null || method.equals(requestMethod)) && pattern.matches(path);
    }
  }

  public static final class Builder {
    private final PathPatternParser parser = PathPatternParser.defaultInstance;
    private final List<Entry> entries = new ArrayList<>();
    private final RoutePolicy defaultPolicy;

    private Builder(RoutePolicy defaultPolicy) {
      if (defaultPolicy == null) throw new IllegalArgumentException("default policy required");
      this.defaultPolicy = defaultPolicy;
    }

    /** Matches any method. */
    public Builder route(String pattern, RoutePolicy policy) {
      return route(null, pattern, policy);
    }

    public Builder route(HttpMethod method, String pattern, RoutePolicy policy) {
      if (policy == null) throw new IllegalArgumentException("policy required for " + pattern);
      entries.add(new Entry(method, parser.parse(pattern), policy));
      return this;
    }

    public RoutePolicyRegistry build() {
      return new RoutePolicyRegistry(entries, defaultPolicy);
    }
  }
}
