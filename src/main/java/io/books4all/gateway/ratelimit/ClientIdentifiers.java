package io.books4all.gateway.ratelimit;

import io.books4all.gateway.auth.Principal;
import java.net.InetSocketAddress;
import java.util.Locale;
import org.springframework.http.server.reactive.ServerHttpRequest;

/**
 * Rate-limit identity of a caller: {@code user:<id>} when authenticated, otherwise {@code ip:<addr>}.
 *
 * <p>The first {@code X-Forwarded-For} hop is taken as-is. Any client can forge that header when no
 * trusted proxy strips it, so anonymous limits are only as strong as the deployment's proxy setup.
 */
public final class ClientIdentifiers {
  public static final String FORWARDED_FOR = "X-Forwarded-For";
  public static final String UNKNOWN = "unknown";

  private ClientIdentifiers() {}

  public static String forPrincipal(Principal principal) {
    return "user:" + principal.id();
  }

  public static String forRequest(ServerHttpRequest request) {
    return "ip:" + clientAddress(request);
  }

  public static String clientAddress(ServerHttpRequest request) {
    String forwarded = request.getHeaders().getFirst(FORWARDED_FOR);
    if (forwarded != null && !forwarded.isBlank()) {
      int idx = forwarded.indexOf(',');
      String first = idx >= 0 ? forwarded.substring(0, idx) : forwarded;
      if (!first.isBlank()) return normalize(first);
    }
    InetSocketAddress remote = request.getRemoteAddress();
    if (remote == null) return UNKNOWN;
    if (remote.getAddress() == null) {
      return remote.getHostString() == null ? UNKNOWN : normalize(remote.getHostString());
    }
    return normalize(remote.getAddress().getHostAddress());
  }

  private static String normalize(String ip) {
    return ip.trim().toLowerCase(Locale.ROOT);
  }
}
