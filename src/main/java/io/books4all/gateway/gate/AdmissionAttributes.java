package io.books4all.gateway.gate;

import io.books4all.gateway.auth.AuthException;
import io.books4all.gateway.auth.Principal;
import java.util.Optional;
import org.springframework.web.server.ServerWebExchange;

public final class AdmissionAttributes {
  public static final String PRINCIPAL = AdmissionAttributes.class.getName() + ".principal";

  private AdmissionAttributes() {}

  public static Optional<Principal> principal(ServerWebExchange exchange) {
    return Optional.ofNullable(exchange.<Principal>getAttribute(PRINCIPAL));
  }

  public static Principal requirePrincipal(ServerWebExchange exchange) {
    return principal(exchange).orElseThrow(() -> AuthException.unauthenticated("not authenticated"));
  }
}
