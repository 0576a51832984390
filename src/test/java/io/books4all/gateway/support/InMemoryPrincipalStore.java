package io.books4all.gateway.support;

import io.books4all.gateway.auth.Principal;
import io.books4all.gateway.auth.PrincipalCredentials;
import io.books4all.gateway.auth.PrincipalStore;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPrincipalStore implements PrincipalStore {
  private final Map<UUID, Principal> principals = new ConcurrentHashMap<>();
  private final Map<String, PrincipalCredentials> credentials = new ConcurrentHashMap<>();

  @Override
  public Optional<Principal> findActiveById(UUID id) {
    return findByIdIgnoringActive(id).filter(Principal::active);
  }

  @Override
  public Optional<Principal> findByIdIgnoringActive(UUID id) {
    return Optional.ofNullable(principals.get(id)).filter(p -> !p.deleted());
  }

  @Override
  public void save(Principal principal) {
    principals.put(principal.id(), principal);
  }

  @Override
  public Optional<PrincipalCredentials> findCredentialsByEmail(String email) {
    return Optional.ofNullable(credentials.get(PrincipalCredentials.normalizeEmail(email)));
  }

  @Override
  public boolean createCredentials(PrincipalCredentials entry) {
    return credentials.putIfAbsent(entry.email(), entry) == null;
  }

  @Override
  public void updateCredentials(PrincipalCredentials entry) {
    credentials.put(entry.email(), entry);
  }
}
