package io.books4all.gateway.auth;

import java.util.Optional;
import java.util.UUID;

/** Persistence collaborator holding principal records. Soft-deleted records are never returned. */
public interface PrincipalStore {

  /** Principal that is neither soft-deleted nor inactive. */
  Optional<Principal> findActiveById(UUID id);

  /** Principal that is not soft-deleted, whatever its active flag. */
  Optional<Principal> findByIdIgnoringActive(UUID id);

  void save(Principal principal);

  Optional<PrincipalCredentials> findCredentialsByEmail(String email);

  /** Stores credentials for an email that has none yet. Returns false when the email is taken. */
  boolean createCredentials(PrincipalCredentials credentials);

  void updateCredentials(PrincipalCredentials credentials);
}
