package io.books4all.gateway.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

@Service
public class RedisPrincipalStore implements PrincipalStore {
  private static final Logger log = LoggerFactory.getLogger(RedisPrincipalStore.class);
  private static final String PREFIX_PRINCIPAL = "auth:principal:";
  private static final String PREFIX_CREDENTIAL = "auth:credential:";

  private final StringRedisTemplate redis;
  private final ObjectMapper objectMapper;

  public RedisPrincipalStore(StringRedisTemplate redis, ObjectMapper objectMapper) {
    this.redis = redis;
    this.objectMapper = objectMapper;
  }

  @Override
  public Optional<Principal> findActiveById(UUID id) {
    return findByIdIgnoringActive(id).filter(Principal::active);
  }

  @Override
  public Optional<Principal> findByIdIgnoringActive(UUID id) {
    if (id == null) return Optional.empty();
    return getJson(PREFIX_PRINCIPAL + id, Principal.class).filter(p -> !p.deleted());
  }

  @Override
  public void save(Principal principal) {
    redis.opsForValue().set(PREFIX_PRINCIPAL + principal.id(), toJson(principal));
  }

  @Override
  public Optional<PrincipalCredentials> findCredentialsByEmail(String email) {
    if (email == null || email.isBlank()) return Optional.empty();
    return getJson(credentialKey(email), PrincipalCredentials.class);
  }

  @Override
  public boolean createCredentials(PrincipalCredentials credentials) {
    Boolean stored = redis.opsForValue().setIfAbsent(credentialKey(credentials.email()), toJson(credentials));
    return Boolean.TRUE.equals(stored);
  }

  @Override
  public void updateCredentials(PrincipalCredentials credentials) {
    redis.opsForValue().set(credentialKey(credentials.email()), toJson(credentials));
  }

  private static String credentialKey(String email) {
    return PREFIX_CREDENTIAL + PrincipalCredentials.normalizeEmail(email);
  }

  private String toJson(Object document) {
    try {
      return objectMapper.writeValueAsString(document);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(document.getClass().getSimpleName() + " is not serializable", e);
    }
  }

  private <T> Optional<T> getJson(String key, Class<T> type) {
    String raw = redis.opsForValue().get(key);
    if (raw == null || raw.isBlank()) return Optional.empty();
    try {
      return Optional.of(objectMapper.readValue(raw, type));
    } catch (JsonProcessingException e) {
      log.warn("unreadable {} document: key={}", type.getSimpleName(), key);
      return Optional.empty();
    }
  }
}
