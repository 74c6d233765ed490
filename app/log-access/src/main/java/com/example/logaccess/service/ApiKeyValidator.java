package com.example.logaccess.service;

import com.example.logaccess.model.ApiKeyRecord;
import com.example.logaccess.model.CallerIdentity;
import com.example.logaccess.repository.ApiKeyRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ApiKeyValidator {

  private static final Logger logger = LoggerFactory.getLogger(ApiKeyValidator.class);

  private final ApiKeyRepository apiKeyRepository;

  /**
   * Resolves the login bound to {@code key}.
   *
   * @throws InvalidApiKeyException when the key is blank or has no row in the key store
   * @throws KeyStoreUnavailableException when the key store cannot be queried
   */
  public CallerIdentity validate(String key) {
    if (key == null || key.isBlank()) {
      throw new InvalidApiKeyException();
    }
    final ApiKeyRecord apiKey;
    try {
      apiKey = apiKeyRepository.findByUserKey(key).orElseThrow(InvalidApiKeyException::new);
    } catch (DataAccessException ex) {
      logger.error("api key lookup failed", ex);
      throw new KeyStoreUnavailableException("api key store is unavailable", ex);
    }
    return new CallerIdentity(apiKey.login());
  }
}
