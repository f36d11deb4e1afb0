package com.evoila.relay.common.service;

import com.evoila.relay.common.config.RelayProperties;
import com.evoila.relay.common.exception.CredentialFormatException;
import com.evoila.relay.common.exception.CredentialLookupException;
import com.evoila.relay.common.model.CredentialSet;
import com.evoila.relay.secretstore.SecretStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * Resolves provider credentials from the secret store for every activation. Nothing is cached:
 * each call performs a fresh lookup of the configured secret.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialResolver {

  private final SecretStore secretStore;
  private final RelayProperties relayProperties;
  private final JsonMapper jsonMapper;

  /**
   * Fetches and decodes the credential secret.
   *
   * @return Mono emitting the credentials, or failing with {@link CredentialLookupException} or
   *     {@link CredentialFormatException}
   */
  public Mono<CredentialSet> resolve() {
    String secretName = relayProperties.getSecrets().getSecretName();
    if (!StringUtils.hasText(secretName)) {
      return Mono.error(new CredentialLookupException("No secret name configured"));
    }

    return secretStore
        .fetchSecret(secretName)
        .onErrorMap(
            e -> !(e instanceof CredentialLookupException),
            e -> new CredentialLookupException("Unable to retrieve secret " + secretName, e))
        .switchIfEmpty(
            Mono.error(() -> new CredentialLookupException("Secret " + secretName + " is empty")))
        .map(this::decode)
        .doOnNext(credentials -> log.debug("Resolved credentials from secret {}", secretName));
  }

  private CredentialSet decode(String secretString) {
    CredentialSet credentials;
    try {
      credentials = jsonMapper.readValue(secretString, CredentialSet.class);
    } catch (JacksonException e) {
      // the parser message may quote the secret, keep it out of the exception
      throw new CredentialFormatException("Secret payload is not a JSON object");
    }

    if (credentials == null) {
      throw new CredentialFormatException("Secret payload is empty");
    }
    requireField(credentials.bedrockApiKey(), "bedrock_api_key");
    requireField(credentials.azureApiKey(), "azure_api_key");
    requireField(credentials.azureEndpoint(), "azure_endpoint");
    return credentials;
  }

  private void requireField(String value, String key) {
    if (!StringUtils.hasText(value)) {
      throw new CredentialFormatException("Secret payload is missing '" + key + "'");
    }
  }
}
