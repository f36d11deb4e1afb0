package com.evoila.relay.secretstore;

import reactor.core.publisher.Mono;

/** Key-value lookup for secret strings held outside the process. */
public interface SecretStore {

  /**
   * Fetch the string payload of a secret
   *
   * @param secretId identifier of the secret (name or ARN)
   * @return Mono emitting the secret string, or an error if the lookup failed
   */
  Mono<String> fetchSecret(String secretId);
}
