package com.evoila.relay.secretstore;

import com.evoila.relay.common.exception.CredentialLookupException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;

/**
 * AWS Secrets Manager backed secret store. The SDK client is blocking, so each lookup runs on the
 * bounded elastic scheduler. The client is shared; secret values are never kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SecretsManagerSecretStore implements SecretStore {

  private final SecretsManagerClient secretsManagerClient;

  @Override
  public Mono<String> fetchSecret(String secretId) {
    return Mono.fromCallable(() -> getSecretString(secretId))
        .subscribeOn(Schedulers.boundedElastic());
  }

  private String getSecretString(String secretId) {
    log.debug("Fetching secret {} from Secrets Manager", secretId);
    GetSecretValueResponse response;
    try {
      response =
          secretsManagerClient.getSecretValue(
              GetSecretValueRequest.builder().secretId(secretId).build());
    } catch (SdkException e) {
      log.error("Error retrieving secret {}: {}", secretId, e.getMessage());
      throw new CredentialLookupException("Unable to retrieve secret " + secretId, e);
    }

    if (response.secretString() == null) {
      // binary secrets are not supported
      throw new CredentialLookupException("Secret " + secretId + " has no string value");
    }
    return response.secretString();
  }
}
