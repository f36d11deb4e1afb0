package com.evoila.relay.provider;

import com.evoila.relay.common.config.TargetModel;
import com.evoila.relay.common.model.CredentialSet;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Azure OpenAI provider. Builds the completion request for the configured endpoint; the remote
 * call itself is simulated.
 */
@Slf4j
@Component
public class AzureOpenAiProvider implements ModelProvider {

  static final String API_KEY_HEADER = "api-key";
  static final int MAX_TOKENS = 100;

  @Override
  public TargetModel target() {
    return TargetModel.AZURE;
  }

  @Override
  public Mono<String> invoke(String prompt, CredentialSet credentials) {
    return Mono.fromSupplier(
        () -> {
          AzureCompletionRequest request = buildRequest(prompt);
          Map<String, String> headers = buildHeaders(credentials);
          log.info("Calling Azure OpenAI at {}", credentials.azureEndpoint());
          log.debug(
              "Azure OpenAI request: max_tokens={}, headers={}",
              request.maxTokens(),
              headers.keySet());
          return "Simulated Azure OpenAI response to '" + request.prompt() + "'";
        });
  }

  AzureCompletionRequest buildRequest(String prompt) {
    return new AzureCompletionRequest(prompt, MAX_TOKENS);
  }

  Map<String, String> buildHeaders(CredentialSet credentials) {
    if (credentials.azureApiKey() == null || credentials.azureEndpoint() == null) {
      throw new IllegalStateException("Azure OpenAI credentials are not available");
    }
    return Map.of(
        HttpHeaders.CONTENT_TYPE,
        MediaType.APPLICATION_JSON_VALUE,
        API_KEY_HEADER,
        credentials.azureApiKey());
  }
}
