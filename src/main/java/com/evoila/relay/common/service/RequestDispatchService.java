package com.evoila.relay.common.service;

import com.evoila.relay.common.config.RelayProperties;
import com.evoila.relay.common.config.TargetModel;
import com.evoila.relay.common.exception.ProviderInvocationException;
import com.evoila.relay.common.model.CredentialSet;
import com.evoila.relay.common.model.DispatchRequest;
import com.evoila.relay.common.model.ProviderResponse;
import com.evoila.relay.provider.AzureOpenAiProvider;
import com.evoila.relay.provider.BedrockProvider;
import com.evoila.relay.provider.ModelProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import tools.jackson.databind.json.JsonMapper;

/**
 * Core service for dispatching a prompt to a model provider.
 *
 * <p>Pipeline: validate the request, resolve credentials from the secret store, invoke the
 * selected provider, format the response. Every failure is turned into an error response by the
 * {@link ErrorHandler}; nothing is retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequestDispatchService {

  private final RequestValidator requestValidator;
  private final CredentialResolver credentialResolver;
  private final BedrockProvider bedrockProvider;
  private final AzureOpenAiProvider azureOpenAiProvider;
  private final RelayProperties relayProperties;
  private final ErrorHandler errorHandler;
  private final JsonMapper jsonMapper;

  /**
   * Processes one inbound request.
   *
   * @param method The HTTP method of the inbound request
   * @param rawBody The raw request body, may be null
   * @return Mono containing the response entity with a JSON body
   */
  public Mono<ResponseEntity<String>> dispatch(HttpMethod method, String rawBody) {
    // validation runs inside defer so its exceptions become Mono.error()
    return Mono.defer(() -> Mono.just(requestValidator.validate(method, rawBody)))
        .flatMap(this::invokeWithCredentials)
        .map(this::toResponseEntity)
        .onErrorResume(errorHandler::handleError);
  }

  private Mono<ProviderResponse> invokeWithCredentials(DispatchRequest request) {
    log.debug("Dispatching prompt to {}", request.targetModel());
    return credentialResolver
        .resolve()
        .flatMap(credentials -> invokeProvider(request, credentials))
        .map(reply -> new ProviderResponse(request.targetModel().getResponseModel(), reply));
  }

  private Mono<String> invokeProvider(DispatchRequest request, CredentialSet credentials) {
    ModelProvider provider = selectProvider(request.targetModel());

    return Mono.defer(() -> provider.invoke(request.prompt(), credentials))
        .timeout(relayProperties.getProvider().getTimeout())
        .onErrorMap(e -> new ProviderInvocationException(provider.target(), e));
  }

  private ModelProvider selectProvider(TargetModel target) {
    return switch (target) {
      case BEDROCK -> bedrockProvider;
      case AZURE -> azureOpenAiProvider;
    };
  }

  private ResponseEntity<String> toResponseEntity(ProviderResponse response) {
    log.info("Provider {} answered", response.model());
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .body(jsonMapper.writeValueAsString(response));
  }
}
