package com.evoila.relay.provider;

import com.evoila.relay.common.config.TargetModel;
import com.evoila.relay.common.model.CredentialSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Amazon Bedrock provider. The remote call is simulated. */
@Slf4j
@Component
public class BedrockProvider implements ModelProvider {

  @Override
  public TargetModel target() {
    return TargetModel.BEDROCK;
  }

  @Override
  public Mono<String> invoke(String prompt, CredentialSet credentials) {
    return Mono.fromSupplier(
        () -> {
          if (credentials.bedrockApiKey() == null) {
            throw new IllegalStateException("Bedrock API key is not available");
          }
          log.info("Calling Bedrock API");
          log.debug("Bedrock prompt: {}", prompt);
          return "Simulated Bedrock response to '" + prompt + "'";
        });
  }
}
