package com.evoila.relay.provider;

import com.evoila.relay.common.config.TargetModel;
import com.evoila.relay.common.model.CredentialSet;
import reactor.core.publisher.Mono;

/** A remote AI model service that answers a single prompt. */
public interface ModelProvider {

  /** The target this provider serves. */
  TargetModel target();

  /**
   * Send a prompt to the provider. No retries are attempted.
   *
   * @param prompt non-empty prompt text
   * @param credentials credentials resolved for this activation
   * @return Mono emitting the reply text
   */
  Mono<String> invoke(String prompt, CredentialSet credentials);
}
