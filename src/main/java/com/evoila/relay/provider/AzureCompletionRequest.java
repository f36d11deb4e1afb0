package com.evoila.relay.provider;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Completion payload posted to an Azure OpenAI deployment. */
public record AzureCompletionRequest(
    @JsonProperty("prompt") String prompt, @JsonProperty("max_tokens") int maxTokens) {}
