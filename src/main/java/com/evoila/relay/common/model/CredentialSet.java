package com.evoila.relay.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Provider credentials decoded from the secret store. Lives for a single activation and is never
 * logged; {@link #toString()} masks every value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CredentialSet(
    @JsonProperty("bedrock_api_key") String bedrockApiKey,
    @JsonProperty("azure_api_key") String azureApiKey,
    @JsonProperty("azure_endpoint") String azureEndpoint) {

  @Override
  public String toString() {
    return "CredentialSet[bedrockApiKey=***, azureApiKey=***, azureEndpoint=***]";
  }
}
