package com.evoila.relay.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Raw inbound body before validation. Either field may be null. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DispatchRequestBody(
    @JsonProperty("prompt") String prompt, @JsonProperty("target_model") String targetModel) {}
