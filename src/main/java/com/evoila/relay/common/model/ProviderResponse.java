package com.evoila.relay.common.model;

/** Successful dispatch result: which provider answered and what it replied. */
public record ProviderResponse(String model, String reply) {}
