package com.evoila.relay.common.model;

/** Body of every non-2xx response. */
public record ErrorResponse(String error) {}
