package com.evoila.relay.common.model;

import com.evoila.relay.common.config.TargetModel;

/** A validated prompt together with the provider it is routed to. */
public record DispatchRequest(String prompt, TargetModel targetModel) {}
