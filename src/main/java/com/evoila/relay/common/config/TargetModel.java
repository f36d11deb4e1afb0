package com.evoila.relay.common.config;

import com.evoila.relay.common.exception.RequestValidationException;
import java.util.Arrays;
import lombok.Getter;

/**
 * Model providers a prompt can be routed to. The request name is what callers send in {@code
 * target_model}; the response model is what the reply reports back in {@code model}.
 */
@Getter
public enum TargetModel {
  BEDROCK("bedrock", "bedrock"),
  AZURE("azure", "azure_openai");

  public static final String INVALID_TARGET_MESSAGE =
      "Invalid target_model, choose 'bedrock' or 'azure'";

  /** -- GETTER -- Name accepted in the request body (case-insensitive) */
  private final String requestName;

  /** -- GETTER -- Name reported in the response body */
  private final String responseModel;

  TargetModel(String requestName, String responseModel) {
    this.requestName = requestName;
    this.responseModel = responseModel;
  }

  /**
   * Parse a target model from the request value (case-insensitive, not trimmed)
   *
   * @param value the raw {@code target_model} value
   * @return the corresponding TargetModel
   * @throws RequestValidationException if the value names no known provider
   */
  public static TargetModel fromString(String value) {
    if (value == null) {
      throw new RequestValidationException(INVALID_TARGET_MESSAGE);
    }

    return Arrays.stream(values())
        .filter(target -> target.requestName.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new RequestValidationException(INVALID_TARGET_MESSAGE));
  }

  @Override
  public String toString() {
    return requestName;
  }
}
