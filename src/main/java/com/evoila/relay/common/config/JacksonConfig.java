package com.evoila.relay.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.cfg.CoercionAction;
import tools.jackson.databind.cfg.CoercionInputShape;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.type.LogicalType;

/**
 * Shared JSON mapper. String fields only accept JSON strings: numbers and booleans are rejected
 * instead of being coerced, so {@code {"prompt": 5}} is a malformed request.
 */
@Configuration
public class JacksonConfig {

  @Bean
  public JsonMapper jsonMapper() {
    return strictTextualMapper();
  }

  public static JsonMapper strictTextualMapper() {
    return JsonMapper.builder()
        .withCoercionConfig(
            LogicalType.Textual,
            config ->
                config
                    .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                    .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                    .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
        .build();
  }
}
