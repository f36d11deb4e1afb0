package com.evoila.relay.common.config;

import java.time.Duration;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Relay configuration properties. Holds the secret store coordinates used to resolve provider
 * credentials and the bound applied to outbound provider calls.
 */
@Data
@Component
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

  private SecretsConfig secrets = new SecretsConfig();
  private ProviderConfig provider = new ProviderConfig();

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class SecretsConfig {
    private String secretName; // sourced from SECRET_NAME
    @Builder.Default private String region = "us-east-1";
    private String endpointOverride;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ProviderConfig {
    @Builder.Default private Duration timeout = Duration.ofSeconds(10);
  }
}
