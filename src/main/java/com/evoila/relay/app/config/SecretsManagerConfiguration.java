package com.evoila.relay.app.config;

import com.evoila.relay.common.config.RelayProperties;
import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClientBuilder;

/**
 * Creates the process-wide Secrets Manager client. It is a connection object only; secrets are
 * re-read on every request.
 */
@Slf4j
@Configuration
public class SecretsManagerConfiguration {

  @Bean
  public AwsCredentialsProvider awsCredentialsProvider() {
    return DefaultCredentialsProvider.builder().build();
  }

  @Bean(destroyMethod = "close")
  public SecretsManagerClient secretsManagerClient(
      RelayProperties relayProperties, AwsCredentialsProvider awsCredentialsProvider) {
    RelayProperties.SecretsConfig secrets = relayProperties.getSecrets();

    SecretsManagerClientBuilder builder =
        SecretsManagerClient.builder()
            .region(Region.of(secrets.getRegion()))
            .credentialsProvider(awsCredentialsProvider);

    if (StringUtils.hasText(secrets.getEndpointOverride())) {
      log.info("Using Secrets Manager endpoint override {}", secrets.getEndpointOverride());
      builder.endpointOverride(URI.create(secrets.getEndpointOverride()));
    }

    log.info("Secrets Manager client configured for region {}", secrets.getRegion());
    return builder.build();
  }
}
