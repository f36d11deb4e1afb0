package com.evoila.relay.common.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.evoila.relay.base.BaseUnitTest;
import com.evoila.relay.common.exception.CredentialFormatException;
import com.evoila.relay.common.exception.CredentialLookupException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class CredentialResolverTest extends BaseUnitTest {

  private CredentialResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new CredentialResolver(mockSecretStore, relayProperties, jsonMapper);
  }

  @Test
  void resolve_ShouldDecodeAllCredentialFields() {
    when(mockSecretStore.fetchSecret(SECRET_NAME)).thenReturn(Mono.just(createSecretString()));

    StepVerifier.create(resolver.resolve())
        .assertNext(
            credentials -> {
              assertThat(credentials.bedrockApiKey()).isEqualTo("DUMMY_BEDROCK_KEY");
              assertThat(credentials.azureApiKey()).isEqualTo("DUMMY_AZURE_KEY");
              assertThat(credentials.azureEndpoint())
                  .isEqualTo("https://your-azure-openai-endpoint");
            })
        .verifyComplete();
  }

  @Test
  void resolve_ShouldFetchFreshSecretOnEveryCall() {
    when(mockSecretStore.fetchSecret(SECRET_NAME))
        .thenReturn(Mono.just(createSecretString()))
        .thenReturn(
            Mono.just(
                "{\"bedrock_api_key\":\"ROTATED\",\"azure_api_key\":\"a\",\"azure_endpoint\":\"e\"}"));

    StepVerifier.create(resolver.resolve()).expectNextCount(1).verifyComplete();
    StepVerifier.create(resolver.resolve())
        .assertNext(credentials -> assertThat(credentials.bedrockApiKey()).isEqualTo("ROTATED"))
        .verifyComplete();
  }

  @Test
  void resolve_StoreFailure_ShouldFailWithLookupError() {
    when(mockSecretStore.fetchSecret(SECRET_NAME))
        .thenReturn(Mono.error(new IllegalStateException("AccessDeniedException")));

    StepVerifier.create(resolver.resolve())
        .expectErrorSatisfies(
            e -> {
              assertThat(e).isInstanceOf(CredentialLookupException.class);
              assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
            })
        .verify();
  }

  @Test
  void resolve_LookupErrorFromStore_ShouldPassThroughUnchanged() {
    CredentialLookupException original = new CredentialLookupException("no such secret");
    when(mockSecretStore.fetchSecret(SECRET_NAME)).thenReturn(Mono.error(original));

    StepVerifier.create(resolver.resolve()).expectErrorMatches(e -> e == original).verify();
  }

  @Test
  void resolve_EmptyStoreResult_ShouldFailWithLookupError() {
    when(mockSecretStore.fetchSecret(SECRET_NAME)).thenReturn(Mono.empty());

    StepVerifier.create(resolver.resolve()).expectError(CredentialLookupException.class).verify();
  }

  @Test
  void resolve_NoSecretNameConfigured_ShouldFailWithoutCallingStore() {
    resolver =
        new CredentialResolver(
            mockSecretStore, createProperties("", Duration.ofSeconds(1)), jsonMapper);

    StepVerifier.create(resolver.resolve()).expectError(CredentialLookupException.class).verify();
    verifyNoInteractions(mockSecretStore);
  }

  @Test
  void resolve_NonJsonPayload_ShouldFailWithFormatErrorWithoutLeakingSecret() {
    when(mockSecretStore.fetchSecret(SECRET_NAME))
        .thenReturn(Mono.just("bedrock_api_key=SUPER_SECRET"));

    StepVerifier.create(resolver.resolve())
        .expectErrorSatisfies(
            e -> {
              assertThat(e).isInstanceOf(CredentialFormatException.class);
              assertThat(e.getMessage()).doesNotContain("SUPER_SECRET");
              assertThat(e.getCause()).isNull();
            })
        .verify();
  }

  @Test
  void resolve_MissingKey_ShouldFailWithFormatError() {
    when(mockSecretStore.fetchSecret(SECRET_NAME))
        .thenReturn(Mono.just("{\"bedrock_api_key\":\"k\",\"azure_api_key\":\"a\"}"));

    StepVerifier.create(resolver.resolve())
        .expectErrorSatisfies(
            e -> {
              assertThat(e).isInstanceOf(CredentialFormatException.class);
              assertThat(e.getMessage()).contains("azure_endpoint");
            })
        .verify();
  }

  @Test
  void credentialSet_ToString_ShouldMaskValues() {
    assertThat(createTestCredentials().toString())
        .doesNotContain("DUMMY_BEDROCK_KEY")
        .doesNotContain("DUMMY_AZURE_KEY");
  }
}
