package com.evoila.relay.common.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.evoila.relay.common.config.JacksonConfig;
import com.evoila.relay.common.config.TargetModel;
import com.evoila.relay.common.exception.CredentialFormatException;
import com.evoila.relay.common.exception.CredentialLookupException;
import com.evoila.relay.common.exception.ProviderInvocationException;
import com.evoila.relay.common.exception.RequestMethodNotAllowedException;
import com.evoila.relay.common.exception.RequestValidationException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class ErrorHandlerTest {

  private ErrorHandler errorHandler;

  @BeforeEach
  void setUp() {
    errorHandler = new ErrorHandler(JacksonConfig.strictTextualMapper());
  }

  @Test
  void handleError_ValidationException_ShouldReturnBadRequestWithMessage() {
    Mono<ResponseEntity<String>> result =
        errorHandler.handleError(
            new RequestValidationException("Missing 'prompt' or 'target_model' in request body"));

    StepVerifier.create(result)
        .assertNext(
            response -> {
              assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
              assertThat(response.getHeaders().getContentType())
                  .isEqualTo(MediaType.APPLICATION_JSON);
              assertThat(response.getBody())
                  .isEqualTo("{\"error\":\"Missing 'prompt' or 'target_model' in request body\"}");
            })
        .verifyComplete();
  }

  @Test
  void handleError_MethodNotAllowed_ShouldReturn405() {
    StepVerifier.create(
            errorHandler.handleError(
                new RequestMethodNotAllowedException("Method Not Allowed, only POST supported")))
        .assertNext(
            response -> {
              assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
              assertThat(response.getBody()).contains("only POST supported");
            })
        .verifyComplete();
  }

  @Test
  void handleError_CredentialLookupException_ShouldHideDetail() {
    StepVerifier.create(
            errorHandler.handleError(
                new CredentialLookupException(
                    "Unable to retrieve secret AIServiceSecrets",
                    new RuntimeException("AccessDeniedException: arn:aws:iam::123:role/x"))))
        .assertNext(
            response -> {
              assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
              assertThat(response.getBody()).isEqualTo("{\"error\":\"Internal server error\"}");
            })
        .verifyComplete();
  }

  @Test
  void handleError_CredentialFormatException_ShouldReturnGeneric500() {
    StepVerifier.create(
            errorHandler.handleError(new CredentialFormatException("missing 'azure_endpoint'")))
        .assertNext(
            response -> {
              assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
              assertThat(response.getBody()).doesNotContain("azure_endpoint");
            })
        .verifyComplete();
  }

  @Test
  void handleError_ProviderInvocationException_ShouldReturnGeneric500() {
    ProviderInvocationException providerException =
        new ProviderInvocationException(TargetModel.AZURE, new TimeoutException("took too long"));

    StepVerifier.create(errorHandler.handleError(providerException))
        .assertNext(
            response -> {
              assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
              assertThat(response.getBody()).isEqualTo("{\"error\":\"Internal server error\"}");
            })
        .verifyComplete();
    assertThat(providerException.getTarget()).isEqualTo(TargetModel.AZURE);
  }

  @Test
  void handleError_UnclassifiedException_ShouldReturnGeneric500() {
    StepVerifier.create(errorHandler.handleError(new NullPointerException("boom")))
        .assertNext(
            response -> {
              assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
              assertThat(response.getBody()).doesNotContain("boom");
            })
        .verifyComplete();
  }
}
