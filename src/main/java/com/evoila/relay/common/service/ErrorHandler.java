package com.evoila.relay.common.service;

import com.evoila.relay.common.exception.ProviderInvocationException;
import com.evoila.relay.common.exception.RelayException;
import com.evoila.relay.common.model.ErrorResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * Centralized error handling for dispatch requests. Client errors echo their short message; every
 * server error is reduced to a generic message while the cause is logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ErrorHandler {

  public static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

  private static final String FALLBACK_BODY = "{\"error\":\"" + INTERNAL_ERROR_MESSAGE + "\"}";

  private final JsonMapper jsonMapper;

  /** Converts any pipeline failure into a JSON error response */
  public Mono<ResponseEntity<String>> handleError(Throwable e) {
    HttpStatus status = resolveStatus(e);

    String message;
    if (status.is4xxClientError()) {
      log.warn("Rejected request with {}: {}", status.value(), e.getMessage());
      message = e.getMessage();
    } else {
      logServerError(e);
      message = INTERNAL_ERROR_MESSAGE;
    }

    return Mono.just(errorResponse(status, message));
  }

  /** Builds a JSON error response with the given status and message */
  public ResponseEntity<String> errorResponse(HttpStatus status, String message) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(serializeError(new ErrorResponse(message)));
  }

  private HttpStatus resolveStatus(Throwable e) {
    if (e instanceof RelayException relayException) {
      return relayException.getStatus();
    }
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  private void logServerError(Throwable e) {
    if (e instanceof ProviderInvocationException providerException) {
      log.error("Provider {} invocation failed", providerException.getTarget(), e);
    } else if (e instanceof RelayException) {
      log.error("Error processing request: {}", e.getMessage(), e);
    } else {
      log.error("Unhandled error processing request: {}", e.getMessage(), e);
    }
  }

  private String serializeError(ErrorResponse response) {
    try {
      return jsonMapper.writeValueAsString(response);
    } catch (JacksonException e) {
      log.error("Failed to serialize error response", e);
      return FALLBACK_BODY;
    }
  }
}
