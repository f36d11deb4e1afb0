package com.evoila.relay.common.config;

import com.evoila.relay.common.exception.RelayException;
import com.evoila.relay.common.model.ErrorResponse;
import com.evoila.relay.common.service.ErrorHandler;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.webflux.error.ErrorWebExceptionHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * Last-resort handler for errors raised outside the dispatch pipeline (unknown paths, codec
 * failures). Keeps the {@code {"error": ...}} envelope for every response.
 */
@Slf4j
@Configuration
@Order(-2) // Higher priority than DefaultErrorWebExceptionHandler
@RequiredArgsConstructor
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

  private final JsonMapper jsonMapper;

  @Override
  public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
    if (exchange.getResponse().isCommitted()) {
      return Mono.error(ex);
    }

    ErrorInfo errorInfo = determineErrorResponse(exchange, ex);

    log.debug(
        "Returning error response: {} {} - {}",
        errorInfo.status().value(),
        errorInfo.status().getReasonPhrase(),
        errorInfo.message());

    return writeErrorResponse(exchange, errorInfo.status(), errorInfo.message());
  }

  /** Determines the appropriate error response based on exception type */
  private ErrorInfo determineErrorResponse(ServerWebExchange exchange, Throwable ex) {
    String path = exchange.getRequest().getPath().value();

    if (ex instanceof RelayException relayException) {
      return handleRelayException(relayException);
    }
    if (ex instanceof ResponseStatusException statusException) {
      return handleResponseStatusException(statusException, path);
    }
    if (ex instanceof JacksonException) {
      log.warn("JSON processing error on {}: {}", path, ex.getMessage());
      return new ErrorInfo(HttpStatus.BAD_REQUEST, "Request body must be a JSON object");
    }
    return handleGenericException(exchange, ex);
  }

  private ErrorInfo handleRelayException(RelayException ex) {
    HttpStatus status = ex.getStatus();
    if (status.is4xxClientError()) {
      log.warn("Rejected request: {}", ex.getMessage());
      return new ErrorInfo(status, ex.getMessage());
    }
    log.error("Relay error outside dispatch pipeline: {}", ex.getMessage(), ex);
    return new ErrorInfo(status, ErrorHandler.INTERNAL_ERROR_MESSAGE);
  }

  private ErrorInfo handleResponseStatusException(ResponseStatusException ex, String path) {
    HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
    if (status == null || status.is5xxServerError()) {
      log.error("Response status exception on {}: {}", path, ex.getMessage(), ex);
      return new ErrorInfo(HttpStatus.INTERNAL_SERVER_ERROR, ErrorHandler.INTERNAL_ERROR_MESSAGE);
    }
    log.warn("Response status exception on {}: {}", path, ex.getStatusCode());
    return new ErrorInfo(status, status.getReasonPhrase());
  }

  /** Logs the request and full stack trace, then answers with the generic message */
  private ErrorInfo handleGenericException(ServerWebExchange exchange, Throwable ex) {
    log.error(
        "Unhandled error for {} {}: {}",
        exchange.getRequest().getMethod(),
        exchange.getRequest().getPath().value(),
        ex.getMessage(),
        ex);
    return new ErrorInfo(HttpStatus.INTERNAL_SERVER_ERROR, ErrorHandler.INTERNAL_ERROR_MESSAGE);
  }

  /** Internal record for passing error info between methods */
  private record ErrorInfo(HttpStatus status, String message) {}

  private Mono<Void> writeErrorResponse(
      ServerWebExchange exchange, HttpStatus status, String message) {
    exchange.getResponse().setStatusCode(status);
    exchange.getResponse().getHeaders().add("Content-Type", MediaType.APPLICATION_JSON_VALUE);

    String errorJson;
    try {
      errorJson = jsonMapper.writeValueAsString(new ErrorResponse(message));
    } catch (JacksonException e) {
      log.error("Failed to serialize error response", e);
      errorJson = "{\"error\":\"" + ErrorHandler.INTERNAL_ERROR_MESSAGE + "\"}";
    }

    DataBuffer buffer =
        exchange.getResponse().bufferFactory().wrap(errorJson.getBytes(StandardCharsets.UTF_8));
    return exchange.getResponse().writeWith(Mono.just(buffer));
  }
}
