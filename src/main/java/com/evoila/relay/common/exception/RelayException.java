package com.evoila.relay.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for failures raised while dispatching a prompt. Each subclass maps to exactly one
 * response status; the message is what the caller sees for client errors.
 */
public abstract class RelayException extends RuntimeException {

  protected RelayException(String message) {
    super(message);
  }

  protected RelayException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract HttpStatus getStatus();
}
