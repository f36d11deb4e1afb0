package com.evoila.relay.common.exception;

import org.springframework.http.HttpStatus;

/** Malformed, missing or unsupported request fields. */
public class RequestValidationException extends RelayException {

  public RequestValidationException(String message) {
    super(message);
  }

  public RequestValidationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public HttpStatus getStatus() {
    return HttpStatus.BAD_REQUEST;
  }
}
