package com.evoila.relay.common.exception;

import org.springframework.http.HttpStatus;

/** Request arrived with a method other than POST. */
public class RequestMethodNotAllowedException extends RelayException {

  public RequestMethodNotAllowedException(String message) {
    super(message);
  }

  @Override
  public HttpStatus getStatus() {
    return HttpStatus.METHOD_NOT_ALLOWED;
  }
}
