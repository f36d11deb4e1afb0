package com.evoila.relay.common.exception;

import org.springframework.http.HttpStatus;

/** The credential secret was found but does not hold the expected mapping. */
public class CredentialFormatException extends RelayException {

  public CredentialFormatException(String message) {
    super(message);
  }

  public CredentialFormatException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public HttpStatus getStatus() {
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }
}
