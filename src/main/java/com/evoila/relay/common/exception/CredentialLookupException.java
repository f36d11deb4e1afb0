package com.evoila.relay.common.exception;

import org.springframework.http.HttpStatus;

/** The secret store could not return the credential secret. */
public class CredentialLookupException extends RelayException {

  public CredentialLookupException(String message) {
    super(message);
  }

  public CredentialLookupException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public HttpStatus getStatus() {
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }
}
