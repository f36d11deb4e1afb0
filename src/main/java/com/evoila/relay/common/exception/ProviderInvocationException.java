package com.evoila.relay.common.exception;

import com.evoila.relay.common.config.TargetModel;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/** A model provider call failed or did not answer in time. */
@Getter
public class ProviderInvocationException extends RelayException {

  private final TargetModel target;

  public ProviderInvocationException(TargetModel target, Throwable cause) {
    super("Provider " + target + " failed: " + cause.getMessage(), cause);
    this.target = target;
  }

  @Override
  public HttpStatus getStatus() {
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }
}
