package com.evoila.relay.common.controller;

import com.evoila.relay.common.service.RequestDispatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Entry point for prompt dispatch. All methods are listed so that OPTIONS and HEAD reach the
 * validator and get the 405 envelope like any other non-POST request.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class DispatchController {

  private final RequestDispatchService requestDispatchService;

  @RequestMapping(
      value = "/",
      method = {
        RequestMethod.POST,
        RequestMethod.GET,
        RequestMethod.HEAD,
        RequestMethod.PUT,
        RequestMethod.PATCH,
        RequestMethod.DELETE,
        RequestMethod.OPTIONS
      })
  public Mono<ResponseEntity<String>> handle(
      ServerWebExchange exchange, @RequestBody(required = false) String body) {

    HttpMethod method = exchange.getRequest().getMethod();
    log.info("Incoming request: {} {}", method, exchange.getRequest().getPath().value());

    return requestDispatchService.dispatch(method, body);
  }
}
