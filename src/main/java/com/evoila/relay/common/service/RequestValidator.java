package com.evoila.relay.common.service;

import com.evoila.relay.common.config.TargetModel;
import com.evoila.relay.common.exception.RequestMethodNotAllowedException;
import com.evoila.relay.common.exception.RequestValidationException;
import com.evoila.relay.common.model.DispatchRequest;
import com.evoila.relay.common.model.DispatchRequestBody;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * Turns a raw inbound request into a {@link DispatchRequest}. Pure: the outcome depends only on
 * the method and body passed in.
 */
@Component
@RequiredArgsConstructor
public class RequestValidator {

  static final String METHOD_NOT_ALLOWED_MESSAGE = "Method Not Allowed, only POST supported";
  static final String MISSING_FIELDS_MESSAGE =
      "Missing 'prompt' or 'target_model' in request body";
  static final String MALFORMED_BODY_MESSAGE = "Request body must be a JSON object";

  private static final String EMPTY_BODY = "{}";

  private final JsonMapper jsonMapper;

  /**
   * Validates method and body.
   *
   * @param method the inbound HTTP method
   * @param rawBody the request body, may be null or blank
   * @return the validated request
   * @throws RequestMethodNotAllowedException if the method is not POST
   * @throws RequestValidationException if the body is malformed or a field is missing or invalid
   */
  public DispatchRequest validate(HttpMethod method, String rawBody) {
    if (!HttpMethod.POST.equals(method)) {
      throw new RequestMethodNotAllowedException(METHOD_NOT_ALLOWED_MESSAGE);
    }

    DispatchRequestBody body = parseBody(rawBody);
    if (body == null || isEmpty(body.prompt()) || isEmpty(body.targetModel())) {
      throw new RequestValidationException(MISSING_FIELDS_MESSAGE);
    }

    return new DispatchRequest(body.prompt(), TargetModel.fromString(body.targetModel()));
  }

  private DispatchRequestBody parseBody(String rawBody) {
    String json = StringUtils.hasText(rawBody) ? rawBody : EMPTY_BODY;
    try {
      return jsonMapper.readValue(json, DispatchRequestBody.class);
    } catch (JacksonException e) {
      throw new RequestValidationException(MALFORMED_BODY_MESSAGE, e);
    }
  }

  private static boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }
}
