package com.codeheadsystems.lockr.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned for every failed vault call.
 *
 * @param code              machine-readable error code, e.g. {@code "RATE_LIMITED"}
 * @param message           human-readable description, safe to show to the user
 * @param retryAfterSeconds seconds until the caller may retry; only present for rate limiting
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(@JsonProperty("code") String code,
                            @JsonProperty("message") String message,
                            @JsonProperty("retryAfterSeconds") Long retryAfterSeconds) {

  public ErrorResponse(String code, String message) {
    this(code, message, null);
  }
}
