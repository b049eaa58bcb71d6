package com.codeheadsystems.lockr.model.vault;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whether the caller currently holds a live unlock session.
 * <p>
 * Used by: {@code GET /vault/status}
 *
 * @param unlocked  true if a non-expired session exists
 * @param expiresAt ISO-8601 expiry of that session, absent when locked
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VaultStatusResponse(@JsonProperty("unlocked") boolean unlocked,
                                  @JsonProperty("expiresAt") String expiresAt) {

  public static VaultStatusResponse locked() {
    return new VaultStatusResponse(false, null);
  }
}
