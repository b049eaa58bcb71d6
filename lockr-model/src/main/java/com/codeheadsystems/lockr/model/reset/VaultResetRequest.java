package com.codeheadsystems.lockr.model.reset;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Redeem a reset token and destroy the vault.
 * <p>
 * Used by: {@code POST /vault-reset/complete}
 *
 * @param token     hex token from the reset link
 * @param confirmed must be true
 * @param newKey    optional base64 key for the fresh vault; when present the server seals a
 *                  key-check entry under it so the first unlock is verified
 */
public record VaultResetRequest(@JsonProperty("token") String token,
                                @JsonProperty("confirmed") boolean confirmed,
                                @JsonProperty("newKey") String newKey) {

  @Override
  public String toString() {
    return "VaultResetRequest[token=<redacted>, confirmed=" + confirmed + "]";
  }
}
