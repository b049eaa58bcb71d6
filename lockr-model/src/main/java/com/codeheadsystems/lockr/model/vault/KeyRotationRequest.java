package com.codeheadsystems.lockr.model.vault;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Re-encrypt every entry from one key to another, typically after a master password change.
 * <p>
 * Used by: {@code POST /vault/rotate-key}
 *
 * @param currentKey base64 key the entries are sealed under now; must match the unlock session
 * @param newKey     base64 key to re-seal under
 */
public record KeyRotationRequest(@JsonProperty("currentKey") String currentKey,
                                 @JsonProperty("newKey") String newKey) {

  @Override
  public String toString() {
    return "KeyRotationRequest[currentKey=<redacted>, newKey=<redacted>]";
  }
}
