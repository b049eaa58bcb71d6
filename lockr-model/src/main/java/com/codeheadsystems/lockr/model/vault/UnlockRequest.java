package com.codeheadsystems.lockr.model.vault;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request to unlock the caller's vault.
 * <p>
 * The key is derived on the client from the master password. The server only ever sees the
 * derived key, and only keeps it in memory for the life of the unlock session.
 * <p>
 * Used by: {@code POST /vault/unlock}
 *
 * @param encryptionKey base64-encoded symmetric key
 */
public record UnlockRequest(@JsonProperty("encryptionKey") String encryptionKey) {

  @Override
  public String toString() {
    return "UnlockRequest[encryptionKey=<redacted>]";
  }
}
