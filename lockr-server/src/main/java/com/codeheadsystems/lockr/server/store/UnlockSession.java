package com.codeheadsystems.lockr.server.store;

import com.codeheadsystems.lockr.crypto.VaultKey;
import java.time.Instant;

/**
 * The in-memory binding of a user to the key their vault is currently sealed under.
 * <p>
 * Never serialized. Instances handed out by a {@link SessionRegistry} carry their own copy of the
 * key, so destroying one does not affect the registry's copy.
 *
 * @param userId        the user id
 * @param encryptionKey the key
 * @param createdAt     when the session was installed
 * @param expiresAt     when it stops being usable
 */
public record UnlockSession(String userId, VaultKey encryptionKey, Instant createdAt, Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  @Override
  public String toString() {
    return "UnlockSession[userId=" + userId + ", expiresAt=" + expiresAt + "]";
  }
}
