package com.codeheadsystems.lockr.server.store;

import com.codeheadsystems.lockr.crypto.VaultKey;
import java.util.Optional;

/**
 * Per-user unlock sessions. At most one live session per user.
 * <p>
 * Implementations must be thread-safe without a global lock, must never persist key material,
 * and must offer no lookup that crosses user ids. Expired sessions are treated as absent and
 * removed when encountered.
 */
public interface SessionRegistry {

  /**
   * Installs a session, replacing any prior one. Does not check that the key is correct.
   *
   * @param userId the user id
   * @param key    the key; the registry stores its own copy
   * @return the new session
   */
  UnlockSession createSession(String userId, VaultKey key);

  /**
   * Gets the live session.
   *
   * @param userId the user id
   * @return the session, or empty if none or expired
   */
  Optional<UnlockSession> getSession(String userId);

  /**
   * Copy of the session key.
   *
   * @param userId the user id
   * @return the key, or empty if no live session
   */
  Optional<VaultKey> getEncryptionKey(String userId);

  /**
   * Removes the session. Idempotent.
   *
   * @param userId the user id
   */
  void clearSession(String userId);

  /**
   * Removes every expired session. Not needed for correctness.
   *
   * @return number removed
   */
  int purgeExpired();
}
