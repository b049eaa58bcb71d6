package com.codeheadsystems.lockr.server.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for vault reset tokens, keyed by token hash.
 * <p>
 * {@link #claim} must be atomic: of any number of concurrent claims for the same hash, at most one
 * succeeds.
 */
public interface ResetTokenStore {

  /**
   * Stores a new token.
   *
   * @param token the token
   */
  void store(ResetToken token);

  /**
   * Looks up a token that is unexpired and unused, without consuming it.
   *
   * @param tokenHash the token hash
   * @param now       the current instant
   * @return the token if usable
   */
  Optional<ResetToken> findUsable(String tokenHash, Instant now);

  /**
   * Marks a usable token used.
   *
   * @param tokenHash the token hash
   * @param now       the current instant
   * @return the claimed token, or empty if it was unknown, expired or already used
   */
  Optional<ResetToken> claim(String tokenHash, Instant now);

  /**
   * Removes expired tokens, used or not.
   *
   * @param now the current instant
   * @return number removed
   */
  int purgeExpired(Instant now);
}
