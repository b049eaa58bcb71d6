package com.codeheadsystems.lockr.server.delivery;

import com.codeheadsystems.lockr.server.store.Account;
import java.time.Instant;

/**
 * Out-of-band channel that gets a reset token to the account owner (normally email).
 * <p>
 * Called off the request thread. Implementations own the message content and transport, and must
 * treat the token as a secret.
 */
public interface ResetTokenDelivery {

  /**
   * Delivers a reset token.
   *
   * @param account   recipient
   * @param token     raw hex token; the only copy the server ever sees
   * @param expiresAt when the token stops working
   */
  void deliver(Account account, String token, Instant expiresAt);
}
