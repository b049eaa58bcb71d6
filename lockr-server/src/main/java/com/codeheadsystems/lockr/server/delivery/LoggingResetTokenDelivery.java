package com.codeheadsystems.lockr.server.delivery;

import com.codeheadsystems.lockr.server.store.Account;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Placeholder delivery that only records that a token was issued. The token itself is not logged,
 * so with this delivery in place nobody can actually complete a reset.
 */
public class LoggingResetTokenDelivery implements ResetTokenDelivery {

  private static final Logger log = LoggerFactory.getLogger(LoggingResetTokenDelivery.class);

  /**
   * Instantiates a new logging reset token delivery.
   */
  public LoggingResetTokenDelivery() {
    log.warn("LoggingResetTokenDelivery in use: reset tokens are not delivered to anyone");
  }

  @Override
  public void deliver(Account account, String token, Instant expiresAt) {
    log.info("Vault reset token issued for userId={} (expires {})", account.userId(), expiresAt);
  }
}
