package com.codeheadsystems.lockr.server.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SecurityAuditLog} that writes to the {@code lockr.security-audit} logger, so deployments
 * can route audit events to their own appender.
 */
public class Slf4jSecurityAuditLog implements SecurityAuditLog {

  /**
   * Name of the audit logger.
   */
  public static final String LOGGER_NAME = "lockr.security-audit";

  private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

  @Override
  public void unlockFailed(String userId, int failuresInWindow, String address) {
    audit.warn("event=unlock_failed userId={} failures={} address={}", userId, failuresInWindow, address);
  }

  @Override
  public void unlockRateLimited(String userId, String address) {
    audit.warn("event=unlock_rate_limited userId={} address={}", userId, address);
  }

  @Override
  public void keyRotated(String userId, String outcome, int rotated, int skipped) {
    if (skipped == 0) {
      audit.info("event=key_rotated userId={} outcome={} rotated={} skipped=0", userId, outcome, rotated);
    } else {
      audit.warn("event=key_rotated userId={} outcome={} rotated={} skipped={}",
          userId, outcome, rotated, skipped);
    }
  }

  @Override
  public void entryUndecryptable(String userId, String entryId, String operation) {
    audit.error("event=entry_undecryptable userId={} entryId={} operation={}", userId, entryId, operation);
  }

  @Override
  public void resetTokenIssued(String userId, String address) {
    audit.warn("event=reset_token_issued userId={} address={}", userId, address);
  }

  @Override
  public void resetRequestRateLimited(String address) {
    audit.warn("event=reset_request_rate_limited address={}", address);
  }

  @Override
  public void vaultReset(String userId, int entriesDestroyed, int entriesRemaining, String address) {
    audit.error("event=vault_reset userId={} entriesDestroyed={} entriesRemaining={} address={}",
        userId, entriesDestroyed, entriesRemaining, address);
  }
}
