package com.codeheadsystems.lockr.server.audit;

/**
 * Security event sink. Implementations must never receive, and so can never log, key material,
 * plaintext or raw reset tokens; the methods only accept ids and counts.
 */
public interface SecurityAuditLog {

  void unlockFailed(String userId, int failuresInWindow, String address);

  void unlockRateLimited(String userId, String address);

  void keyRotated(String userId, String outcome, int rotated, int skipped);

  void entryUndecryptable(String userId, String entryId, String operation);

  void resetTokenIssued(String userId, String address);

  void resetRequestRateLimited(String address);

  void vaultReset(String userId, int entriesDestroyed, int entriesRemaining, String address);
}
