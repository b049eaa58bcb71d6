package com.codeheadsystems.lockr.server.error;

/**
 * Error taxonomy for vault operations, with the HTTP status each one maps to.
 */
public enum VaultErrorCode {

  /**
   * Malformed key or missing field. No state was changed.
   */
  VALIDATION_ERROR(400),
  /**
   * Too many recent failures; back off. Says nothing about whether the last key was right.
   */
  RATE_LIMITED(429),
  /**
   * The submitted key failed authenticated decryption.
   */
  INVALID_KEY(403),
  /**
   * The operation needs a live unlock session.
   */
  SESSION_REQUIRED(403),
  /**
   * Rotation's current key does not match the unlocked session.
   */
  KEY_MISMATCH(403),
  /**
   * Unknown user or entry.
   */
  NOT_FOUND(404),
  /**
   * Reset token is unknown, expired or already used.
   */
  INVALID_TOKEN(400),
  /**
   * Another rotation, reset or write for this vault is in progress.
   */
  VAULT_BUSY(409),
  /**
   * Rotation found entries but could not rotate any of them.
   */
  ROTATION_INEFFECTIVE(422),
  /**
   * Storage or cipher engine failure not caused by the caller.
   */
  FATAL(500);

  private final int httpStatus;

  VaultErrorCode(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
