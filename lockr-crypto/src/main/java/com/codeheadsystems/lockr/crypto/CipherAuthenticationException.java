package com.codeheadsystems.lockr.crypto;

/**
 * Thrown when an authentication tag does not verify.
 * <p>
 * This is the one and only signal that a key is wrong (or the ciphertext was tampered with).
 * It is definitive: retrying with the same inputs will fail the same way.
 */
public class CipherAuthenticationException extends SecurityException {

  /**
   * Instantiates a new cipher authentication exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CipherAuthenticationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
