package com.codeheadsystems.lockr.crypto;

/**
 * Stateless authenticated-encryption primitive.
 * <p>
 * Implementations must be thread-safe and must not retain key material between calls.
 * Every {@link #seal} call uses a fresh random IV.
 * <p>
 * <strong>Exception contract:</strong>
 * <ul>
 *   <li>{@link CipherAuthenticationException}: tag mismatch on {@link #open}; wrong key or tampered data</li>
 *   <li>{@link IllegalArgumentException}: key length or IV/tag size does not fit the suite</li>
 *   <li>{@link IllegalStateException}: internal engine failure, not attributable to input</li>
 * </ul>
 */
public interface CipherEngine {

  /**
   * The suite this engine implements.
   *
   * @return the suite
   */
  VaultCipherSuite suite();

  /**
   * Encrypts plaintext under the key.
   *
   * @param plaintext bytes to protect
   * @param key       the key
   * @return ciphertext, iv and tag
   */
  SealedPayload seal(byte[] plaintext, VaultKey key);

  /**
   * Decrypts and verifies a sealed payload.
   *
   * @param sealed the sealed payload
   * @param key    the key
   * @return the plaintext
   * @throws CipherAuthenticationException if the tag does not verify under this key
   */
  byte[] open(SealedPayload sealed, VaultKey key);
}
