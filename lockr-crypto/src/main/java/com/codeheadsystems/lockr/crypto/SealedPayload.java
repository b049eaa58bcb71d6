package com.codeheadsystems.lockr.crypto;

import java.util.Base64;

/**
 * Output of one authenticated encryption: ciphertext, the IV it was produced with, and the tag.
 * <p>
 * The three parts are only meaningful together; callers store and replace them as a unit.
 *
 * @param ciphertext encrypted bytes, same length as the plaintext
 * @param iv         {@value VaultCipherSuite#IV_LENGTH}-byte random IV
 * @param authTag    {@value VaultCipherSuite#TAG_LENGTH}-byte GCM tag
 */
public record SealedPayload(byte[] ciphertext, byte[] iv, byte[] authTag) {

  private static final Base64.Encoder B64 = Base64.getEncoder();

  /**
   * Instantiates a new sealed payload.
   *
   * @param ciphertext the ciphertext
   * @param iv         the iv
   * @param authTag    the auth tag
   */
  public SealedPayload {
    if (ciphertext == null || iv == null || authTag == null) {
      throw new IllegalArgumentException("ciphertext, iv and authTag are all required");
    }
    ciphertext = ciphertext.clone();
    iv = iv.clone();
    authTag = authTag.clone();
  }

  @Override
  public byte[] ciphertext() {
    return ciphertext.clone();
  }

  @Override
  public byte[] iv() {
    return iv.clone();
  }

  @Override
  public byte[] authTag() {
    return authTag.clone();
  }

  /**
   * Base64 of the IV, handy for log correlation without exposing ciphertext.
   *
   * @return the iv in base64
   */
  public String ivBase64() {
    return B64.encodeToString(iv);
  }

  @Override
  public String toString() {
    return "SealedPayload[ciphertext=" + ciphertext.length + " bytes, iv=" + ivBase64() + "]";
  }
}
