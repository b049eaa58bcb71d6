package com.codeheadsystems.lockr.crypto;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Raw symmetric key material for a user's vault.
 * <p>
 * Instances own a private copy of the bytes. {@link #destroy()} zeroes that copy; a destroyed key
 * refuses to hand out its material. {@link #toString()} never prints key bytes.
 */
public final class VaultKey {

  private final byte[] material;
  private volatile boolean destroyed;

  private VaultKey(byte[] material) {
    this.material = material;
  }

  /**
   * Wraps a copy of the given bytes.
   *
   * @param bytes key bytes
   * @return the vault key
   */
  public static VaultKey of(byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      throw new IllegalArgumentException("Key material is required");
    }
    return new VaultKey(bytes.clone());
  }

  /**
   * Decodes a base64 key and checks its length against the suite.
   *
   * @param encoded base64 key text as submitted by the client
   * @param suite   the configured cipher suite
   * @return the vault key
   * @throws IllegalArgumentException if the text is missing, not base64, or the wrong length
   */
  public static VaultKey fromBase64(String encoded, VaultCipherSuite suite) {
    if (encoded == null || encoded.isBlank()) {
      throw new IllegalArgumentException("Encryption key is required");
    }
    byte[] decoded;
    try {
      decoded = Base64.getDecoder().decode(encoded);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Encryption key is not valid base64");
    }
    if (decoded.length != suite.keyLength()) {
      Arrays.fill(decoded, (byte) 0);
      throw new IllegalArgumentException("Encryption key must be " + suite.keyLength() + " bytes");
    }
    return new VaultKey(decoded);
  }

  /**
   * Generates a random key for the suite.
   *
   * @param suite  the suite
   * @param random source of randomness
   * @return the vault key
   */
  public static VaultKey generate(VaultCipherSuite suite, SecureRandom random) {
    byte[] bytes = new byte[suite.keyLength()];
    random.nextBytes(bytes);
    return new VaultKey(bytes);
  }

  /**
   * Returns a copy of the key bytes. Callers should zero the copy when done.
   *
   * @return the key bytes
   * @throws IllegalStateException if the key has been destroyed
   */
  public synchronized byte[] bytes() {
    checkLive();
    return material.clone();
  }

  /**
   * Key length in bytes.
   *
   * @return the length
   */
  public int length() {
    return material.length;
  }

  /**
   * Independent copy with its own lifetime.
   *
   * @return the copy
   */
  public synchronized VaultKey copy() {
    checkLive();
    return new VaultKey(material.clone());
  }

  /**
   * Constant-time comparison of key material.
   *
   * @param other the other key
   * @return true if both keys hold identical bytes
   */
  public boolean matches(VaultKey other) {
    if (other == null || destroyed || other.destroyed) {
      return false;
    }
    return org.bouncycastle.util.Arrays.constantTimeAreEqual(material, other.material);
  }

  /**
   * Zeroes the key material.
   */
  public synchronized void destroy() {
    destroyed = true;
    Arrays.fill(material, (byte) 0);
  }

  /**
   * Is destroyed boolean.
   *
   * @return the boolean
   */
  public boolean isDestroyed() {
    return destroyed;
  }

  private void checkLive() {
    if (destroyed) {
      throw new IllegalStateException("Key material has been destroyed");
    }
  }

  @Override
  public String toString() {
    return "VaultKey[" + material.length + " bytes" + (destroyed ? ", destroyed" : "") + "]";
  }
}
