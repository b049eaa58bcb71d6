package com.codeheadsystems.lockr.crypto;

/**
 * Authenticated-encryption suites supported for vault entries.
 * <p>
 * Every suite uses a 96-bit random IV and a 128-bit authentication tag; only the key length
 * differs. The suite must match whatever the client used to derive its key, since the server
 * never sees the password the key came from.
 */
public enum VaultCipherSuite {

  /**
   * AES-256 in GCM mode (default).
   */
  AES_256_GCM(32),
  /**
   * AES-128 in GCM mode.
   */
  AES_128_GCM(16);

  /**
   * IV length in bytes.
   */
  public static final int IV_LENGTH = 12;

  /**
   * Authentication tag length in bytes.
   */
  public static final int TAG_LENGTH = 16;

  private final int keyLength;

  VaultCipherSuite(int keyLength) {
    this.keyLength = keyLength;
  }

  /**
   * Returns the suite for the given name. Accepted names: {@code "AES_256_GCM"},
   * {@code "AES_128_GCM"}.
   *
   * @param name the name
   * @return the vault cipher suite
   * @throws IllegalArgumentException for unrecognised names
   */
  public static VaultCipherSuite fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Cipher suite name is required");
    }
    return switch (name) {
      case "AES_256_GCM" -> AES_256_GCM;
      case "AES_128_GCM" -> AES_128_GCM;
      default -> throw new IllegalArgumentException("Unknown vault cipher suite: " + name
          + ". Valid values: AES_256_GCM, AES_128_GCM");
    };
  }

  /**
   * Key length in bytes (32 or 16).
   *
   * @return the key length
   */
  public int keyLength() {
    return keyLength;
  }
}
