package com.codeheadsystems.lockr.crypto;

import java.security.SecureRandom;
import java.util.Arrays;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AES-GCM {@link CipherEngine} on the BouncyCastle lightweight API.
 * <p>
 * A new GCM instance is created per call, so the engine itself holds nothing but the suite and
 * the random source. GCM emits {@code ciphertext || tag}; the tag is split off into its own field.
 */
public class AesGcmCipherEngine implements CipherEngine {

  private static final Logger log = LoggerFactory.getLogger(AesGcmCipherEngine.class);
  private static final int TAG_BITS = VaultCipherSuite.TAG_LENGTH * 8;

  private final VaultCipherSuite suite;
  private final SecureRandom random;

  /**
   * Instantiates a new AES-GCM engine with a default {@link SecureRandom}.
   *
   * @param suite the suite
   */
  public AesGcmCipherEngine(VaultCipherSuite suite) {
    this(suite, new SecureRandom());
  }

  /**
   * Instantiates a new AES-GCM engine.
   *
   * @param suite  the suite
   * @param random the IV source
   */
  public AesGcmCipherEngine(VaultCipherSuite suite, SecureRandom random) {
    this.suite = suite;
    this.random = random;
    log.info("AesGcmCipherEngine({})", suite);
  }

  @Override
  public VaultCipherSuite suite() {
    return suite;
  }

  @Override
  public SealedPayload seal(byte[] plaintext, VaultKey key) {
    if (plaintext == null) {
      throw new IllegalArgumentException("Plaintext is required");
    }
    byte[] iv = new byte[VaultCipherSuite.IV_LENGTH];
    random.nextBytes(iv);

    byte[] keyBytes = keyBytes(key);
    try {
      GCMModeCipher cipher = newCipher(true, keyBytes, iv);
      byte[] out = new byte[cipher.getOutputSize(plaintext.length)];
      int len = cipher.processBytes(plaintext, 0, plaintext.length, out, 0);
      len += cipher.doFinal(out, len);

      int ctLen = len - VaultCipherSuite.TAG_LENGTH;
      byte[] ciphertext = Arrays.copyOfRange(out, 0, ctLen);
      byte[] tag = Arrays.copyOfRange(out, ctLen, len);
      return new SealedPayload(ciphertext, iv, tag);
    } catch (InvalidCipherTextException e) {
      // Encryption never verifies a tag; reaching here means the engine itself is broken.
      throw new IllegalStateException("AES-GCM encryption failed", e);
    } finally {
      Arrays.fill(keyBytes, (byte) 0);
    }
  }

  @Override
  public byte[] open(SealedPayload sealed, VaultKey key) {
    byte[] iv = sealed.iv();
    byte[] tag = sealed.authTag();
    if (iv.length != VaultCipherSuite.IV_LENGTH) {
      throw new IllegalArgumentException("IV must be " + VaultCipherSuite.IV_LENGTH + " bytes");
    }
    if (tag.length != VaultCipherSuite.TAG_LENGTH) {
      throw new IllegalArgumentException("Auth tag must be " + VaultCipherSuite.TAG_LENGTH + " bytes");
    }
    byte[] ciphertext = sealed.ciphertext();
    byte[] input = new byte[ciphertext.length + tag.length];
    System.arraycopy(ciphertext, 0, input, 0, ciphertext.length);
    System.arraycopy(tag, 0, input, ciphertext.length, tag.length);

    byte[] keyBytes = keyBytes(key);
    byte[] out = null;
    try {
      GCMModeCipher cipher = newCipher(false, keyBytes, iv);
      out = new byte[cipher.getOutputSize(input.length)];
      int len = cipher.processBytes(input, 0, input.length, out, 0);
      len += cipher.doFinal(out, len);
      return len == out.length ? out : Arrays.copyOf(out, len);
    } catch (InvalidCipherTextException e) {
      if (out != null) {
        Arrays.fill(out, (byte) 0);
      }
      throw new CipherAuthenticationException("Authentication failed", e);
    } finally {
      Arrays.fill(keyBytes, (byte) 0);
    }
  }

  private byte[] keyBytes(VaultKey key) {
    if (key == null) {
      throw new IllegalArgumentException("Key is required");
    }
    if (key.length() != suite.keyLength()) {
      throw new IllegalArgumentException("Key must be " + suite.keyLength() + " bytes for " + suite);
    }
    return key.bytes();
  }

  private static GCMModeCipher newCipher(boolean forEncryption, byte[] keyBytes, byte[] iv) {
    GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(forEncryption, new AEADParameters(new KeyParameter(keyBytes), TAG_BITS, iv));
    return cipher;
  }
}
