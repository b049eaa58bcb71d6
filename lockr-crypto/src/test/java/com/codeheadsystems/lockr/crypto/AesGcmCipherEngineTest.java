package com.codeheadsystems.lockr.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class AesGcmCipherEngineTest {

  private static final SecureRandom RANDOM = new SecureRandom();
  private static final byte[] PLAINTEXT = "{\"title\":\"bank\",\"password\":\"hunter2\"}"
      .getBytes(StandardCharsets.UTF_8);

  private final AesGcmCipherEngine engine = new AesGcmCipherEngine(VaultCipherSuite.AES_256_GCM);

  // ── Round trip ──────────────────────────────────────────────────────────────

  @Test
  void sealThenOpen_returnsOriginalPlaintext() {
    VaultKey key = VaultKey.generate(VaultCipherSuite.AES_256_GCM, RANDOM);

    SealedPayload sealed = engine.seal(PLAINTEXT, key);

    assertThat(engine.open(sealed, key)).isEqualTo(PLAINTEXT);
  }

  @Test
  void seal_producesExpectedSizes() {
    VaultKey key = VaultKey.generate(VaultCipherSuite.AES_256_GCM, RANDOM);

    SealedPayload sealed = engine.seal(PLAINTEXT, key);

    assertThat(sealed.iv()).hasSize(12);
    assertThat(sealed.authTag()).hasSize(16);
    assertThat(sealed.ciphertext()).hasSize(PLAINTEXT.length);
  }

  @Test
  void seal_usesFreshIvEachCall() {
    VaultKey key = VaultKey.generate(VaultCipherSuite.AES_256_GCM, RANDOM);

    SealedPayload first = engine.seal(PLAINTEXT, key);
    SealedPayload second = engine.seal(PLAINTEXT, key);

    assertThat(first.iv()).isNotEqualTo(second.iv());
    assertThat(first.ciphertext()).isNotEqualTo(second.ciphertext());
  }

  @Test
  void sealThenOpen_emptyPlaintext() {
    VaultKey key = VaultKey.generate(VaultCipherSuite.AES_256_GCM, RANDOM);

    SealedPayload sealed = engine.seal(new byte[0], key);

    assertThat(engine.open(sealed, key)).isEmpty();
  }

  @Test
  void aes128_roundTrip() {
    AesGcmCipherEngine engine128 = new AesGcmCipherEngine(VaultCipherSuite.AES_128_GCM);
    VaultKey key = VaultKey.generate(VaultCipherSuite.AES_128_GCM, RANDOM);

    assertThat(engine128.open(engine128.seal(PLAINTEXT, key), key)).isEqualTo(PLAINTEXT);
  }

  // ── Authentication failures ─────────────────────────────────────────────────

  @Test
  void open_withWrongKey_throwsAuthenticationFailure() {
    VaultKey key = VaultKey.generate(VaultCipherSuite.AES_256_GCM, RANDOM);
    VaultKey other = VaultKey.generate(VaultCipherSuite.AES_256_GCM, RANDOM);
    SealedPayload sealed = engine.seal(PLAINTEXT, key);

    assertThatThrownBy(() -> engine.open(sealed, other))
        .isInstanceOf(CipherAuthenticationException.class);
  }

  @Test
  void open_withTamperedCiphertext_throwsAuthenticationFailure() {
    VaultKey key = VaultKey.generate(VaultCipherSuite.AES_256_GCM, RANDOM);
    SealedPayload sealed = engine.seal(PLAINTEXT, key);
    byte[] ciphertext = sealed.ciphertext();
    ciphertext[0] ^= 0x01;
    SealedPayload tampered = new SealedPayload(ciphertext, sealed.iv(), sealed.authTag());

    assertThatThrownBy(() -> engine.open(tampered, key))
        .isInstanceOf(CipherAuthenticationException.class);
  }

  @Test
  void open_withTamperedTag_throwsAuthenticationFailure() {
    VaultKey key = VaultKey.generate(VaultCipherSuite.AES_256_GCM, RANDOM);
    SealedPayload sealed = engine.seal(PLAINTEXT, key);
    byte[] tag = sealed.authTag();
    tag[15] ^= (byte) 0x80;
    SealedPayload tampered = new SealedPayload(sealed.ciphertext(), sealed.iv(), tag);

    assertThatThrownBy(() -> engine.open(tampered, key))
        .isInstanceOf(CipherAuthenticationException.class)
        .isInstanceOf(SecurityException.class);
  }

  // ── Input validation ────────────────────────────────────────────────────────

  @Test
  void seal_withWrongKeyLength_throwsIllegalArgument() {
    VaultKey shortKey = VaultKey.generate(VaultCipherSuite.AES_128_GCM, RANDOM);

    assertThatThrownBy(() -> engine.seal(PLAINTEXT, shortKey))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("32 bytes");
  }

  @Test
  void open_withShortIv_throwsIllegalArgument() {
    VaultKey key = VaultKey.generate(VaultCipherSuite.AES_256_GCM, RANDOM);
    SealedPayload sealed = engine.seal(PLAINTEXT, key);
    SealedPayload bad = new SealedPayload(sealed.ciphertext(), new byte[8], sealed.authTag());

    assertThatThrownBy(() -> engine.open(bad, key))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void seal_withDestroyedKey_throwsIllegalState() {
    VaultKey key = VaultKey.generate(VaultCipherSuite.AES_256_GCM, RANDOM);
    key.destroy();

    assertThatThrownBy(() -> engine.seal(PLAINTEXT, key))
        .isInstanceOf(IllegalStateException.class);
  }
}
