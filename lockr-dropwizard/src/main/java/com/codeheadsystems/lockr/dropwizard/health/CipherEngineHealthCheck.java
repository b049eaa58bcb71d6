package com.codeheadsystems.lockr.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.lockr.crypto.CipherEngine;
import com.codeheadsystems.lockr.crypto.SealedPayload;
import com.codeheadsystems.lockr.crypto.VaultKey;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Health check that seals and opens a sample value under a throwaway key.
 */
public class CipherEngineHealthCheck extends HealthCheck {

  private static final byte[] SAMPLE = "lockr-health-check".getBytes(StandardCharsets.UTF_8);

  private final CipherEngine cipherEngine;
  private final SecureRandom random = new SecureRandom();

  /**
   * Instantiates a new cipher engine health check.
   *
   * @param cipherEngine the cipher engine
   */
  public CipherEngineHealthCheck(CipherEngine cipherEngine) {
    this.cipherEngine = cipherEngine;
  }

  @Override
  protected Result check() {
    VaultKey key = VaultKey.generate(cipherEngine.suite(), random);
    try {
      SealedPayload sealed = cipherEngine.seal(SAMPLE, key);
      byte[] opened = cipherEngine.open(sealed, key);
      if (!Arrays.equals(SAMPLE, opened)) {
        return Result.unhealthy("Round trip returned different plaintext");
      }
      return Result.healthy("suite=%s", cipherEngine.suite());
    } catch (RuntimeException e) {
      return Result.unhealthy(e);
    } finally {
      key.destroy();
    }
  }
}
