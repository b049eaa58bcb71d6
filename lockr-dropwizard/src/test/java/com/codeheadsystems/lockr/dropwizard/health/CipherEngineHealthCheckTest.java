package com.codeheadsystems.lockr.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.lockr.crypto.AesGcmCipherEngine;
import com.codeheadsystems.lockr.crypto.CipherEngine;
import com.codeheadsystems.lockr.crypto.VaultCipherSuite;
import com.codeheadsystems.lockr.crypto.VaultKey;
import org.junit.jupiter.api.Test;

class CipherEngineHealthCheckTest {

  @Test
  void realEngine_isHealthy() {
    HealthCheck.Result result = new CipherEngineHealthCheck(new AesGcmCipherEngine(VaultCipherSuite.AES_128_GCM))
        .execute();

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).contains("AES_128_GCM");
  }

  @Test
  void failingEngine_isUnhealthy() {
    CipherEngine broken = mock(CipherEngine.class);
    when(broken.suite()).thenReturn(VaultCipherSuite.AES_256_GCM);
    when(broken.seal(any(byte[].class), any(VaultKey.class))).thenThrow(new IllegalStateException("no provider"));

    HealthCheck.Result result = new CipherEngineHealthCheck(broken).execute();

    assertThat(result.isHealthy()).isFalse();
  }
}
