package com.codeheadsystems.lockr.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.lockr.server.VaultPolicy;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class LockrConfigurationTest {

  @Test
  void defaults_matchCorePolicyDefaults() {
    assertThat(new LockrConfiguration().toVaultPolicy()).isEqualTo(VaultPolicy.defaults());
  }

  @Test
  void overrides_areCarriedIntoPolicy() {
    LockrConfiguration configuration = new LockrConfiguration();
    configuration.setSessionTtlMinutes(5);
    configuration.setMaxUnlockFailuresPerAddress(2);
    configuration.setSealKeyCheckOnFirstUnlock(true);

    VaultPolicy policy = configuration.toVaultPolicy();

    assertThat(policy.sessionTtl()).isEqualTo(Duration.ofMinutes(5));
    assertThat(policy.maxUnlockFailuresPerAddress()).isEqualTo(2);
    assertThat(policy.sealKeyCheckOnFirstUnlock()).isTrue();
  }
}
