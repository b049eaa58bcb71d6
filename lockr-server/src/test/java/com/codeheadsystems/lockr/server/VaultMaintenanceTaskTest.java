package com.codeheadsystems.lockr.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.lockr.server.audit.SecurityAuditLog;
import com.codeheadsystems.lockr.server.delivery.ResetTokenDelivery;
import com.codeheadsystems.lockr.server.error.VaultException;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VaultMaintenanceTaskTest {

  @Mock private SecurityAuditLog auditLog;
  @Mock private ResetTokenDelivery delivery;

  private VaultFixture fixture;
  private VaultMaintenanceTask task;

  @BeforeEach
  void setUp() {
    fixture = new VaultFixture(auditLog, delivery);
    task = new VaultMaintenanceTask(fixture.sessionRegistry, fixture.attemptLimiter, fixture.resetManager,
        Duration.ofSeconds(60));
  }

  @AfterEach
  void tearDown() {
    task.stop();
  }

  @Test
  void runOnce_nothingExpired_purgesNothing() {
    fixture.unlockManager.unlock(VaultFixture.ALICE, VaultFixture.newKey(), "10.0.0.1");

    assertThat(task.runOnce()).isZero();
    assertThat(fixture.unlockManager.status(VaultFixture.ALICE)).isPresent();
  }

  @Test
  void runOnce_purgesSessionsWindowsAndTokens() {
    fixture.unlockManager.unlock(VaultFixture.ALICE, VaultFixture.newKey(), "10.0.0.1");
    fixture.seedEntries(VaultFixture.BOB, VaultFixture.newKey(), 1);
    assertThatThrownBy(() -> fixture.unlockManager.unlock(VaultFixture.BOB, VaultFixture.newKey(), "10.0.0.2"))
        .isInstanceOf(VaultException.class);
    fixture.resetManager.requestReset(VaultFixture.ALICE_EMAIL, true, "10.0.0.3");

    fixture.clock.advance(Duration.ofHours(2));

    // one session, one failure window, one reset token
    assertThat(task.runOnce()).isEqualTo(3);
    assertThat(task.runOnce()).isZero();
    assertThat(fixture.attemptLimiter.failures(VaultFixture.BOB)).isZero();
  }

  @Test
  void startAndStop_areIdempotent() {
    task.start();
    task.start();
    task.stop();
    task.stop();
  }
}
