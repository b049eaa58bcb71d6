package com.codeheadsystems.lockr.server.manager;

import static com.codeheadsystems.lockr.server.VaultFixture.ALICE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import com.codeheadsystems.lockr.crypto.VaultKey;
import com.codeheadsystems.lockr.server.VaultFixture;
import com.codeheadsystems.lockr.server.audit.SecurityAuditLog;
import com.codeheadsystems.lockr.server.delivery.ResetTokenDelivery;
import com.codeheadsystems.lockr.server.error.VaultErrorCode;
import com.codeheadsystems.lockr.server.error.VaultException;
import com.codeheadsystems.lockr.server.gate.UserVaultGates;
import com.codeheadsystems.lockr.server.store.EntryStore;
import com.codeheadsystems.lockr.server.store.SessionRegistry;
import com.codeheadsystems.lockr.server.store.VaultEntry;
import java.util.List;
import java.util.Optional;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class KeyRotationManagerTest {

  @Mock private SecurityAuditLog auditLog;
  @Mock private ResetTokenDelivery delivery;

  private VaultFixture fixture;
  private KeyRotationManager manager;
  private String k1;
  private String k2;

  @BeforeEach
  void setUp() {
    fixture = new VaultFixture(auditLog, delivery);
    manager = fixture.rotationManager;
    k1 = VaultFixture.newKey();
    k2 = VaultFixture.newKey();
  }

  private static void assertCode(ThrowingCallable call, VaultErrorCode code) {
    assertThatThrownBy(call)
        .isInstanceOf(VaultException.class)
        .satisfies(e -> assertThat(((VaultException) e).code()).isEqualTo(code));
  }

  // ── Preconditions ───────────────────────────────────────────────────────────

  @Test
  void rotate_withoutSession_isSessionRequired() {
    fixture.seedEntries(ALICE, k1, 1);

    assertCode(() -> manager.rotate(ALICE, k1, k2), VaultErrorCode.SESSION_REQUIRED);
  }

  @Test
  void rotate_currentKeyNotSessionKey_isKeyMismatch() {
    fixture.seedEntries(ALICE, k1, 1);
    fixture.unlockManager.unlock(ALICE, k1, null);

    assertCode(() -> manager.rotate(ALICE, VaultFixture.newKey(), k2), VaultErrorCode.KEY_MISMATCH);
  }

  @Test
  void rotate_sameKey_isValidationError() {
    fixture.unlockManager.unlock(ALICE, k1, null);

    assertCode(() -> manager.rotate(ALICE, k1, k1), VaultErrorCode.VALIDATION_ERROR);
  }

  @Test
  void rotate_malformedNewKey_isValidationError() {
    fixture.unlockManager.unlock(ALICE, k1, null);

    assertCode(() -> manager.rotate(ALICE, k1, "not-a-key"), VaultErrorCode.VALIDATION_ERROR);
  }

  @Test
  void rotate_whileAnotherExclusiveRuns_isBusy() {
    fixture.unlockManager.unlock(ALICE, k1, null);
    try (UserVaultGates.Exclusive ignored = fixture.gates.beginExclusive(ALICE)) {
      assertCode(() -> manager.rotate(ALICE, k1, k2), VaultErrorCode.VAULT_BUSY);
    }
  }

  // ── Rotation ────────────────────────────────────────────────────────────────

  @Test
  void threeEntries_k1ToK2_oldKeyFailsNewKeyWorks() {
    List<String> ids = fixture.seedEntries(ALICE, k1, 3);
    fixture.unlockManager.unlock(ALICE, k1, null);

    KeyRotationResult result = manager.rotate(ALICE, k1, k2);

    assertThat(result.outcome()).isEqualTo(KeyRotationResult.Outcome.ROTATED);
    assertThat(result.rotated()).isEqualTo(3);
    assertThat(result.skipped()).isZero();
    assertThat(result.rotatedIds()).containsExactlyInAnyOrderElementsOf(ids);
    verify(auditLog).keyRotated(ALICE, "ROTATED", 3, 0);

    fixture.unlockManager.lock(ALICE);
    assertCode(() -> fixture.unlockManager.unlock(ALICE, k1, null), VaultErrorCode.INVALID_KEY);
    assertThatCode(() -> fixture.unlockManager.unlock(ALICE, k2, null)).doesNotThrowAnyException();
    assertThat(fixture.entryManager.listEntries(ALICE, null, false).entries()).hasSize(3);
  }

  @Test
  void rotate_installsSessionUnderNewKey() {
    fixture.seedEntries(ALICE, k1, 1);
    fixture.unlockManager.unlock(ALICE, k1, null);

    manager.rotate(ALICE, k1, k2);

    assertThat(fixture.sessionRegistry.getEncryptionKey(ALICE).orElseThrow()
        .matches(VaultFixture.key(k2))).isTrue();
  }

  @Test
  void corruptedEntry_isSkippedWithoutAbortingBatch() {
    List<String> ids = fixture.seedEntries(ALICE, k1, 5);
    fixture.corrupt(ALICE, ids.get(2));
    fixture.unlockManager.unlock(ALICE, k1, null);

    KeyRotationResult result = manager.rotate(ALICE, k1, k2);

    assertThat(result.outcome()).isEqualTo(KeyRotationResult.Outcome.PARTIAL);
    assertThat(result.rotated()).isEqualTo(4);
    assertThat(result.skippedIds()).containsExactly(ids.get(2));
    verify(auditLog).keyRotated(ALICE, "PARTIAL", 4, 1);

    EntryListing listing = fixture.entryManager.listEntries(ALICE, null, false);
    assertThat(listing.entries()).hasSize(4);
    assertThat(listing.unreadable()).isEqualTo(1);

    // The most recently written entry is under the new key, so the new key still unlocks.
    fixture.unlockManager.lock(ALICE);
    assertThatCode(() -> fixture.unlockManager.unlock(ALICE, k2, null)).doesNotThrowAnyException();
  }

  @Test
  void noEntries_isEmptyAndStillSwapsKey() {
    fixture.unlockManager.unlock(ALICE, k1, null);

    KeyRotationResult result = manager.rotate(ALICE, k1, k2);

    assertThat(result.outcome()).isEqualTo(KeyRotationResult.Outcome.EMPTY);
    assertThat(fixture.sessionRegistry.getEncryptionKey(ALICE).orElseThrow()
        .matches(VaultFixture.key(k2))).isTrue();
  }

  @Test
  void nothingDecryptable_isIneffectiveAndKeepsSession() {
    List<String> ids = fixture.seedEntries(ALICE, k1, 2);
    fixture.unlockManager.unlock(ALICE, k1, null);
    ids.forEach(id -> fixture.corrupt(ALICE, id));
    long epoch = fixture.gates.epoch(ALICE);

    KeyRotationResult result = manager.rotate(ALICE, k1, k2);

    assertThat(result.outcome()).isEqualTo(KeyRotationResult.Outcome.INEFFECTIVE);
    assertThat(result.skipped()).isEqualTo(2);
    assertThat(fixture.sessionRegistry.getEncryptionKey(ALICE).orElseThrow()
        .matches(VaultFixture.key(k1))).isTrue();
    assertThat(fixture.gates.epoch(ALICE)).isEqualTo(epoch);
  }

  // ── Interruption and concurrency ────────────────────────────────────────────

  @Test
  void interruptedBatch_isFatal_andRerunFinishesTheRotation() {
    fixture.seedEntries(ALICE, k1, 5);
    fixture.unlockManager.unlock(ALICE, k1, null);
    EntryStore store = spy(fixture.entryStore);
    doAnswer(invocation -> {
      List<VaultEntry> batch = invocation.getArgument(1);
      fixture.entryStore.replaceAll(ALICE, batch.subList(0, 2));
      throw new IllegalStateException("connection reset");
    }).doCallRealMethod().when(store).replaceAll(eq(ALICE), anyList());
    KeyRotationManager interrupted = new KeyRotationManager(fixture.cipherEngine, store,
        fixture.sessionRegistry, fixture.gates, auditLog, fixture.clock);

    assertCode(() -> interrupted.rotate(ALICE, k1, k2), VaultErrorCode.FATAL);
    assertThat(fixture.sessionRegistry.getEncryptionKey(ALICE).orElseThrow()
        .matches(VaultFixture.key(k1))).isTrue();

    KeyRotationResult rerun = interrupted.rotate(ALICE, k1, k2);

    assertThat(rerun.outcome()).isEqualTo(KeyRotationResult.Outcome.ROTATED);
    assertThat(rerun.rotated()).isEqualTo(5);
    VaultKey newKey = VaultFixture.key(k2);
    assertThat(fixture.entryStore.findAllByOwner(ALICE))
        .allSatisfy(entry -> assertThatCode(() -> fixture.cipherEngine.open(entry.sealed(), newKey))
            .doesNotThrowAnyException());
  }

  @Test
  @SuppressWarnings("unchecked")
  void lockAfterSessionCheck_leavesVaultLocked() {
    fixture.seedEntries(ALICE, k1, 2);
    fixture.unlockManager.unlock(ALICE, k1, null);
    SessionRegistry registry = spy(fixture.sessionRegistry);
    doAnswer(invocation -> {
      Optional<VaultKey> key = (Optional<VaultKey>) invocation.callRealMethod();
      fixture.unlockManager.lock(ALICE);
      return key;
    }).when(registry).getEncryptionKey(ALICE);
    KeyRotationManager racing = new KeyRotationManager(fixture.cipherEngine, fixture.entryStore,
        registry, fixture.gates, auditLog, fixture.clock);

    KeyRotationResult result = racing.rotate(ALICE, k1, k2);

    assertThat(result.outcome()).isEqualTo(KeyRotationResult.Outcome.ROTATED);
    assertThat(fixture.sessionRegistry.getSession(ALICE)).isEmpty();
    assertCode(() -> fixture.entryManager.listEntries(ALICE, null, false), VaultErrorCode.SESSION_REQUIRED);
    assertThatCode(() -> fixture.unlockManager.unlock(ALICE, k2, null)).doesNotThrowAnyException();
  }

  @Test
  void lockBeforeRotation_isSessionRequired() {
    fixture.seedEntries(ALICE, k1, 1);
    fixture.unlockManager.unlock(ALICE, k1, null);
    fixture.unlockManager.lock(ALICE);

    assertCode(() -> manager.rotate(ALICE, k1, k2), VaultErrorCode.SESSION_REQUIRED);
    assertThat(fixture.sessionRegistry.getSession(ALICE)).isEmpty();
  }
}
