package com.codeheadsystems.lockr.server.manager;

import com.codeheadsystems.lockr.crypto.CipherAuthenticationException;
import com.codeheadsystems.lockr.crypto.CipherEngine;
import com.codeheadsystems.lockr.crypto.VaultKey;
import com.codeheadsystems.lockr.server.VaultPolicy;
import com.codeheadsystems.lockr.server.audit.SecurityAuditLog;
import com.codeheadsystems.lockr.server.error.RateLimitedException;
import com.codeheadsystems.lockr.server.error.VaultErrorCode;
import com.codeheadsystems.lockr.server.error.VaultException;
import com.codeheadsystems.lockr.server.gate.UserVaultGates;
import com.codeheadsystems.lockr.server.limiter.UnlockAttemptLimiter;
import com.codeheadsystems.lockr.server.store.AccountDirectory;
import com.codeheadsystems.lockr.server.store.EntryStore;
import com.codeheadsystems.lockr.server.store.SessionRegistry;
import com.codeheadsystems.lockr.server.store.UnlockSession;
import com.codeheadsystems.lockr.server.store.VaultEntry;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unlock and lock for a user's vault.
 * <p>
 * Unlock proves knowledge of the key by decrypting one stored entry. There is no stored hash or
 * other verifier; a tag mismatch is the only "wrong key" signal. The attempt limiter is consulted
 * before any decryption.
 * <p>
 * Framework-agnostic; all failures are {@link VaultException}s carrying the error code the HTTP
 * layer should report.
 */
public class VaultUnlockManager {

  private static final Logger log = LoggerFactory.getLogger(VaultUnlockManager.class);

  /**
   * Verification passes allowed when rotations or resets keep changing the key underneath.
   */
  private static final int MAX_VERIFY_PASSES = 3;

  private final CipherEngine cipherEngine;
  private final EntryStore entryStore;
  private final SessionRegistry sessionRegistry;
  private final UnlockAttemptLimiter attemptLimiter;
  private final AccountDirectory accountDirectory;
  private final UserVaultGates gates;
  private final KeyCheckWriter keyCheckWriter;
  private final SecurityAuditLog auditLog;
  private final VaultPolicy policy;

  public VaultUnlockManager(CipherEngine cipherEngine,
                            EntryStore entryStore,
                            SessionRegistry sessionRegistry,
                            UnlockAttemptLimiter attemptLimiter,
                            AccountDirectory accountDirectory,
                            UserVaultGates gates,
                            KeyCheckWriter keyCheckWriter,
                            SecurityAuditLog auditLog,
                            VaultPolicy policy) {
    this.cipherEngine = cipherEngine;
    this.entryStore = entryStore;
    this.sessionRegistry = sessionRegistry;
    this.attemptLimiter = attemptLimiter;
    this.accountDirectory = accountDirectory;
    this.gates = gates;
    this.keyCheckWriter = keyCheckWriter;
    this.auditLog = auditLog;
    this.policy = policy;
  }

  /**
   * Verifies the key against the vault and installs an unlock session.
   *
   * @param userId     authenticated user id
   * @param encodedKey base64 key
   * @param address    client address, may be null
   * @return the new session (with its own key copy; callers may destroy it)
   * @throws VaultException VALIDATION_ERROR, RATE_LIMITED, NOT_FOUND, INVALID_KEY, VAULT_BUSY or FATAL
   */
  public UnlockSession unlock(String userId, String encodedKey, String address) {
    log.debug("unlock(userId={})", userId);
    VaultKey key = KeyParsing.parse(encodedKey, cipherEngine.suite(), "Encryption key");
    try {
      Optional<Duration> blocked = attemptLimiter.blockedFor(userId, address);
      if (blocked.isPresent()) {
        auditLog.unlockRateLimited(userId, address);
        throw new RateLimitedException("Too many failed unlock attempts; try again later", blocked.get());
      }
      if (accountDirectory.findById(userId).isEmpty()) {
        throw VaultException.notFound("User not found");
      }
      if (gates.isExclusiveActive(userId)) {
        throw VaultException.busy();
      }

      for (int pass = 0; pass < MAX_VERIFY_PASSES; pass++) {
        long epoch = gates.epoch(userId);
        boolean verified = verify(userId, key, address);
        UnlockSession session;
        if (!verified && policy.sealKeyCheckOnFirstUnlock()) {
          session = sealKeyCheck(userId, key);
        } else {
          session = gates.ifEpochUnchanged(userId, epoch, () -> sessionRegistry.createSession(userId, key));
        }
        if (session != null) {
          log.debug("unlock(userId={}) succeeded", userId);
          return session;
        }
        log.debug("unlock(userId={}) key changed during verification; re-verifying", userId);
      }
      throw VaultException.busy();
    } finally {
      key.destroy();
    }
  }

  /**
   * Clears the user's session. Idempotent. A rotation running at the time finishes its writes and
   * leaves the vault locked.
   *
   * @param userId the user id
   */
  public void lock(String userId) {
    log.debug("lock(userId={})", userId);
    try {
      gates.lock(userId, () -> sessionRegistry.clearSession(userId));
    } catch (RuntimeException e) {
      throw VaultException.fatal("Unable to clear the unlock session", e);
    }
  }

  /**
   * Expiry of the live session, if any. The session key never leaves the registry here.
   *
   * @param userId the user id
   * @return when the session expires
   */
  public Optional<Instant> status(String userId) {
    return sessionRegistry.getSession(userId).map(s -> {
      s.encryptionKey().destroy();
      return s.expiresAt();
    });
  }

  /**
   * Seals the first key-check entry of an empty vault and installs the session, as one exclusive
   * operation. The epoch bump makes any concurrent first unlock re-verify against the new entry.
   *
   * @return the session, or null if another unlock sealed first
   */
  private UnlockSession sealKeyCheck(String userId, VaultKey key) {
    try (UserVaultGates.Exclusive exclusive = gates.beginExclusive(userId)) {
      if (latestEntry(userId).isPresent()) {
        return null;
      }
      try {
        keyCheckWriter.seal(userId, key);
      } catch (RuntimeException e) {
        throw VaultException.fatal("Unable to seal the key-check entry", e);
      }
      AtomicReference<UnlockSession> session = new AtomicReference<>();
      exclusive.commitAndRun(() -> session.set(sessionRegistry.createSession(userId, key)));
      return session.get();
    }
  }

  private Optional<VaultEntry> latestEntry(String userId) {
    try {
      return entryStore.findLatestByOwner(userId);
    } catch (RuntimeException e) {
      throw VaultException.fatal("Unable to read vault entries", e);
    }
  }

  /**
   * Opens the newest entry with the key.
   *
   * @return false if the vault is empty and there was nothing to verify against
   */
  private boolean verify(String userId, VaultKey key, String address) {
    Optional<VaultEntry> newest = latestEntry(userId);
    if (newest.isEmpty()) {
      return false;
    }
    try {
      byte[] plaintext = cipherEngine.open(newest.get().sealed(), key);
      Arrays.fill(plaintext, (byte) 0);
    } catch (CipherAuthenticationException e) {
      int failures = attemptLimiter.recordFailure(userId, address);
      auditLog.unlockFailed(userId, failures, address);
      throw new VaultException(VaultErrorCode.INVALID_KEY, "Invalid encryption key");
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw VaultException.fatal("Stored entry could not be processed", e);
    }
    return true;
  }
}
