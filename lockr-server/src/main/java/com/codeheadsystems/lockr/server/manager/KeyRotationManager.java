package com.codeheadsystems.lockr.server.manager;

import com.codeheadsystems.lockr.crypto.CipherAuthenticationException;
import com.codeheadsystems.lockr.crypto.CipherEngine;
import com.codeheadsystems.lockr.crypto.VaultKey;
import com.codeheadsystems.lockr.server.audit.SecurityAuditLog;
import com.codeheadsystems.lockr.server.error.VaultErrorCode;
import com.codeheadsystems.lockr.server.error.VaultException;
import com.codeheadsystems.lockr.server.gate.UserVaultGates;
import com.codeheadsystems.lockr.server.store.EntryStore;
import com.codeheadsystems.lockr.server.store.SessionRegistry;
import com.codeheadsystems.lockr.server.store.VaultEntry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-seals every entry of a vault under a new key (master password change).
 * <p>
 * Best effort with per-entry isolation: an entry that does not decrypt under the current key is
 * skipped and reported, never allowed to abort the rest. All re-sealing happens before the single
 * batch write, so a cipher failure aborts the rotation with nothing written. Each written entry is
 * self-consistent, so an interrupted batch leaves some entries under the old key and some under
 * the new one. The session still holds the old key in that case, and running the same rotation
 * again re-seals the stragglers and counts entries already under the new key as rotated.
 * <p>
 * <strong>Exception contract:</strong> {@link VaultException} with VALIDATION_ERROR,
 * SESSION_REQUIRED, KEY_MISMATCH, VAULT_BUSY or FATAL.
 */
public class KeyRotationManager {

  private static final Logger log = LoggerFactory.getLogger(KeyRotationManager.class);

  private final CipherEngine cipherEngine;
  private final EntryStore entryStore;
  private final SessionRegistry sessionRegistry;
  private final UserVaultGates gates;
  private final SecurityAuditLog auditLog;
  private final Clock clock;

  public KeyRotationManager(CipherEngine cipherEngine,
                            EntryStore entryStore,
                            SessionRegistry sessionRegistry,
                            UserVaultGates gates,
                            SecurityAuditLog auditLog,
                            Clock clock) {
    this.cipherEngine = cipherEngine;
    this.entryStore = entryStore;
    this.sessionRegistry = sessionRegistry;
    this.gates = gates;
    this.auditLog = auditLog;
    this.clock = clock;
  }

  /**
   * Rotates the vault from {@code currentKey} to {@code newKey}.
   * <p>
   * On {@code ROTATED}, {@code PARTIAL} or {@code EMPTY} the session is replaced by one under the
   * new key (unless the vault was locked while the rotation ran). On {@code INEFFECTIVE} nothing is
   * written and the session is untouched.
   *
   * @param userId            authenticated user id
   * @param encodedCurrentKey base64 key the vault is unlocked with
   * @param encodedNewKey     base64 replacement key
   * @return per-entry result
   */
  public KeyRotationResult rotate(String userId, String encodedCurrentKey, String encodedNewKey) {
    log.debug("rotate(userId={})", userId);
    VaultKey currentKey = KeyParsing.parse(encodedCurrentKey, cipherEngine.suite(), "Current key");
    VaultKey newKey = KeyParsing.parse(encodedNewKey, cipherEngine.suite(), "New key");
    try {
      if (currentKey.matches(newKey)) {
        throw VaultException.validation("New key must differ from the current key");
      }
      try (UserVaultGates.Exclusive exclusive = gates.beginExclusive(userId)) {
        // Checked inside the exclusive section so a lock from here on is seen by commitKeyChange.
        VaultKey sessionKey = sessionRegistry.getEncryptionKey(userId)
            .orElseThrow(VaultException::sessionRequired);
        try {
          if (!sessionKey.matches(currentKey)) {
            throw new VaultException(VaultErrorCode.KEY_MISMATCH,
                "Current key does not match the unlocked vault");
          }
        } finally {
          sessionKey.destroy();
        }

        KeyRotationResult result = reseal(userId, currentKey, newKey);
        if (result.outcome() == KeyRotationResult.Outcome.INEFFECTIVE) {
          log.warn("Rotation for userId={} could not decrypt any of {} entries", userId, result.skipped());
        } else {
          boolean installed = exclusive.commitKeyChange(() -> sessionRegistry.createSession(userId, newKey));
          if (!installed) {
            log.debug("rotate(userId={}) vault locked during rotation; leaving it locked", userId);
          }
        }
        auditLog.keyRotated(userId, result.outcome().name(), result.rotated(), result.skipped());
        return result;
      }
    } finally {
      currentKey.destroy();
      newKey.destroy();
    }
  }

  private KeyRotationResult reseal(String userId, VaultKey currentKey, VaultKey newKey) {
    List<VaultEntry> entries;
    try {
      entries = entryStore.findAllByOwner(userId);
    } catch (RuntimeException e) {
      throw VaultException.fatal("Unable to read vault entries", e);
    }

    Instant now = clock.instant();
    List<VaultEntry> replacements = new ArrayList<>(entries.size());
    List<String> skipped = new ArrayList<>();
    List<String> alreadyRotated = new ArrayList<>();
    for (VaultEntry entry : entries) {
      byte[] plaintext;
      try {
        plaintext = cipherEngine.open(entry.sealed(), currentKey);
      } catch (CipherAuthenticationException | IllegalArgumentException e) {
        if (opensUnder(entry, newKey)) {
          // Written by an earlier, interrupted run of this rotation.
          alreadyRotated.add(entry.id());
        } else {
          log.warn("Skipping entry {} for userId={}: not decryptable under the current key", entry.id(), userId);
          skipped.add(entry.id());
        }
        continue;
      }
      try {
        replacements.add(entry.reseal(cipherEngine.seal(plaintext, newKey), now));
      } catch (RuntimeException e) {
        throw VaultException.fatal("Re-encryption failed; no entries were changed", e);
      } finally {
        Arrays.fill(plaintext, (byte) 0);
      }
    }

    if (replacements.isEmpty()) {
      return KeyRotationResult.of(alreadyRotated, skipped);
    }

    List<String> written;
    try {
      written = entryStore.replaceAll(userId, replacements);
    } catch (RuntimeException e) {
      throw VaultException.fatal("Batch write of rotated entries failed", e);
    }
    Set<String> writtenIds = new HashSet<>(written);
    List<String> rotated = new ArrayList<>(alreadyRotated);
    for (VaultEntry replacement : replacements) {
      if (writtenIds.contains(replacement.id())) {
        rotated.add(replacement.id());
      } else {
        // Deleted between read and write.
        skipped.add(replacement.id());
      }
    }
    return KeyRotationResult.of(rotated, skipped);
  }

  private boolean opensUnder(VaultEntry entry, VaultKey key) {
    try {
      Arrays.fill(cipherEngine.open(entry.sealed(), key), (byte) 0);
      return true;
    } catch (CipherAuthenticationException | IllegalArgumentException e) {
      return false;
    }
  }
}
