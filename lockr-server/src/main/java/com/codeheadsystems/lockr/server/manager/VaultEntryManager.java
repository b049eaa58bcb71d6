package com.codeheadsystems.lockr.server.manager;

import com.codeheadsystems.lockr.crypto.CipherAuthenticationException;
import com.codeheadsystems.lockr.crypto.CipherEngine;
import com.codeheadsystems.lockr.crypto.SealedPayload;
import com.codeheadsystems.lockr.crypto.VaultKey;
import com.codeheadsystems.lockr.model.vault.VaultEntryPayload;
import com.codeheadsystems.lockr.server.audit.SecurityAuditLog;
import com.codeheadsystems.lockr.server.error.VaultException;
import com.codeheadsystems.lockr.server.gate.UserVaultGates;
import com.codeheadsystems.lockr.server.store.EntryStore;
import com.codeheadsystems.lockr.server.store.SessionRegistry;
import com.codeheadsystems.lockr.server.store.VaultEntry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session-scoped entry operations. Every call needs a live unlock session and uses only that
 * session's key; no key is ever accepted per request.
 * <p>
 * Writes are registered with {@link UserVaultGates} so they cannot interleave with a rotation or
 * reset of the same vault.
 */
public class VaultEntryManager {

  private static final Logger log = LoggerFactory.getLogger(VaultEntryManager.class);
  private static final int MAX_CATEGORY_LENGTH = 50;

  private final CipherEngine cipherEngine;
  private final EntryStore entryStore;
  private final SessionRegistry sessionRegistry;
  private final UserVaultGates gates;
  private final VaultEntryCodec codec;
  private final SecurityAuditLog auditLog;
  private final Clock clock;

  public VaultEntryManager(CipherEngine cipherEngine,
                           EntryStore entryStore,
                           SessionRegistry sessionRegistry,
                           UserVaultGates gates,
                           VaultEntryCodec codec,
                           SecurityAuditLog auditLog,
                           Clock clock) {
    this.cipherEngine = cipherEngine;
    this.entryStore = entryStore;
    this.sessionRegistry = sessionRegistry;
    this.gates = gates;
    this.codec = codec;
    this.auditLog = auditLog;
    this.clock = clock;
  }

  public DecryptedEntry createEntry(String userId, String category, boolean favorite, VaultEntryPayload payload) {
    log.debug("createEntry(userId={})", userId);
    validate(category, payload);
    try (UserVaultGates.Writer ignored = gates.beginWrite(userId)) {
      VaultKey key = sessionKey(userId);
      try {
        Instant now = clock.instant();
        VaultEntry entry = new VaultEntry(UUID.randomUUID().toString(), userId, category, favorite,
            seal(payload, key), now, now);
        store(() -> entryStore.insert(entry));
        return new DecryptedEntry(entry.id(), category, favorite, payload, now, now);
      } finally {
        key.destroy();
      }
    }
  }

  /**
   * Lists readable entries. Entries that do not decrypt are counted and audited instead of failing
   * the whole listing.
   *
   * @param userId        the user id
   * @param category      optional filter
   * @param favoritesOnly only entries flagged as favorites
   * @return the listing
   */
  public EntryListing listEntries(String userId, String category, boolean favoritesOnly) {
    log.debug("listEntries(userId={}, category={}, favoritesOnly={})", userId, category, favoritesOnly);
    VaultKey key = sessionKey(userId);
    try {
      List<VaultEntry> entries = read(() -> entryStore.findAllByOwner(userId));
      List<DecryptedEntry> readable = new ArrayList<>(entries.size());
      int unreadable = 0;
      for (VaultEntry entry : entries) {
        if (VaultEntryCodec.isKeyCheck(entry.category())
            || (category != null && !category.equals(entry.category()))
            || (favoritesOnly && !entry.favorite())) {
          continue;
        }
        try {
          readable.add(open(entry, key));
        } catch (CipherAuthenticationException | IllegalArgumentException e) {
          unreadable++;
          auditLog.entryUndecryptable(userId, entry.id(), "list");
        }
      }
      return new EntryListing(readable, unreadable);
    } finally {
      key.destroy();
    }
  }

  public DecryptedEntry getEntry(String userId, String entryId) {
    log.debug("getEntry(userId={}, entryId={})", userId, entryId);
    VaultKey key = sessionKey(userId);
    try {
      VaultEntry entry = find(userId, entryId);
      try {
        return open(entry, key);
      } catch (CipherAuthenticationException | IllegalArgumentException e) {
        auditLog.entryUndecryptable(userId, entryId, "get");
        throw VaultException.fatal("Entry could not be decrypted with the current vault key", e);
      }
    } finally {
      key.destroy();
    }
  }

  /**
   * Replaces an entry's category and payload. The ciphertext is always fully replaced.
   *
   * @param userId   the user id
   * @param entryId  the entry id
   * @param category the category
   * @param favorite new favorite flag, or null to keep the current one
   * @param payload  the payload
   * @return the updated entry
   */
  public DecryptedEntry updateEntry(String userId, String entryId, String category, Boolean favorite,
                                    VaultEntryPayload payload) {
    log.debug("updateEntry(userId={}, entryId={})", userId, entryId);
    validate(category, payload);
    try (UserVaultGates.Writer ignored = gates.beginWrite(userId)) {
      VaultKey key = sessionKey(userId);
      try {
        VaultEntry existing = find(userId, entryId);
        Instant now = clock.instant();
        boolean flag = favorite == null ? existing.favorite() : favorite;
        VaultEntry replacement = existing.replace(category, flag, seal(payload, key), now);
        if (!read(() -> entryStore.replace(replacement))) {
          throw VaultException.notFound("Entry not found");
        }
        return new DecryptedEntry(entryId, category, flag, payload, existing.createdAt(), now);
      } finally {
        key.destroy();
      }
    }
  }

  public void deleteEntry(String userId, String entryId) {
    log.debug("deleteEntry(userId={}, entryId={})", userId, entryId);
    try (UserVaultGates.Writer ignored = gates.beginWrite(userId)) {
      sessionKey(userId).destroy();
      find(userId, entryId);
      if (!read(() -> entryStore.delete(entryId, userId))) {
        throw VaultException.notFound("Entry not found");
      }
    }
  }

  private VaultKey sessionKey(String userId) {
    return sessionRegistry.getEncryptionKey(userId).orElseThrow(VaultException::sessionRequired);
  }

  private VaultEntry find(String userId, String entryId) {
    return read(() -> entryStore.findByIdAndOwner(entryId, userId))
        .filter(e -> !VaultEntryCodec.isKeyCheck(e.category()))
        .orElseThrow(() -> VaultException.notFound("Entry not found"));
  }

  private SealedPayload seal(VaultEntryPayload payload, VaultKey key) {
    byte[] plaintext = codec.encode(payload);
    try {
      return cipherEngine.seal(plaintext, key);
    } catch (IllegalStateException e) {
      throw VaultException.fatal("Encryption failed", e);
    } finally {
      Arrays.fill(plaintext, (byte) 0);
    }
  }

  private DecryptedEntry open(VaultEntry entry, VaultKey key) {
    byte[] plaintext = cipherEngine.open(entry.sealed(), key);
    try {
      return new DecryptedEntry(entry.id(), entry.category(), entry.favorite(), codec.decode(plaintext),
          entry.createdAt(), entry.updatedAt());
    } catch (IllegalStateException e) {
      throw VaultException.fatal("Stored entry is not a valid payload", e);
    } finally {
      Arrays.fill(plaintext, (byte) 0);
    }
  }

  private static void validate(String category, VaultEntryPayload payload) {
    if (category == null || category.isBlank()) {
      throw VaultException.validation("Category is required");
    }
    if (category.length() > MAX_CATEGORY_LENGTH) {
      throw VaultException.validation("Category must be at most " + MAX_CATEGORY_LENGTH + " characters");
    }
    if (VaultEntryCodec.isKeyCheck(category)) {
      throw VaultException.validation("Category '" + category + "' is reserved");
    }
    if (payload == null) {
      throw VaultException.validation("Payload is required");
    }
  }

  private static void store(Runnable write) {
    try {
      write.run();
    } catch (RuntimeException e) {
      throw VaultException.fatal("Unable to write vault entry", e);
    }
  }

  private static <T> T read(Supplier<T> op) {
    try {
      return op.get();
    } catch (RuntimeException e) {
      throw VaultException.fatal("Vault storage failure", e);
    }
  }
}
