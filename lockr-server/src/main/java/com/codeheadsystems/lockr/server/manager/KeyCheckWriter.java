package com.codeheadsystems.lockr.server.manager;

import com.codeheadsystems.lockr.crypto.CipherEngine;
import com.codeheadsystems.lockr.crypto.VaultKey;
import com.codeheadsystems.lockr.server.store.EntryStore;
import com.codeheadsystems.lockr.server.store.VaultEntry;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seals the key-check entry: a fixed server-written payload that gives an otherwise empty vault
 * something to verify the next unlock against.
 */
public class KeyCheckWriter {

  private static final Logger log = LoggerFactory.getLogger(KeyCheckWriter.class);

  private final CipherEngine cipherEngine;
  private final EntryStore entryStore;
  private final VaultEntryCodec codec;
  private final Clock clock;

  public KeyCheckWriter(CipherEngine cipherEngine, EntryStore entryStore, VaultEntryCodec codec, Clock clock) {
    this.cipherEngine = cipherEngine;
    this.entryStore = entryStore;
    this.codec = codec;
    this.clock = clock;
  }

  /**
   * Seals and stores a key-check entry for the user.
   *
   * @param userId the user id
   * @param key    the key the vault will be unlocked with
   * @return the new entry's id
   */
  public String seal(String userId, VaultKey key) {
    Instant now = clock.instant();
    VaultEntry entry = new VaultEntry(UUID.randomUUID().toString(), userId,
        VaultEntryCodec.KEY_CHECK_CATEGORY, false, cipherEngine.seal(codec.keyCheckPlaintext(), key), now, now);
    entryStore.insert(entry);
    log.debug("seal(userId={}) key-check entry {}", userId, entry.id());
    return entry.id();
  }
}
