package com.codeheadsystems.lockr.server.store;

import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for vault entries. Knows nothing about plaintext.
 * <p>
 * Implementations must be thread-safe, and no method may return or touch an entry belonging to an
 * owner other than the one passed in.
 */
public interface EntryStore {

  /**
   * All entries for the owner, oldest first.
   *
   * @param ownerId the owner id
   * @return the entries
   */
  List<VaultEntry> findAllByOwner(String ownerId);

  /**
   * The owner's most recently written entry. Its ciphertext is always under the key that was
   * active at the last write, which makes it the right entry to verify a submitted key against.
   *
   * @param ownerId the owner id
   * @return the entry, or empty if the vault has no entries
   */
  Optional<VaultEntry> findLatestByOwner(String ownerId);

  /**
   * Find by id and owner.
   *
   * @param id      the id
   * @param ownerId the owner id
   * @return the entry, or empty if not found for this owner
   */
  Optional<VaultEntry> findByIdAndOwner(String id, String ownerId);

  /**
   * Inserts a new entry.
   *
   * @param entry the entry
   */
  void insert(VaultEntry entry);

  /**
   * Replaces one entry if it still exists for its owner.
   *
   * @param entry the replacement
   * @return true if an entry was replaced
   */
  boolean replace(VaultEntry entry);

  /**
   * Batch write. Replaces each entry that still exists for the owner; entries that have vanished
   * are not recreated.
   *
   * @param ownerId      the owner id
   * @param replacements replacement entries, all owned by {@code ownerId}
   * @return ids of the entries actually replaced
   */
  List<String> replaceAll(String ownerId, List<VaultEntry> replacements);

  /**
   * Deletes one entry.
   *
   * @param id      the id
   * @param ownerId the owner id
   * @return true if it existed
   */
  boolean delete(String id, String ownerId);

  /**
   * Deletes every entry for the owner.
   *
   * @param ownerId the owner id
   * @return number deleted
   */
  int deleteAllByOwner(String ownerId);

  /**
   * Count by owner.
   *
   * @param ownerId the owner id
   * @return the count
   */
  int countByOwner(String ownerId);
}
