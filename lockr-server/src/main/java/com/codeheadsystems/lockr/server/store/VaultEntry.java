package com.codeheadsystems.lockr.server.store;

import com.codeheadsystems.lockr.crypto.SealedPayload;
import java.time.Instant;

/**
 * A stored vault entry. Only {@code category}, {@code favorite} and the timestamps are in the clear; everything else
 * the user typed is inside {@code sealed}.
 *
 * @param id        immutable entry id
 * @param ownerId   immutable owning user id; every store query is scoped by it
 * @param category  plaintext filter tag
 * @param favorite  plaintext user flag
 * @param sealed    ciphertext, iv and tag, always replaced together
 * @param createdAt creation instant
 * @param updatedAt last ciphertext replacement
 */
public record VaultEntry(String id,
                         String ownerId,
                         String category,
                         boolean favorite,
                         SealedPayload sealed,
                         Instant createdAt,
                         Instant updatedAt) {

  /**
   * Copy with a new ciphertext and cleartext metadata, keeping identity and creation time.
   *
   * @param category  the category
   * @param favorite  the favorite flag
   * @param sealed    the new sealed payload
   * @param updatedAt the update instant
   * @return the replacement entry
   */
  public VaultEntry replace(String category, boolean favorite, SealedPayload sealed, Instant updatedAt) {
    return new VaultEntry(id, ownerId, category, favorite, sealed, createdAt, updatedAt);
  }

  /**
   * Copy with a new ciphertext under the same metadata.
   *
   * @param sealed    the sealed
   * @param updatedAt the updated at
   * @return the vault entry
   */
  public VaultEntry reseal(SealedPayload sealed, Instant updatedAt) {
    return replace(category, favorite, sealed, updatedAt);
  }
}
