package com.codeheadsystems.lockr.server.manager;

import com.codeheadsystems.lockr.model.vault.VaultEntryPayload;
import java.time.Instant;

/**
 * A vault entry opened with the session key.
 *
 * @param id        the id
 * @param category  the category
 * @param favorite  the favorite flag
 * @param payload   decrypted fields
 * @param createdAt the created at
 * @param updatedAt the updated at
 */
public record DecryptedEntry(String id, String category, boolean favorite, VaultEntryPayload payload,
                             Instant createdAt, Instant updatedAt) {
}
