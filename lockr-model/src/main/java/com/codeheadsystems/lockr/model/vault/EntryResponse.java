package com.codeheadsystems.lockr.model.vault;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A decrypted vault entry.
 *
 * @param id        entry id
 * @param category  plaintext category
 * @param favorite  plaintext favorite flag
 * @param payload   decrypted secret fields
 * @param createdAt ISO-8601 creation instant
 * @param updatedAt ISO-8601 instant of the last content or key change
 */
public record EntryResponse(@JsonProperty("id") String id,
                            @JsonProperty("category") String category,
                            @JsonProperty("favorite") boolean favorite,
                            @JsonProperty("payload") VaultEntryPayload payload,
                            @JsonProperty("createdAt") String createdAt,
                            @JsonProperty("updatedAt") String updatedAt) {
}
