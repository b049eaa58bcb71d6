package com.codeheadsystems.lockr.model.vault;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Create or replace a vault entry.
 * <p>
 * Used by: {@code POST /vault/entries}, {@code PUT /vault/entries/{id}}
 *
 * @param category plaintext grouping label, e.g. {@code "login"}; stored unencrypted
 * @param favorite plaintext favorite flag; absent means false on create and unchanged on replace
 * @param payload  secret fields, sealed under the session key before storage
 */
public record EntryRequest(@JsonProperty("category") String category,
                           @JsonProperty("favorite") Boolean favorite,
                           @JsonProperty("payload") VaultEntryPayload payload) {
}
