package com.codeheadsystems.lockr.model.reset;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a completed reset.
 *
 * @param entriesDestroyed number of entries deleted
 * @param entriesRemaining entries still present after the delete; non-zero means the reset raced
 *                         a concurrent write and should be retried by support; -1 when the
 *                         recount failed
 * @param complete         true when the vault is verifiably empty (apart from a fresh key-check entry)
 * @param completedAt      ISO-8601 completion instant
 */
public record VaultResetResponse(@JsonProperty("entriesDestroyed") int entriesDestroyed,
                                 @JsonProperty("entriesRemaining") int entriesRemaining,
                                 @JsonProperty("complete") boolean complete,
                                 @JsonProperty("completedAt") String completedAt) {
}
