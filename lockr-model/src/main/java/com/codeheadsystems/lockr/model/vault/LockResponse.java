package com.codeheadsystems.lockr.model.vault;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of {@code POST /vault/lock}.
 *
 * @param locked always true; lock is idempotent
 */
public record LockResponse(@JsonProperty("locked") boolean locked) {
}
