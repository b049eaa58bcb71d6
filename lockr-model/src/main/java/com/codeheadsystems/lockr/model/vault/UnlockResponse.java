package com.codeheadsystems.lockr.model.vault;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful unlock.
 *
 * @param unlocked  always true
 * @param expiresAt ISO-8601 instant after which the session is treated as absent
 */
public record UnlockResponse(@JsonProperty("unlocked") boolean unlocked,
                             @JsonProperty("expiresAt") String expiresAt) {
}
