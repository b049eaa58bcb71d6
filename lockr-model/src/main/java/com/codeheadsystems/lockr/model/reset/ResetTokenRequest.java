package com.codeheadsystems.lockr.model.reset;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ask for a vault reset link. The caller must acknowledge that a reset destroys all vault data.
 * <p>
 * Used by: {@code POST /vault-reset/request}
 *
 * @param email     account email address
 * @param confirmed must be true
 */
public record ResetTokenRequest(@JsonProperty("email") String email,
                                @JsonProperty("confirmed") boolean confirmed) {
}
