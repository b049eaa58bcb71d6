package com.codeheadsystems.lockr.model.reset;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identical for known and unknown addresses.
 *
 * @param message generic acknowledgement
 */
public record ResetTokenResponse(@JsonProperty("message") String message) {
}
