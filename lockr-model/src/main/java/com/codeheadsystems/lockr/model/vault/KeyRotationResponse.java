package com.codeheadsystems.lockr.model.vault;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Outcome of a key rotation.
 * <p>
 * {@code outcome} is one of {@code ROTATED} (every entry moved), {@code PARTIAL} (some entries
 * could not be decrypted and still need the old key), or {@code EMPTY} (nothing to rotate).
 * Skipped entries are reported by id so the client can warn the user about them.
 *
 * @param outcome    rotation outcome
 * @param rotated    number of entries now sealed under the new key
 * @param skipped    number of entries left untouched
 * @param rotatedIds ids of rotated entries
 * @param skippedIds ids of skipped entries
 */
public record KeyRotationResponse(@JsonProperty("outcome") String outcome,
                                  @JsonProperty("rotated") int rotated,
                                  @JsonProperty("skipped") int skipped,
                                  @JsonProperty("rotatedIds") List<String> rotatedIds,
                                  @JsonProperty("skippedIds") List<String> skippedIds) {
}
