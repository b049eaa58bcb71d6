package com.codeheadsystems.lockr.server.manager;

import java.util.List;

/**
 * What a key rotation did, entry by entry.
 *
 * @param rotatedIds entries now sealed under the new key
 * @param skippedIds entries left as they were (undecryptable under the current key, or deleted
 *                   while the rotation ran)
 * @param outcome    summary of the two lists
 */
public record KeyRotationResult(List<String> rotatedIds, List<String> skippedIds, Outcome outcome) {

  public KeyRotationResult {
    rotatedIds = List.copyOf(rotatedIds);
    skippedIds = List.copyOf(skippedIds);
  }

  /**
   * Builds a result, deriving the outcome from the two lists.
   *
   * @param rotatedIds the rotated ids
   * @param skippedIds the skipped ids
   * @return the result
   */
  public static KeyRotationResult of(List<String> rotatedIds, List<String> skippedIds) {
    Outcome outcome;
    if (rotatedIds.isEmpty() && skippedIds.isEmpty()) {
      outcome = Outcome.EMPTY;
    } else if (rotatedIds.isEmpty()) {
      outcome = Outcome.INEFFECTIVE;
    } else if (skippedIds.isEmpty()) {
      outcome = Outcome.ROTATED;
    } else {
      outcome = Outcome.PARTIAL;
    }
    return new KeyRotationResult(rotatedIds, skippedIds, outcome);
  }

  public int rotated() {
    return rotatedIds.size();
  }

  public int skipped() {
    return skippedIds.size();
  }

  /**
   * Rotation outcome.
   */
  public enum Outcome {
    /** Every entry moved to the new key. */
    ROTATED,
    /** Some entries moved; the skipped ones still need the old key. */
    PARTIAL,
    /** The vault had no entries. */
    EMPTY,
    /** Entries existed but none could be moved. The session keeps the old key. */
    INEFFECTIVE
  }
}
