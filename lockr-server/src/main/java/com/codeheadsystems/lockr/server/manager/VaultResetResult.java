package com.codeheadsystems.lockr.server.manager;

import java.time.Instant;

/**
 * What a completed vault reset destroyed.
 *
 * @param userId           whose vault was reset
 * @param entriesDestroyed entries deleted
 * @param entriesRemaining entries found after the delete, excluding a freshly sealed key-check entry;
 *                         {@link #UNKNOWN_REMAINING} when the recount failed
 * @param complete         true when nothing remained
 * @param completedAt      completion instant
 */
public record VaultResetResult(String userId,
                               int entriesDestroyed,
                               int entriesRemaining,
                               boolean complete,
                               Instant completedAt) {

  /**
   * Reported as {@code entriesRemaining} when the post-delete recount could not be taken.
   */
  public static final int UNKNOWN_REMAINING = -1;
}
