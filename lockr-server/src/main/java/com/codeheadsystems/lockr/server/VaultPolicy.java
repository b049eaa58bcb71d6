package com.codeheadsystems.lockr.server;

import java.time.Duration;

/**
 * Tunables for the vault core. Use {@link #defaults()} unless you have a reason not to.
 *
 * @param sessionTtl                  lifetime of an unlock session
 * @param maxUnlockFailures           failed unlocks per user allowed within the window
 * @param maxUnlockFailuresPerAddress failed unlocks per user and client address; 0 disables this layer
 * @param unlockWindow                fixed window for unlock failure counting
 * @param resetTokenTtl               lifetime of a vault reset token
 * @param maxResetRequestsPerAddress  reset requests per client address within the reset window
 * @param maxResetRequestsPerUser     reset tokens issued per user within the reset window
 * @param resetRequestWindow          fixed window for reset request counting
 * @param sweepInterval               how often expired state is purged
 * @param sealKeyCheckOnFirstUnlock   when true, unlocking an empty vault seals a key-check entry
 *                                    so later unlocks are verified against it
 */
public record VaultPolicy(Duration sessionTtl,
                          int maxUnlockFailures,
                          int maxUnlockFailuresPerAddress,
                          Duration unlockWindow,
                          Duration resetTokenTtl,
                          int maxResetRequestsPerAddress,
                          int maxResetRequestsPerUser,
                          Duration resetRequestWindow,
                          Duration sweepInterval,
                          boolean sealKeyCheckOnFirstUnlock) {

  public VaultPolicy {
    requirePositive(sessionTtl, "sessionTtl");
    requirePositive(unlockWindow, "unlockWindow");
    requirePositive(resetTokenTtl, "resetTokenTtl");
    requirePositive(resetRequestWindow, "resetRequestWindow");
    requirePositive(sweepInterval, "sweepInterval");
    if (maxUnlockFailures < 1) {
      throw new IllegalArgumentException("maxUnlockFailures must be at least 1");
    }
    if (maxUnlockFailuresPerAddress < 0) {
      throw new IllegalArgumentException("maxUnlockFailuresPerAddress must not be negative");
    }
    if (maxResetRequestsPerAddress < 1 || maxResetRequestsPerUser < 1) {
      throw new IllegalArgumentException("reset request limits must be at least 1");
    }
  }

  /**
   * 30 minute sessions, 5 failures per 15 minutes, 15 minute reset tokens, 5 reset requests per
   * address and 3 per user each hour.
   *
   * @return the vault policy
   */
  public static VaultPolicy defaults() {
    return new VaultPolicy(
        Duration.ofMinutes(30),
        5,
        0,
        Duration.ofMinutes(15),
        Duration.ofMinutes(15),
        5,
        3,
        Duration.ofHours(1),
        Duration.ofSeconds(60),
        false);
  }

  public VaultPolicy withSealKeyCheckOnFirstUnlock(boolean seal) {
    return new VaultPolicy(sessionTtl, maxUnlockFailures, maxUnlockFailuresPerAddress, unlockWindow,
        resetTokenTtl, maxResetRequestsPerAddress, maxResetRequestsPerUser, resetRequestWindow,
        sweepInterval, seal);
  }

  public VaultPolicy withMaxUnlockFailuresPerAddress(int max) {
    return new VaultPolicy(sessionTtl, maxUnlockFailures, max, unlockWindow,
        resetTokenTtl, maxResetRequestsPerAddress, maxResetRequestsPerUser, resetRequestWindow,
        sweepInterval, sealKeyCheckOnFirstUnlock);
  }

  private static void requirePositive(Duration d, String name) {
    if (d == null || d.isZero() || d.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
