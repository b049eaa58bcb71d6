package com.codeheadsystems.lockr.server.limiter;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Failed-unlock limiter with two layers: per user, and optionally per user and client address.
 * <p>
 * An unlock is blocked if either layer is at its maximum. Successful unlocks never touch the
 * counters, so a correct guess after many failures does not reset the lockout.
 */
public class UnlockAttemptLimiter {

  private static final Logger log = LoggerFactory.getLogger(UnlockAttemptLimiter.class);

  private final FixedWindowCounter perUser;
  private final FixedWindowCounter perAddress;

  /**
   * Instantiates a new unlock attempt limiter.
   *
   * @param clock              the clock
   * @param maxPerUser         failures per user per window
   * @param maxPerUserAddress  failures per user and address per window; 0 disables the layer
   * @param window             window length
   */
  public UnlockAttemptLimiter(Clock clock, int maxPerUser, int maxPerUserAddress, Duration window) {
    this.perUser = new FixedWindowCounter(clock, maxPerUser, window);
    this.perAddress = maxPerUserAddress > 0
        ? new FixedWindowCounter(clock, maxPerUserAddress, window)
        : null;
    log.info("UnlockAttemptLimiter(maxPerUser={}, maxPerUserAddress={}, window={})",
        maxPerUser, maxPerUserAddress, window);
  }

  /**
   * If blocked, how long until the blocking window rolls over.
   *
   * @param userId  the user id
   * @param address client address, may be null
   * @return the retry-after duration when blocked, empty otherwise
   */
  public Optional<Duration> blockedFor(String userId, String address) {
    Duration wait = Duration.ZERO;
    boolean blocked = false;
    if (perUser.isBlocked(userId)) {
      blocked = true;
      wait = perUser.retryAfter(userId);
    }
    String addressKey = addressKey(userId, address);
    if (addressKey != null && perAddress.isBlocked(addressKey)) {
      blocked = true;
      Duration addressWait = perAddress.retryAfter(addressKey);
      if (addressWait.compareTo(wait) > 0) {
        wait = addressWait;
      }
    }
    return blocked ? Optional.of(wait) : Optional.empty();
  }

  /**
   * Counts a failed unlock in every enabled layer.
   *
   * @param userId  the user id
   * @param address client address, may be null
   * @return failures for this user in the current window
   */
  public int recordFailure(String userId, String address) {
    int count = perUser.record(userId);
    String addressKey = addressKey(userId, address);
    if (addressKey != null) {
      perAddress.record(addressKey);
    }
    return count;
  }

  /**
   * Failures counted for the user in the current window.
   *
   * @param userId the user id
   * @return the count
   */
  public int failures(String userId) {
    return perUser.count(userId);
  }

  /**
   * Administrative clear of every counter belonging to the user.
   *
   * @param userId the user id
   */
  public void clear(String userId) {
    perUser.clear(userId);
    if (perAddress != null) {
      String prefix = userId + "@";
      perAddress.clearMatching(k -> k.startsWith(prefix));
    }
    log.debug("clear(userId={})", userId);
  }

  /**
   * Drops elapsed windows from both layers.
   *
   * @return number dropped
   */
  public int purgeExpired() {
    return perUser.purgeExpired() + (perAddress == null ? 0 : perAddress.purgeExpired());
  }

  private String addressKey(String userId, String address) {
    if (perAddress == null || address == null || address.isBlank()) {
      return null;
    }
    return userId + "@" + address;
  }
}
