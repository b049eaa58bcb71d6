package com.codeheadsystems.lockr.server.error;

import java.time.Duration;

/**
 * {@link VaultErrorCode#RATE_LIMITED} with the time remaining until the window rolls over.
 */
public class RateLimitedException extends VaultException {

  private final Duration retryAfter;

  /**
   * Instantiates a new rate limited exception.
   *
   * @param message    the message
   * @param retryAfter time until the caller may retry
   */
  public RateLimitedException(String message, Duration retryAfter) {
    super(VaultErrorCode.RATE_LIMITED, message);
    this.retryAfter = retryAfter;
  }

  public Duration retryAfter() {
    return retryAfter;
  }

  /**
   * Retry-after rounded up to whole seconds, never less than one.
   *
   * @return seconds
   */
  public long retryAfterSeconds() {
    long seconds = retryAfter.toSeconds();
    if (retryAfter.toNanos() > seconds * 1_000_000_000L) {
      seconds++;
    }
    return Math.max(1, seconds);
  }
}
