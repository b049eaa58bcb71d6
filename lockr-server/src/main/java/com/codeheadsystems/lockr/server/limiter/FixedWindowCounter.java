package com.codeheadsystems.lockr.server.limiter;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Keyed fixed-window attempt counter backed by one Bucket4j token bucket per key.
 * <p>
 * Each bucket holds {@code maxAttempts} tokens and refills all of them once per window
 * ({@link Refill#intervally}). An attempt consumes a token; a key is blocked while its bucket is
 * empty. A bucket that has refilled completely is replaced on the next attempt, so the window always
 * starts with the first counted attempt. Nothing but window expiry or {@link #clear} gives tokens
 * back.
 */
public class FixedWindowCounter {

  private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
  private final TimeMeter timeMeter;
  private final int maxAttempts;
  private final Duration window;

  /**
   * Instantiates a new fixed window counter.
   *
   * @param clock       the clock
   * @param maxAttempts attempts allowed per window
   * @param window      window length
   */
  public FixedWindowCounter(Clock clock, int maxAttempts, Duration window) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.timeMeter = new ClockTimeMeter(clock);
    this.maxAttempts = maxAttempts;
    this.window = window;
  }

  /**
   * Is the key at its maximum within the current window.
   *
   * @param key the key
   * @return true if blocked
   */
  public boolean isBlocked(String key) {
    Bucket bucket = buckets.get(key);
    return bucket != null && bucket.getAvailableTokens() == 0;
  }

  /**
   * Counts one attempt, starting a new window if there is none or the old one has elapsed.
   *
   * @param key the key
   * @return the count in the current window after this attempt
   */
  public int record(String key) {
    ConsumptionProbe consumption = consume(key);
    return maxAttempts - (int) consumption.getRemainingTokens();
  }

  /**
   * Counts one attempt unless the key is already blocked. Check and count are a single atomic step.
   *
   * @param key the key
   * @return true if the attempt was allowed and counted
   */
  public boolean tryAcquire(String key) {
    return consume(key).isConsumed();
  }

  /**
   * Count in the current window, zero if none.
   *
   * @param key the key
   * @return the count
   */
  public int count(String key) {
    Bucket bucket = buckets.get(key);
    return bucket == null ? 0 : maxAttempts - (int) bucket.getAvailableTokens();
  }

  /**
   * Time until the key may attempt again.
   *
   * @param key the key
   * @return remaining wait, zero if the key is not blocked
   */
  public Duration retryAfter(String key) {
    Bucket bucket = buckets.get(key);
    if (bucket == null) {
      return Duration.ZERO;
    }
    return Duration.ofNanos(bucket.estimateAbilityToConsume(1).getNanosToWaitForRefill());
  }

  /**
   * Administrative clear.
   *
   * @param key the key
   */
  public void clear(String key) {
    buckets.remove(key);
  }

  /**
   * Clears every key matching the predicate.
   *
   * @param keyFilter the filter
   */
  public void clearMatching(Predicate<String> keyFilter) {
    buckets.keySet().removeIf(keyFilter);
  }

  /**
   * Drops buckets whose window has elapsed.
   *
   * @return number dropped
   */
  public int purgeExpired() {
    int before = buckets.size();
    buckets.values().removeIf(this::isRefilled);
    return Math.max(before - buckets.size(), 0);
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  private ConsumptionProbe consume(String key) {
    AtomicReference<ConsumptionProbe> consumption = new AtomicReference<>();
    buckets.compute(key, (k, existing) -> {
      Bucket bucket = existing == null || isRefilled(existing) ? newBucket() : existing;
      consumption.set(bucket.tryConsumeAndReturnRemaining(1));
      return bucket;
    });
    return consumption.get();
  }

  private boolean isRefilled(Bucket bucket) {
    return bucket.getAvailableTokens() >= maxAttempts;
  }

  private Bucket newBucket() {
    Bandwidth limit = Bandwidth.classic(maxAttempts, Refill.intervally(maxAttempts, window));
    return Bucket.builder()
        .addLimit(limit)
        .withCustomTimePrecision(timeMeter)
        .build();
  }

  /**
   * Drives bucket refill from the injected clock.
   */
  private static final class ClockTimeMeter implements TimeMeter {

    private final Clock clock;

    private ClockTimeMeter(Clock clock) {
      this.clock = clock;
    }

    @Override
    public long currentTimeNanos() {
      Instant now = clock.instant();
      return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }

    @Override
    public boolean isWallClockBased() {
      return true;
    }
  }
}
