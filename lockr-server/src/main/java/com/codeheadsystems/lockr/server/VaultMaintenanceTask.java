package com.codeheadsystems.lockr.server;

import com.codeheadsystems.lockr.server.limiter.UnlockAttemptLimiter;
import com.codeheadsystems.lockr.server.manager.VaultResetManager;
import com.codeheadsystems.lockr.server.store.SessionRegistry;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic sweep of expired sessions, limiter windows and reset tokens.
 * <p>
 * Expiry is always enforced at access time; this only keeps memory bounded.
 */
public class VaultMaintenanceTask {

  private static final Logger log = LoggerFactory.getLogger(VaultMaintenanceTask.class);

  private final SessionRegistry sessionRegistry;
  private final UnlockAttemptLimiter attemptLimiter;
  private final VaultResetManager resetManager;
  private final Duration interval;
  private ScheduledExecutorService reaper;

  public VaultMaintenanceTask(SessionRegistry sessionRegistry,
                              UnlockAttemptLimiter attemptLimiter,
                              VaultResetManager resetManager,
                              Duration interval) {
    this.sessionRegistry = sessionRegistry;
    this.attemptLimiter = attemptLimiter;
    this.resetManager = resetManager;
    this.interval = interval;
  }

  /**
   * Starts the daemon sweeper thread. Calling it twice is a no-op.
   */
  public synchronized void start() {
    if (reaper != null) {
      return;
    }
    reaper = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "vault-maintenance");
      t.setDaemon(true);
      return t;
    });
    long millis = interval.toMillis();
    reaper.scheduleAtFixedRate(this::runSafely, millis, millis, TimeUnit.MILLISECONDS);
    log.info("VaultMaintenanceTask started (interval={})", interval);
  }

  /**
   * Stops the sweeper thread.
   */
  public synchronized void stop() {
    if (reaper != null) {
      reaper.shutdownNow();
      reaper = null;
      log.info("VaultMaintenanceTask stopped");
    }
  }

  /**
   * One sweep.
   *
   * @return total items purged
   */
  public int runOnce() {
    int sessions = sessionRegistry.purgeExpired();
    int windows = attemptLimiter.purgeExpired();
    int tokens = resetManager.purgeExpiredTokens();
    log.debug("Maintenance sweep: sessions={}, limiterWindows={}, resetTokens={}", sessions, windows, tokens);
    return sessions + windows + tokens;
  }

  private void runSafely() {
    try {
      runOnce();
    } catch (RuntimeException e) {
      // A thrown exception would cancel every future run.
      log.error("Maintenance sweep failed", e);
    }
  }
}
