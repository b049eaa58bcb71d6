package com.codeheadsystems.lockr.server.store;

import com.codeheadsystems.lockr.crypto.VaultKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionRegistry} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Stored keys are zeroed when their session is replaced, cleared or found expired. Callers always
 * receive copies.
 */
public class InMemorySessionRegistry implements SessionRegistry {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionRegistry.class);

  private final ConcurrentHashMap<String, UnlockSession> sessions = new ConcurrentHashMap<>();
  private final Clock clock;
  private final Duration ttl;

  /**
   * Instantiates a new in-memory session registry.
   *
   * @param clock the clock
   * @param ttl   session lifetime
   */
  public InMemorySessionRegistry(Clock clock, Duration ttl) {
    this.clock = clock;
    this.ttl = ttl;
  }

  @Override
  public UnlockSession createSession(String userId, VaultKey key) {
    Instant now = clock.instant();
    UnlockSession session = new UnlockSession(userId, key.copy(), now, now.plus(ttl));
    UnlockSession previous = sessions.put(userId, session);
    if (previous != null) {
      previous.encryptionKey().destroy();
    }
    log.debug("createSession(userId={}) expiresAt={}", userId, session.expiresAt());
    return new UnlockSession(userId, key.copy(), session.createdAt(), session.expiresAt());
  }

  @Override
  public Optional<UnlockSession> getSession(String userId) {
    return live(userId).flatMap(s -> copyKey(s.encryptionKey())
        .map(key -> new UnlockSession(s.userId(), key, s.createdAt(), s.expiresAt())));
  }

  @Override
  public Optional<VaultKey> getEncryptionKey(String userId) {
    return live(userId).flatMap(s -> copyKey(s.encryptionKey()));
  }

  @Override
  public void clearSession(String userId) {
    UnlockSession removed = sessions.remove(userId);
    if (removed != null) {
      removed.encryptionKey().destroy();
      log.debug("clearSession(userId={})", userId);
    }
  }

  @Override
  public int purgeExpired() {
    Instant now = clock.instant();
    AtomicInteger purged = new AtomicInteger();
    sessions.forEach((userId, session) -> {
      if (session.isExpired(now) && sessions.remove(userId, session)) {
        session.encryptionKey().destroy();
        purged.incrementAndGet();
      }
    });
    return purged.get();
  }

  private Optional<UnlockSession> live(String userId) {
    UnlockSession session = sessions.get(userId);
    if (session == null) {
      return Optional.empty();
    }
    if (session.isExpired(clock.instant())) {
      // Only remove this exact session; a fresh unlock may have replaced it meanwhile.
      if (sessions.remove(userId, session)) {
        session.encryptionKey().destroy();
        log.debug("Session for userId={} expired", userId);
      }
      return Optional.empty();
    }
    return Optional.of(session);
  }

  private static Optional<VaultKey> copyKey(VaultKey key) {
    try {
      return Optional.of(key.copy());
    } catch (IllegalStateException e) {
      // Lost a race with clearSession; the session is gone.
      return Optional.empty();
    }
  }
}
