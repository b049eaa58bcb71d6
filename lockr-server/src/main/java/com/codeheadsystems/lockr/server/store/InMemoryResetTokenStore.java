package com.codeheadsystems.lockr.server.store;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link ResetTokenStore}.
 */
public class InMemoryResetTokenStore implements ResetTokenStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryResetTokenStore.class);

  private final ConcurrentHashMap<String, ResetToken> tokens = new ConcurrentHashMap<>();

  @Override
  public void store(ResetToken token) {
    tokens.put(token.tokenHash(), token);
  }

  @Override
  public Optional<ResetToken> findUsable(String tokenHash, Instant now) {
    ResetToken token = tokens.get(tokenHash);
    return token != null && token.isUsable(now) ? Optional.of(token) : Optional.empty();
  }

  @Override
  public Optional<ResetToken> claim(String tokenHash, Instant now) {
    AtomicReference<ResetToken> claimed = new AtomicReference<>();
    tokens.computeIfPresent(tokenHash, (k, token) -> {
      if (!token.isUsable(now)) {
        return token;
      }
      ResetToken used = token.markUsed(now);
      claimed.set(used);
      return used;
    });
    return Optional.ofNullable(claimed.get());
  }

  @Override
  public int purgeExpired(Instant now) {
    int before = tokens.size();
    tokens.values().removeIf(t -> !now.isBefore(t.expiresAt()));
    int purged = before - tokens.size();
    if (purged > 0) {
      log.debug("Purged {} expired reset token(s)", purged);
    }
    return Math.max(purged, 0);
  }
}
