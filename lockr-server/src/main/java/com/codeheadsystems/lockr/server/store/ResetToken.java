package com.codeheadsystems.lockr.server.store;

import java.time.Instant;

/**
 * A vault reset token as stored: only the SHA-256 hash of the token the user received.
 *
 * @param tokenHash hex SHA-256 of the raw token
 * @param userId    the user the token may reset
 * @param createdAt issue instant
 * @param expiresAt expiry instant
 * @param usedAt    when it was redeemed, or null
 */
public record ResetToken(String tokenHash, String userId, Instant createdAt, Instant expiresAt, Instant usedAt) {

  public boolean isUsable(Instant now) {
    return usedAt == null && now.isBefore(expiresAt);
  }

  public ResetToken markUsed(Instant now) {
    return new ResetToken(tokenHash, userId, createdAt, expiresAt, now);
  }

  @Override
  public String toString() {
    return "ResetToken[userId=" + userId + ", expiresAt=" + expiresAt + ", used=" + (usedAt != null) + "]";
  }
}
