package com.codeheadsystems.lockr.server.manager;

import com.codeheadsystems.lockr.crypto.VaultCipherSuite;
import com.codeheadsystems.lockr.crypto.VaultKey;
import com.codeheadsystems.lockr.server.VaultPolicy;
import com.codeheadsystems.lockr.server.audit.SecurityAuditLog;
import com.codeheadsystems.lockr.server.delivery.ResetTokenDelivery;
import com.codeheadsystems.lockr.server.error.RateLimitedException;
import com.codeheadsystems.lockr.server.error.VaultErrorCode;
import com.codeheadsystems.lockr.server.error.VaultException;
import com.codeheadsystems.lockr.server.gate.UserVaultGates;
import com.codeheadsystems.lockr.server.limiter.FixedWindowCounter;
import com.codeheadsystems.lockr.server.limiter.UnlockAttemptLimiter;
import com.codeheadsystems.lockr.server.store.Account;
import com.codeheadsystems.lockr.server.store.AccountDirectory;
import com.codeheadsystems.lockr.server.store.EntryStore;
import com.codeheadsystems.lockr.server.store.ResetToken;
import com.codeheadsystems.lockr.server.store.ResetTokenStore;
import com.codeheadsystems.lockr.server.store.SessionRegistry;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lost-key recovery: destroys every entry in a vault after an out-of-band token exchange.
 * <p>
 * Two confirmations are needed: possession of a single-use token delivered to the account's
 * email address, and an explicit {@code confirmed} flag on both the request and the completion.
 * Nothing is ever re-encrypted; without the old key the data is gone.
 * <p>
 * Token issuance does not reveal whether an account exists. Known and unknown addresses, and
 * users who have hit their per-user limit, all get the same response after the same work.
 */
public class VaultResetManager {

  /**
   * Response to every accepted reset request, whether or not the account exists.
   */
  public static final String REQUEST_ACKNOWLEDGEMENT =
      "If an account with this email exists, you will receive a vault reset link. "
          + "WARNING: This will permanently delete all vault data.";

  /**
   * Returned when the destruction was not explicitly confirmed.
   */
  public static final String CONFIRMATION_REQUIRED =
      "Vault reset permanently deletes all vault data and cannot be undone. "
          + "Set confirmed to true to proceed.";

  private static final Logger log = LoggerFactory.getLogger(VaultResetManager.class);
  private static final int TOKEN_BYTES = 32;
  private static final Pattern TOKEN_PATTERN = Pattern.compile("^[0-9a-f]{" + (TOKEN_BYTES * 2) + "}$");
  private static final String UNKNOWN_ADDRESS = "unknown";

  private final EntryStore entryStore;
  private final SessionRegistry sessionRegistry;
  private final UnlockAttemptLimiter unlockAttemptLimiter;
  private final ResetTokenStore tokenStore;
  private final AccountDirectory accountDirectory;
  private final ResetTokenDelivery delivery;
  private final Executor deliveryExecutor;
  private final UserVaultGates gates;
  private final KeyCheckWriter keyCheckWriter;
  private final SecurityAuditLog auditLog;
  private final VaultCipherSuite suite;
  private final VaultPolicy policy;
  private final FixedWindowCounter requestsPerAddress;
  private final FixedWindowCounter requestsPerUser;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  public VaultResetManager(EntryStore entryStore,
                           SessionRegistry sessionRegistry,
                           UnlockAttemptLimiter unlockAttemptLimiter,
                           ResetTokenStore tokenStore,
                           AccountDirectory accountDirectory,
                           ResetTokenDelivery delivery,
                           Executor deliveryExecutor,
                           UserVaultGates gates,
                           KeyCheckWriter keyCheckWriter,
                           SecurityAuditLog auditLog,
                           VaultCipherSuite suite,
                           VaultPolicy policy,
                           Clock clock) {
    this.entryStore = entryStore;
    this.sessionRegistry = sessionRegistry;
    this.unlockAttemptLimiter = unlockAttemptLimiter;
    this.tokenStore = tokenStore;
    this.accountDirectory = accountDirectory;
    this.delivery = delivery;
    this.deliveryExecutor = deliveryExecutor;
    this.gates = gates;
    this.keyCheckWriter = keyCheckWriter;
    this.auditLog = auditLog;
    this.suite = suite;
    this.policy = policy;
    this.clock = clock;
    this.requestsPerAddress = new FixedWindowCounter(clock,
        policy.maxResetRequestsPerAddress(), policy.resetRequestWindow());
    this.requestsPerUser = new FixedWindowCounter(clock,
        policy.maxResetRequestsPerUser(), policy.resetRequestWindow());
  }

  // ── Token issuance ──────────────────────────────────────────────────────────

  /**
   * Issues a reset token for the account with this email, if there is one.
   *
   * @param email     account email
   * @param confirmed caller acknowledged that all vault data will be destroyed
   * @param address   client address, may be null
   * @return the acknowledgement message, identical for every accepted request
   * @throws VaultException VALIDATION_ERROR or RATE_LIMITED (per address only)
   */
  public String requestReset(String email, boolean confirmed, String address) {
    if (!confirmed) {
      throw VaultException.validation(CONFIRMATION_REQUIRED);
    }
    if (email == null || email.isBlank()) {
      throw VaultException.validation("Email is required");
    }
    String addressKey = address == null || address.isBlank() ? UNKNOWN_ADDRESS : address;
    if (!requestsPerAddress.tryAcquire(addressKey)) {
      auditLog.resetRequestRateLimited(addressKey);
      throw new RateLimitedException("Too many reset requests; try again later",
          requestsPerAddress.retryAfter(addressKey));
    }

    // Generated up front in every branch so unknown accounts cost the same.
    String token = newToken();
    String tokenHash = hash(token);
    Instant now = clock.instant();
    Instant expiresAt = now.plus(policy.resetTokenTtl());

    Optional<Account> account = accountDirectory.findByEmail(email);
    if (account.isEmpty()) {
      log.debug("requestReset: no account for that email");
      return REQUEST_ACKNOWLEDGEMENT;
    }
    Account owner = account.get();
    if (!requestsPerUser.tryAcquire(owner.userId())) {
      log.debug("requestReset: per-user limit reached for userId={}", owner.userId());
      return REQUEST_ACKNOWLEDGEMENT;
    }

    tokenStore.store(new ResetToken(tokenHash, owner.userId(), now, expiresAt, null));
    auditLog.resetTokenIssued(owner.userId(), address);
    deliveryExecutor.execute(() -> deliver(owner, token, expiresAt));
    return REQUEST_ACKNOWLEDGEMENT;
  }

  private void deliver(Account account, String token, Instant expiresAt) {
    try {
      delivery.deliver(account, token, expiresAt);
    } catch (RuntimeException e) {
      log.error("Reset token delivery failed for userId={}", account.userId(), e);
    }
  }

  // ── Completion ──────────────────────────────────────────────────────────────

  /**
   * Redeems a token and destroys the vault.
   * <p>
   * The token is claimed before anything is deleted, so it can authorize at most one reset; a
   * second call with the same token fails with INVALID_TOKEN and deletes nothing.
   *
   * @param token         raw hex token
   * @param confirmed     caller acknowledged the destruction
   * @param encodedNewKey optional base64 key to seal a key-check entry under
   * @param address       client address, may be null
   * @return the blast radius
   * @throws VaultException VALIDATION_ERROR, INVALID_TOKEN, NOT_FOUND, VAULT_BUSY or FATAL
   */
  public VaultResetResult completeReset(String token, boolean confirmed, String encodedNewKey, String address) {
    if (!confirmed) {
      throw VaultException.validation(CONFIRMATION_REQUIRED);
    }
    if (token == null || !TOKEN_PATTERN.matcher(token).matches()) {
      throw invalidToken();
    }
    VaultKey newKey = encodedNewKey == null || encodedNewKey.isBlank()
        ? null
        : KeyParsing.parse(encodedNewKey, suite, "New key");
    try {
      String tokenHash = hash(token);
      ResetToken pending = tokenStore.findUsable(tokenHash, clock.instant()).orElseThrow(this::invalidToken);
      String userId = pending.userId();
      if (accountDirectory.findById(userId).isEmpty()) {
        throw VaultException.notFound("User not found");
      }

      try (UserVaultGates.Exclusive exclusive = gates.beginExclusive(userId)) {
        ResetToken claimed = tokenStore.claim(tokenHash, clock.instant()).orElseThrow(this::invalidToken);
        log.debug("completeReset: token claimed for userId={}", claimed.userId());

        exclusive.commitAndRun(() -> sessionRegistry.clearSession(userId));
        int destroyed;
        try {
          destroyed = entryStore.deleteAllByOwner(userId);
        } catch (RuntimeException e) {
          throw VaultException.fatal("Vault deletion failed", e);
        }
        unlockAttemptLimiter.clear(userId);

        int remaining;
        try {
          remaining = entryStore.countByOwner(userId);
        } catch (RuntimeException e) {
          log.error("Vault reset for userId={} destroyed {} entries but the recount failed", userId, destroyed, e);
          remaining = VaultResetResult.UNKNOWN_REMAINING;
        }

        boolean complete = remaining == 0;
        Instant completedAt = clock.instant();
        auditLog.vaultReset(userId, destroyed, remaining, address);
        if (remaining > 0) {
          log.error("Vault reset for userId={} left {} entries behind", userId, remaining);
        } else if (complete && newKey != null) {
          try {
            keyCheckWriter.seal(userId, newKey);
          } catch (RuntimeException e) {
            throw VaultException.fatal("Vault was reset but the key-check entry could not be written", e);
          }
        }
        return new VaultResetResult(userId, destroyed, remaining, complete, completedAt);
      }
    } finally {
      if (newKey != null) {
        newKey.destroy();
      }
    }
  }

  // ── Housekeeping ────────────────────────────────────────────────────────────

  /**
   * Removes expired reset tokens and elapsed request windows.
   *
   * @return number of tokens removed
   */
  public int purgeExpiredTokens() {
    requestsPerAddress.purgeExpired();
    requestsPerUser.purgeExpired();
    return tokenStore.purgeExpired(clock.instant());
  }

  private VaultException invalidToken() {
    return new VaultException(VaultErrorCode.INVALID_TOKEN, "Reset token is invalid, expired or already used");
  }

  private String newToken() {
    byte[] bytes = new byte[TOKEN_BYTES];
    random.nextBytes(bytes);
    return Hex.toHexString(bytes);
  }

  static String hash(String token) {
    byte[] input = token.getBytes(StandardCharsets.US_ASCII);
    SHA256Digest digest = new SHA256Digest();
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return Hex.toHexString(out);
  }
}
