package com.codeheadsystems.lockr.dropwizard;

import com.codeheadsystems.lockr.server.VaultPolicy;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;

/**
 * Dropwizard configuration for the lockr vault.
 * <p>
 * The policy fields map onto {@link VaultPolicy}; their defaults match {@link VaultPolicy#defaults()}.
 * For production supply {@code jwtSecretHex} (generate with {@code openssl rand -hex 32}) so that
 * bearer tokens survive restarts.
 */
public class LockrConfiguration extends Configuration {
  /**
   * Vault cipher suite. Valid values: {@code AES_256_GCM} (default), {@code AES_128_GCM}.
   * Determines the length of every key a client submits.
   */
  @NotEmpty
  private String cipherSuite = "AES_256_GCM";

  /**
   * Hex-encoded HMAC-SHA256 signing secret for bearer tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * Bearer token time-to-live in seconds.
   */
  @Min(1)
  private long jwtTtlSeconds = 3600;

  /**
   * JWT issuer claim.
   */
  @NotEmpty
  private String jwtIssuer = "lockr";

  /**
   * Lifetime of an unlock session in minutes.
   */
  @Min(1)
  private long sessionTtlMinutes = 30;

  /**
   * Failed unlocks allowed per user within the unlock window.
   */
  @Min(1)
  private int maxUnlockFailures = 5;

  /**
   * Failed unlocks allowed per user and client address. 0 disables this layer.
   */
  @Min(0)
  private int maxUnlockFailuresPerAddress = 0;

  /**
   * Fixed window for counting failed unlocks, in minutes.
   */
  @Min(1)
  private long unlockWindowMinutes = 15;

  /**
   * Lifetime of a vault reset token in minutes.
   */
  @Min(1)
  private long resetTokenTtlMinutes = 15;

  /**
   * Reset requests allowed per client address within the reset request window.
   */
  @Min(1)
  private int maxResetRequestsPerAddress = 5;

  /**
   * Reset tokens issued per user within the reset request window.
   */
  @Min(1)
  private int maxResetRequestsPerUser = 3;

  /**
   * Fixed window for counting reset requests, in minutes.
   */
  @Min(1)
  private long resetRequestWindowMinutes = 60;

  /**
   * How often expired sessions, limiter windows and reset tokens are purged.
   */
  @Min(1)
  private long sweepIntervalSeconds = 60;

  /**
   * When true, unlocking an empty vault seals a hidden key-check entry so that later
   * unlocks of the still-empty vault are verified against it.
   */
  private boolean sealKeyCheckOnFirstUnlock = false;

  /**
   * Gets cipher suite.
   *
   * @return the cipher suite
   */
  @JsonProperty
  public String getCipherSuite() {
    return cipherSuite;
  }

  /**
   * Sets cipher suite.
   *
   * @param cipherSuite the cipher suite
   */
  @JsonProperty
  public void setCipherSuite(String cipherSuite) {
    this.cipherSuite = cipherSuite;
  }

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  /**
   * Gets jwt ttl seconds.
   *
   * @return the jwt ttl seconds
   */
  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  /**
   * Sets jwt ttl seconds.
   *
   * @param jwtTtlSeconds the jwt ttl seconds
   */
  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets session ttl minutes.
   *
   * @return the session ttl minutes
   */
  @JsonProperty
  public long getSessionTtlMinutes() {
    return sessionTtlMinutes;
  }

  /**
   * Sets session ttl minutes.
   *
   * @param sessionTtlMinutes the session ttl minutes
   */
  @JsonProperty
  public void setSessionTtlMinutes(long sessionTtlMinutes) {
    this.sessionTtlMinutes = sessionTtlMinutes;
  }

  /**
   * Gets max unlock failures.
   *
   * @return the max unlock failures
   */
  @JsonProperty
  public int getMaxUnlockFailures() {
    return maxUnlockFailures;
  }

  /**
   * Sets max unlock failures.
   *
   * @param maxUnlockFailures the max unlock failures
   */
  @JsonProperty
  public void setMaxUnlockFailures(int maxUnlockFailures) {
    this.maxUnlockFailures = maxUnlockFailures;
  }

  /**
   * Gets max unlock failures per address.
   *
   * @return the max unlock failures per address
   */
  @JsonProperty
  public int getMaxUnlockFailuresPerAddress() {
    return maxUnlockFailuresPerAddress;
  }

  /**
   * Sets max unlock failures per address.
   *
   * @param maxUnlockFailuresPerAddress the max unlock failures per address
   */
  @JsonProperty
  public void setMaxUnlockFailuresPerAddress(int maxUnlockFailuresPerAddress) {
    this.maxUnlockFailuresPerAddress = maxUnlockFailuresPerAddress;
  }

  /**
   * Gets unlock window minutes.
   *
   * @return the unlock window minutes
   */
  @JsonProperty
  public long getUnlockWindowMinutes() {
    return unlockWindowMinutes;
  }

  /**
   * Sets unlock window minutes.
   *
   * @param unlockWindowMinutes the unlock window minutes
   */
  @JsonProperty
  public void setUnlockWindowMinutes(long unlockWindowMinutes) {
    this.unlockWindowMinutes = unlockWindowMinutes;
  }

  /**
   * Gets reset token ttl minutes.
   *
   * @return the reset token ttl minutes
   */
  @JsonProperty
  public long getResetTokenTtlMinutes() {
    return resetTokenTtlMinutes;
  }

  /**
   * Sets reset token ttl minutes.
   *
   * @param resetTokenTtlMinutes the reset token ttl minutes
   */
  @JsonProperty
  public void setResetTokenTtlMinutes(long resetTokenTtlMinutes) {
    this.resetTokenTtlMinutes = resetTokenTtlMinutes;
  }

  /**
   * Gets max reset requests per address.
   *
   * @return the max reset requests per address
   */
  @JsonProperty
  public int getMaxResetRequestsPerAddress() {
    return maxResetRequestsPerAddress;
  }

  /**
   * Sets max reset requests per address.
   *
   * @param maxResetRequestsPerAddress the max reset requests per address
   */
  @JsonProperty
  public void setMaxResetRequestsPerAddress(int maxResetRequestsPerAddress) {
    this.maxResetRequestsPerAddress = maxResetRequestsPerAddress;
  }

  /**
   * Gets max reset requests per user.
   *
   * @return the max reset requests per user
   */
  @JsonProperty
  public int getMaxResetRequestsPerUser() {
    return maxResetRequestsPerUser;
  }

  /**
   * Sets max reset requests per user.
   *
   * @param maxResetRequestsPerUser the max reset requests per user
   */
  @JsonProperty
  public void setMaxResetRequestsPerUser(int maxResetRequestsPerUser) {
    this.maxResetRequestsPerUser = maxResetRequestsPerUser;
  }

  /**
   * Gets reset request window minutes.
   *
   * @return the reset request window minutes
   */
  @JsonProperty
  public long getResetRequestWindowMinutes() {
    return resetRequestWindowMinutes;
  }

  /**
   * Sets reset request window minutes.
   *
   * @param resetRequestWindowMinutes the reset request window minutes
   */
  @JsonProperty
  public void setResetRequestWindowMinutes(long resetRequestWindowMinutes) {
    this.resetRequestWindowMinutes = resetRequestWindowMinutes;
  }

  /**
   * Gets sweep interval seconds.
   *
   * @return the sweep interval seconds
   */
  @JsonProperty
  public long getSweepIntervalSeconds() {
    return sweepIntervalSeconds;
  }

  /**
   * Sets sweep interval seconds.
   *
   * @param sweepIntervalSeconds the sweep interval seconds
   */
  @JsonProperty
  public void setSweepIntervalSeconds(long sweepIntervalSeconds) {
    this.sweepIntervalSeconds = sweepIntervalSeconds;
  }

  /**
   * Gets seal key check on first unlock.
   *
   * @return the seal key check on first unlock
   */
  @JsonProperty
  public boolean isSealKeyCheckOnFirstUnlock() {
    return sealKeyCheckOnFirstUnlock;
  }

  /**
   * Sets seal key check on first unlock.
   *
   * @param sealKeyCheckOnFirstUnlock the seal key check on first unlock
   */
  @JsonProperty
  public void setSealKeyCheckOnFirstUnlock(boolean sealKeyCheckOnFirstUnlock) {
    this.sealKeyCheckOnFirstUnlock = sealKeyCheckOnFirstUnlock;
  }

  /**
   * Builds the core vault policy from the configured values.
   *
   * @return the vault policy
   */
  public VaultPolicy toVaultPolicy() {
    return new VaultPolicy(
        Duration.ofMinutes(sessionTtlMinutes),
        maxUnlockFailures,
        maxUnlockFailuresPerAddress,
        Duration.ofMinutes(unlockWindowMinutes),
        Duration.ofMinutes(resetTokenTtlMinutes),
        maxResetRequestsPerAddress,
        maxResetRequestsPerUser,
        Duration.ofMinutes(resetRequestWindowMinutes),
        Duration.ofSeconds(sweepIntervalSeconds),
        sealKeyCheckOnFirstUnlock);
  }
}
