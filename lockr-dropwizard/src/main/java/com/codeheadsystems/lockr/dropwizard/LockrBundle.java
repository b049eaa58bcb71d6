package com.codeheadsystems.lockr.dropwizard;

import com.codeheadsystems.lockr.crypto.AesGcmCipherEngine;
import com.codeheadsystems.lockr.crypto.CipherEngine;
import com.codeheadsystems.lockr.crypto.VaultCipherSuite;
import com.codeheadsystems.lockr.dropwizard.auth.VaultAuthenticator;
import com.codeheadsystems.lockr.dropwizard.auth.VaultPrincipal;
import com.codeheadsystems.lockr.dropwizard.health.CipherEngineHealthCheck;
import com.codeheadsystems.lockr.server.VaultMaintenanceTask;
import com.codeheadsystems.lockr.server.VaultPolicy;
import com.codeheadsystems.lockr.server.audit.SecurityAuditLog;
import com.codeheadsystems.lockr.server.audit.Slf4jSecurityAuditLog;
import com.codeheadsystems.lockr.server.auth.AccessTokenManager;
import com.codeheadsystems.lockr.server.delivery.LoggingResetTokenDelivery;
import com.codeheadsystems.lockr.server.delivery.ResetTokenDelivery;
import com.codeheadsystems.lockr.server.gate.UserVaultGates;
import com.codeheadsystems.lockr.server.limiter.UnlockAttemptLimiter;
import com.codeheadsystems.lockr.server.manager.KeyCheckWriter;
import com.codeheadsystems.lockr.server.manager.KeyRotationManager;
import com.codeheadsystems.lockr.server.manager.PasswordGenerator;
import com.codeheadsystems.lockr.server.manager.VaultEntryCodec;
import com.codeheadsystems.lockr.server.manager.VaultEntryManager;
import com.codeheadsystems.lockr.server.manager.VaultResetManager;
import com.codeheadsystems.lockr.server.manager.VaultUnlockManager;
import com.codeheadsystems.lockr.server.resource.VaultExceptionMapper;
import com.codeheadsystems.lockr.server.resource.VaultResetResource;
import com.codeheadsystems.lockr.server.resource.VaultResource;
import com.codeheadsystems.lockr.server.store.AccountDirectory;
import com.codeheadsystems.lockr.server.store.EntryStore;
import com.codeheadsystems.lockr.server.store.InMemoryAccountDirectory;
import com.codeheadsystems.lockr.server.store.InMemoryEntryStore;
import com.codeheadsystems.lockr.server.store.InMemoryResetTokenStore;
import com.codeheadsystems.lockr.server.store.InMemorySessionRegistry;
import com.codeheadsystems.lockr.server.store.SessionRegistry;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the lockr vault into an existing Dropwizard application.
 * <p>
 * Registers the vault and vault-reset JAX-RS resources, the error mapper, the bearer token
 * authentication filter, the {@code cipher-engine} health check and the maintenance sweeper.
 * Requires a {@link LockrConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new LockrBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent entries, your account directory and a real reset token channel:
 * <pre>{@code
 *   bootstrap.addBundle(new LockrBundle<>(myEntryStore, myAccounts, myMailer));
 * }</pre>
 * Sessions, attempt counters and reset tokens are always held in memory; they are short lived and
 * losing them on restart only forces users to unlock again.
 */
@Singleton
public class LockrBundle<C extends LockrConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(LockrBundle.class);

  private final EntryStore entryStore;
  private final AccountDirectory accountDirectory;
  private final ResetTokenDelivery resetTokenDelivery;
  private final Clock clock;
  private AccessTokenManager accessTokenManager;

  /**
   * Creates a bundle backed by in-memory stores, an empty account directory and a reset token
   * delivery that only logs.
   * <p>
   * For dev/test only. All vault entries are lost on restart.
   */
  public LockrBundle() {
    this(new InMemoryEntryStore(), new InMemoryAccountDirectory(), new LoggingResetTokenDelivery());
    log.warn("""
        #################################################################
        # WARNING: Using ephemeral in-memory vault storage and an empty  #
        # account directory. All vault entries will be lost on restart.  #
        # Do not use in production.                                      #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied collaborators.
   *
   * @param entryStore         where sealed entries live
   * @param accountDirectory   the accounts known to the authentication layer
   * @param resetTokenDelivery the out-of-band channel for reset tokens
   */
  @Inject
  public LockrBundle(EntryStore entryStore,
                     AccountDirectory accountDirectory,
                     ResetTokenDelivery resetTokenDelivery) {
    this.entryStore = entryStore;
    this.accountDirectory = accountDirectory;
    this.resetTokenDelivery = resetTokenDelivery;
    this.clock = Clock.systemUTC();
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    VaultPolicy policy = configuration.toVaultPolicy();
    VaultCipherSuite suite = VaultCipherSuite.fromName(configuration.getCipherSuite());
    CipherEngine cipherEngine = new AesGcmCipherEngine(suite);
    SecurityAuditLog auditLog = new Slf4jSecurityAuditLog();

    SessionRegistry sessionRegistry = new InMemorySessionRegistry(clock, policy.sessionTtl());
    UnlockAttemptLimiter attemptLimiter = new UnlockAttemptLimiter(clock, policy.maxUnlockFailures(),
        policy.maxUnlockFailuresPerAddress(), policy.unlockWindow());
    UserVaultGates gates = new UserVaultGates();
    VaultEntryCodec codec = new VaultEntryCodec();
    KeyCheckWriter keyCheckWriter = new KeyCheckWriter(cipherEngine, entryStore, codec, clock);

    ExecutorService deliveryExecutor = environment.lifecycle()
        .executorService("vault-reset-delivery-%d")
        .minThreads(1)
        .maxThreads(1)
        .build();

    VaultUnlockManager unlockManager = new VaultUnlockManager(cipherEngine, entryStore, sessionRegistry,
        attemptLimiter, accountDirectory, gates, keyCheckWriter, auditLog, policy);
    KeyRotationManager rotationManager = new KeyRotationManager(cipherEngine, entryStore, sessionRegistry,
        gates, auditLog, clock);
    VaultEntryManager entryManager = new VaultEntryManager(cipherEngine, entryStore, sessionRegistry,
        gates, codec, auditLog, clock);
    VaultResetManager resetManager = new VaultResetManager(entryStore, sessionRegistry, attemptLimiter,
        new InMemoryResetTokenStore(), accountDirectory, resetTokenDelivery, deliveryExecutor, gates,
        keyCheckWriter, auditLog, suite, policy, clock);

    environment.jersey().register(new VaultResource(unlockManager, rotationManager, entryManager,
        new PasswordGenerator()));
    environment.jersey().register(new VaultResetResource(resetManager));
    environment.jersey().register(new VaultExceptionMapper());
    environment.healthChecks().register("cipher-engine", new CipherEngineHealthCheck(cipherEngine));

    // Bearer auth filter, applied to @PermitAll resource methods
    accessTokenManager = buildAccessTokenManager(configuration);
    VaultAuthenticator authenticator = new VaultAuthenticator(accessTokenManager);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<VaultPrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(VaultPrincipal.class));

    VaultMaintenanceTask maintenanceTask = new VaultMaintenanceTask(sessionRegistry, attemptLimiter,
        resetManager, policy.sweepInterval());
    environment.lifecycle().manage(new VaultMaintenanceManaged(maintenanceTask));

    log.info("Lockr vault wired (suite={}, sessionTtl={}, maxUnlockFailures={})",
        suite, policy.sessionTtl(), policy.maxUnlockFailures());
  }

  /**
   * The token manager built in {@link #run}. Applications use it to hand out bearer tokens once
   * their own login has succeeded.
   *
   * @return the access token manager, or null before the bundle has run
   */
  public AccessTokenManager getAccessTokenManager() {
    return accessTokenManager;
  }

  private AccessTokenManager buildAccessTokenManager(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new AccessTokenManager(secret, configuration.getJwtIssuer(),
        configuration.getJwtTtlSeconds(), clock);
  }
}
