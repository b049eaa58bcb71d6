package com.codeheadsystems.lockr.server.store;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link AccountDirectory} for development and tests.
 */
public class InMemoryAccountDirectory implements AccountDirectory {

  private static final Logger log = LoggerFactory.getLogger(InMemoryAccountDirectory.class);

  private final ConcurrentHashMap<String, Account> byId = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Account> byEmail = new ConcurrentHashMap<>();

  /**
   * Adds or replaces an account.
   *
   * @param account the account
   * @return this directory
   */
  public InMemoryAccountDirectory register(Account account) {
    Account previous = byId.put(account.userId(), account);
    if (previous != null) {
      byEmail.remove(normalize(previous.email()));
    }
    byEmail.put(normalize(account.email()), account);
    log.debug("register(userId={})", account.userId());
    return this;
  }

  @Override
  public Optional<Account> findById(String userId) {
    return userId == null ? Optional.empty() : Optional.ofNullable(byId.get(userId));
  }

  @Override
  public Optional<Account> findByEmail(String email) {
    return email == null ? Optional.empty() : Optional.ofNullable(byEmail.get(normalize(email)));
  }

  private static String normalize(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }
}
