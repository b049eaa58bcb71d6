package com.codeheadsystems.lockr.server.store;

import java.util.Optional;

/**
 * Read-only view of the account system that owns users and their email addresses.
 */
public interface AccountDirectory {

  /**
   * Find by id.
   *
   * @param userId the user id
   * @return the account
   */
  Optional<Account> findById(String userId);

  /**
   * Find by email, ignoring case.
   *
   * @param email the email
   * @return the account
   */
  Optional<Account> findByEmail(String email);
}
