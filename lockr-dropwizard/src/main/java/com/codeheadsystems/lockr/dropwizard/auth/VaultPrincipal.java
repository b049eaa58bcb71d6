package com.codeheadsystems.lockr.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing an authenticated vault user.
 *
 * @param userId user id from the bearer token subject
 */
public record VaultPrincipal(String userId) implements Principal {

  @Override
  public String getName() {
    return userId;
  }
}
