package com.codeheadsystems.lockr.dropwizard.auth;

import com.codeheadsystems.lockr.server.auth.AccessTokenManager;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that validates bearer tokens using {@link AccessTokenManager}.
 */
public class VaultAuthenticator implements Authenticator<String, VaultPrincipal> {

  private final AccessTokenManager accessTokenManager;

  /**
   * Instantiates a new vault authenticator.
   *
   * @param accessTokenManager the access token manager
   */
  public VaultAuthenticator(AccessTokenManager accessTokenManager) {
    this.accessTokenManager = accessTokenManager;
  }

  @Override
  public Optional<VaultPrincipal> authenticate(String token) throws AuthenticationException {
    return accessTokenManager.verify(token).map(VaultPrincipal::new);
  }
}
