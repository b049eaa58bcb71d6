package com.codeheadsystems.lockr.server.resource;

import com.codeheadsystems.lockr.model.reset.ResetTokenRequest;
import com.codeheadsystems.lockr.model.reset.ResetTokenResponse;
import com.codeheadsystems.lockr.model.reset.VaultResetRequest;
import com.codeheadsystems.lockr.model.reset.VaultResetResponse;
import com.codeheadsystems.lockr.server.error.VaultException;
import com.codeheadsystems.lockr.server.manager.VaultResetManager;
import com.codeheadsystems.lockr.server.manager.VaultResetResult;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unauthenticated lost-key recovery endpoints. Whoever lost their key has usually lost their
 * login too, so possession of the emailed token is the only credential.
 */
@Path("/vault-reset")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class VaultResetResource {

  private static final Logger log = LoggerFactory.getLogger(VaultResetResource.class);

  private final VaultResetManager resetManager;

  public VaultResetResource(VaultResetManager resetManager) {
    this.resetManager = resetManager;
  }

  @POST
  @Path("/request")
  public ResetTokenResponse request(@Context HttpServletRequest request, ResetTokenRequest body) {
    log.debug("request()");
    if (body == null) {
      throw VaultException.validation("Request body is required");
    }
    return new ResetTokenResponse(
        resetManager.requestReset(body.email(), body.confirmed(), RequestContexts.address(request)));
  }

  @POST
  @Path("/complete")
  public VaultResetResponse complete(@Context HttpServletRequest request, VaultResetRequest body) {
    log.debug("complete()");
    if (body == null) {
      throw VaultException.validation("Request body is required");
    }
    VaultResetResult result = resetManager.completeReset(body.token(), body.confirmed(), body.newKey(),
        RequestContexts.address(request));
    return new VaultResetResponse(result.entriesDestroyed(), result.entriesRemaining(),
        result.complete(), result.completedAt().toString());
  }
}
