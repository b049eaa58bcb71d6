package com.codeheadsystems.lockr.server.resource;

import com.codeheadsystems.lockr.model.vault.EntryListResponse;
import com.codeheadsystems.lockr.model.vault.EntryRequest;
import com.codeheadsystems.lockr.model.vault.EntryResponse;
import com.codeheadsystems.lockr.model.vault.GeneratePasswordRequest;
import com.codeheadsystems.lockr.model.vault.GeneratePasswordResponse;
import com.codeheadsystems.lockr.model.vault.KeyRotationRequest;
import com.codeheadsystems.lockr.model.vault.KeyRotationResponse;
import com.codeheadsystems.lockr.model.vault.LockResponse;
import com.codeheadsystems.lockr.model.vault.UnlockRequest;
import com.codeheadsystems.lockr.model.vault.UnlockResponse;
import com.codeheadsystems.lockr.model.vault.VaultStatusResponse;
import com.codeheadsystems.lockr.server.error.VaultErrorCode;
import com.codeheadsystems.lockr.server.error.VaultException;
import com.codeheadsystems.lockr.server.manager.DecryptedEntry;
import com.codeheadsystems.lockr.server.manager.EntryListing;
import com.codeheadsystems.lockr.server.manager.KeyRotationManager;
import com.codeheadsystems.lockr.server.manager.KeyRotationResult;
import com.codeheadsystems.lockr.server.manager.PasswordGenerator;
import com.codeheadsystems.lockr.server.manager.PasswordOptions;
import com.codeheadsystems.lockr.server.manager.VaultEntryManager;
import com.codeheadsystems.lockr.server.manager.VaultUnlockManager;
import com.codeheadsystems.lockr.server.store.UnlockSession;
import jakarta.annotation.security.PermitAll;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.SecurityContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for an authenticated user's own vault.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /vault/unlock}: verify a key and open an unlock session</li>
 *   <li>{@code POST /vault/lock}: close the session</li>
 *   <li>{@code GET /vault/status}: is the vault unlocked</li>
 *   <li>{@code POST /vault/rotate-key}: re-seal every entry under a new key</li>
 *   <li>{@code GET|POST /vault/entries}: list or create entries</li>
 *   <li>{@code GET|PUT|DELETE /vault/entries/{id}}: read, replace or delete one entry</li>
 *   <li>{@code POST /vault/generate-password}: a random password; needs no unlock session</li>
 * </ul>
 * The user id always comes from the authenticated principal, never from the request body.
 */
@Path("/vault")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class VaultResource {

  private static final Logger log = LoggerFactory.getLogger(VaultResource.class);

  private final VaultUnlockManager unlockManager;
  private final KeyRotationManager rotationManager;
  private final VaultEntryManager entryManager;
  private final PasswordGenerator passwordGenerator;

  public VaultResource(VaultUnlockManager unlockManager,
                       KeyRotationManager rotationManager,
                       VaultEntryManager entryManager,
                       PasswordGenerator passwordGenerator) {
    this.unlockManager = unlockManager;
    this.rotationManager = rotationManager;
    this.entryManager = entryManager;
    this.passwordGenerator = passwordGenerator;
  }

  // ── Unlock / lock ────────────────────────────────────────────────────────

  @POST
  @Path("/unlock")
  @PermitAll
  public UnlockResponse unlock(@Context SecurityContext securityContext,
                               @Context HttpServletRequest request,
                               UnlockRequest body) {
    String userId = RequestContexts.userId(securityContext);
    log.debug("unlock()");
    if (body == null) {
      throw VaultException.validation("Request body is required");
    }
    UnlockSession session = unlockManager.unlock(userId, body.encryptionKey(), RequestContexts.address(request));
    session.encryptionKey().destroy();
    return new UnlockResponse(true, session.expiresAt().toString());
  }

  @POST
  @Path("/lock")
  @PermitAll
  public LockResponse lock(@Context SecurityContext securityContext) {
    unlockManager.lock(RequestContexts.userId(securityContext));
    return new LockResponse(true);
  }

  @GET
  @Path("/status")
  @PermitAll
  public VaultStatusResponse status(@Context SecurityContext securityContext) {
    return unlockManager.status(RequestContexts.userId(securityContext))
        .map(expiresAt -> new VaultStatusResponse(true, expiresAt.toString()))
        .orElseGet(VaultStatusResponse::locked);
  }

  // ── Key rotation ─────────────────────────────────────────────────────────

  /**
   * Rotation that finds entries but cannot move any of them is reported as
   * {@code ROTATION_INEFFECTIVE} rather than as a success.
   */
  @POST
  @Path("/rotate-key")
  @PermitAll
  public KeyRotationResponse rotateKey(@Context SecurityContext securityContext, KeyRotationRequest body) {
    String userId = RequestContexts.userId(securityContext);
    if (body == null) {
      throw VaultException.validation("Request body is required");
    }
    KeyRotationResult result = rotationManager.rotate(userId, body.currentKey(), body.newKey());
    if (result.outcome() == KeyRotationResult.Outcome.INEFFECTIVE) {
      throw new VaultException(VaultErrorCode.ROTATION_INEFFECTIVE,
          "No entries could be decrypted with the current key; " + result.skipped()
              + " entries were left unchanged and the vault key was not changed");
    }
    return new KeyRotationResponse(result.outcome().name(), result.rotated(), result.skipped(),
        result.rotatedIds(), result.skippedIds());
  }

  // ── Entries ──────────────────────────────────────────────────────────────

  @GET
  @Path("/entries")
  @PermitAll
  public EntryListResponse listEntries(@Context SecurityContext securityContext,
                                       @QueryParam("category") String category,
                                       @QueryParam("favorite") boolean favoritesOnly) {
    EntryListing listing = entryManager.listEntries(RequestContexts.userId(securityContext), category,
        favoritesOnly);
    return new EntryListResponse(
        listing.entries().stream().map(VaultResource::toResponse).toList(),
        listing.unreadable());
  }

  @POST
  @Path("/entries")
  @PermitAll
  public EntryResponse createEntry(@Context SecurityContext securityContext, EntryRequest body) {
    String userId = RequestContexts.userId(securityContext);
    if (body == null) {
      throw VaultException.validation("Request body is required");
    }
    return toResponse(entryManager.createEntry(userId, body.category(), Boolean.TRUE.equals(body.favorite()),
        body.payload()));
  }

  @GET
  @Path("/entries/{id}")
  @PermitAll
  public EntryResponse getEntry(@Context SecurityContext securityContext, @PathParam("id") String id) {
    return toResponse(entryManager.getEntry(RequestContexts.userId(securityContext), id));
  }

  @PUT
  @Path("/entries/{id}")
  @PermitAll
  public EntryResponse updateEntry(@Context SecurityContext securityContext,
                                   @PathParam("id") String id,
                                   EntryRequest body) {
    String userId = RequestContexts.userId(securityContext);
    if (body == null) {
      throw VaultException.validation("Request body is required");
    }
    return toResponse(entryManager.updateEntry(userId, id, body.category(), body.favorite(), body.payload()));
  }

  @DELETE
  @Path("/entries/{id}")
  @PermitAll
  public void deleteEntry(@Context SecurityContext securityContext, @PathParam("id") String id) {
    entryManager.deleteEntry(RequestContexts.userId(securityContext), id);
  }

  // ── Password generation ──────────────────────────────────────────────────

  @POST
  @Path("/generate-password")
  @PermitAll
  public GeneratePasswordResponse generatePassword(@Context SecurityContext securityContext,
                                                   GeneratePasswordRequest body) {
    log.debug("generatePassword(userId={})", RequestContexts.userId(securityContext));
    GeneratePasswordRequest request = body == null
        ? new GeneratePasswordRequest(null, null, null, null, null, null, null)
        : body;
    PasswordOptions options = PasswordOptions.withDefaults(request.length(), request.includeUppercase(),
        request.includeLowercase(), request.includeNumbers(), request.includeSymbols(),
        request.excludeSimilar(), request.excludeAmbiguous());
    String password = passwordGenerator.generate(options);
    return new GeneratePasswordResponse(password, new GeneratePasswordRequest(options.length(),
        options.uppercase(), options.lowercase(), options.digits(), options.symbols(),
        options.excludeSimilar(), options.excludeAmbiguous()));
  }

  private static EntryResponse toResponse(DecryptedEntry entry) {
    return new EntryResponse(entry.id(), entry.category(), entry.favorite(), entry.payload(),
        entry.createdAt().toString(), entry.updatedAt().toString());
  }
}
