package com.codeheadsystems.lockr.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.lockr.model.ErrorResponse;
import com.codeheadsystems.lockr.model.reset.ResetTokenRequest;
import com.codeheadsystems.lockr.model.reset.ResetTokenResponse;
import com.codeheadsystems.lockr.model.reset.VaultResetRequest;
import com.codeheadsystems.lockr.model.reset.VaultResetResponse;
import com.codeheadsystems.lockr.model.vault.EntryListResponse;
import com.codeheadsystems.lockr.model.vault.EntryRequest;
import com.codeheadsystems.lockr.model.vault.EntryResponse;
import com.codeheadsystems.lockr.model.vault.GeneratePasswordRequest;
import com.codeheadsystems.lockr.model.vault.GeneratePasswordResponse;
import com.codeheadsystems.lockr.model.vault.KeyRotationRequest;
import com.codeheadsystems.lockr.model.vault.KeyRotationResponse;
import com.codeheadsystems.lockr.model.vault.UnlockRequest;
import com.codeheadsystems.lockr.model.vault.UnlockResponse;
import com.codeheadsystems.lockr.model.vault.VaultEntryPayload;
import com.codeheadsystems.lockr.model.vault.VaultStatusResponse;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.client.Invocation;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Dropwizard integration tests for {@link LockrBundle}.
 * <p>
 * Starts a real embedded Jetty server using the test configuration and exercises the vault over
 * HTTP. Each test works on its own user so the shared server state does not leak between tests.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class LockrBundleIntegrationTest {

  static final DropwizardAppExtension<LockrConfiguration> APP =
      new DropwizardAppExtension<>(
          LockrTestApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final SecureRandom RANDOM = new SecureRandom();

  // ── Health check ─────────────────────────────────────────────────────────

  @Test
  void healthCheckReportsHealthy() {
    Response response = APP.client()
        .target(String.format("http://localhost:%d/healthcheck", APP.getAdminPort()))
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.readEntity(String.class)).contains("cipher-engine");
  }

  // ── Authentication ───────────────────────────────────────────────────────

  @Test
  void vaultCall_noToken_returns401() {
    Response response = APP.client().target(url("/vault/status")).request().get();

    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void vaultCall_bogusToken_returns401() {
    Response response = APP.client().target(url("/vault/status")).request()
        .header(HttpHeaders.AUTHORIZATION, "Bearer not-a-real-token")
        .get();

    assertThat(response.getStatus()).isEqualTo(401);
  }

  // ── Unlock, entries, rotation ────────────────────────────────────────────

  @Test
  void unlockCreateRotateAndUnlockWithNewKey() {
    String k1 = newKey();
    String k2 = newKey();

    assertThat(unlock("alice", k1).getStatus()).isEqualTo(200);
    assertThat(createEntry("alice", "github").getStatus()).isEqualTo(200);
    assertThat(createEntry("alice", "mail").getStatus()).isEqualTo(200);

    Response rotate = as("alice", "/vault/rotate-key").post(Entity.json(new KeyRotationRequest(k1, k2)));
    assertThat(rotate.getStatus()).isEqualTo(200);
    KeyRotationResponse rotation = rotate.readEntity(KeyRotationResponse.class);
    assertThat(rotation.outcome()).isEqualTo("ROTATED");
    assertThat(rotation.rotated()).isEqualTo(2);

    assertThat(as("alice", "/vault/lock").post(Entity.json("{}")).getStatus()).isEqualTo(200);
    VaultStatusResponse status = as("alice", "/vault/status").get().readEntity(VaultStatusResponse.class);
    assertThat(status.unlocked()).isFalse();

    Response oldKey = unlock("alice", k1);
    assertThat(oldKey.getStatus()).isEqualTo(403);
    assertThat(oldKey.readEntity(ErrorResponse.class).code()).isEqualTo("INVALID_KEY");

    Response newKey = unlock("alice", k2);
    assertThat(newKey.getStatus()).isEqualTo(200);
    assertThat(newKey.readEntity(UnlockResponse.class).unlocked()).isTrue();

    EntryListResponse listing = as("alice", "/vault/entries").get().readEntity(EntryListResponse.class);
    assertThat(listing.entries()).extracting(e -> e.payload().title()).containsExactlyInAnyOrder("github", "mail");
    assertThat(listing.unreadable()).isZero();
  }

  @Test
  void entryLifecycle() {
    assertThat(unlock("erin", newKey()).getStatus()).isEqualTo(200);
    EntryResponse created = createEntry("erin", "bank").readEntity(EntryResponse.class);

    VaultEntryPayload changed = new VaultEntryPayload("bank", "erin", null, "new-password", null, null);
    Response update = as("erin", "/vault/entries/" + created.id())
        .put(Entity.json(new EntryRequest("finance", true, changed)));
    assertThat(update.getStatus()).isEqualTo(200);
    EntryResponse updated = update.readEntity(EntryResponse.class);
    assertThat(updated.category()).isEqualTo("finance");
    assertThat(updated.favorite()).isTrue();
    EntryListResponse favorites = as("erin", "/vault/entries?favorite=true").get()
        .readEntity(EntryListResponse.class);
    assertThat(favorites.entries()).extracting(EntryResponse::id).containsExactly(created.id());
    assertThat(updated.payload().password()).isEqualTo("new-password");

    assertThat(as("erin", "/vault/entries/" + created.id()).delete().getStatus()).isEqualTo(204);
    Response missing = as("erin", "/vault/entries/" + created.id()).get();
    assertThat(missing.getStatus()).isEqualTo(404);
    assertThat(missing.readEntity(ErrorResponse.class).code()).isEqualTo("NOT_FOUND");
  }

  @Test
  void entriesWithoutSession_returnSessionRequired() {
    Response response = as("dave", "/vault/entries").get();

    assertThat(response.getStatus()).isEqualTo(403);
    assertThat(response.readEntity(ErrorResponse.class).code()).isEqualTo("SESSION_REQUIRED");
  }

  @Test
  void malformedKey_returnsValidationError() {
    Response response = unlock("dave", "not base64!");

    assertThat(response.getStatus()).isEqualTo(400);
    assertThat(response.readEntity(ErrorResponse.class).code()).isEqualTo("VALIDATION_ERROR");
  }

  @Test
  void generatePassword_worksWithoutSessionAndHonoursOptions() {
    Response response = as("dave", "/vault/generate-password")
        .post(Entity.json(new GeneratePasswordRequest(32, null, null, null, true, null, null)));

    assertThat(response.getStatus()).isEqualTo(200);
    GeneratePasswordResponse generated = response.readEntity(GeneratePasswordResponse.class);
    assertThat(generated.password()).hasSize(32);
    assertThat(generated.options().includeSymbols()).isTrue();

    Response tooShort = as("dave", "/vault/generate-password")
        .post(Entity.json(new GeneratePasswordRequest(4, null, null, null, null, null, null)));
    assertThat(tooShort.getStatus()).isEqualTo(400);
    assertThat(tooShort.readEntity(ErrorResponse.class).code()).isEqualTo("VALIDATION_ERROR");
  }

  // ── Attempt limiting ─────────────────────────────────────────────────────

  @Test
  void repeatedWrongKeys_areRateLimited() {
    String right = newKey();
    assertThat(unlock("bob", right).getStatus()).isEqualTo(200);
    assertThat(createEntry("bob", "router").getStatus()).isEqualTo(200);
    as("bob", "/vault/lock").post(Entity.json("{}"));

    // maxUnlockFailures is 3 in test-config.yml
    for (int i = 0; i < 3; i++) {
      assertThat(unlock("bob", newKey()).getStatus()).isEqualTo(403);
    }
    Response limited = unlock("bob", right);

    assertThat(limited.getStatus()).isEqualTo(429);
    assertThat(limited.getHeaderString(HttpHeaders.RETRY_AFTER)).isNotBlank();
    ErrorResponse error = limited.readEntity(ErrorResponse.class);
    assertThat(error.code()).isEqualTo("RATE_LIMITED");
    assertThat(error.retryAfterSeconds()).isPositive();
  }

  // ── Vault reset ──────────────────────────────────────────────────────────

  @Test
  void resetDestroysEntriesAndSealsUnderNewKey() throws Exception {
    String lost = newKey();
    String replacement = newKey();
    assertThat(unlock("carol", lost).getStatus()).isEqualTo(200);
    assertThat(createEntry("carol", "forgotten").getStatus()).isEqualTo(200);

    Response request = APP.client().target(url("/vault-reset/request")).request()
        .post(Entity.json(new ResetTokenRequest(LockrTestApplication.emailOf("carol"), true)));
    assertThat(request.getStatus()).isEqualTo(200);
    String token = application().tokenFor("carol").get(5, TimeUnit.SECONDS);

    Response complete = APP.client().target(url("/vault-reset/complete")).request()
        .post(Entity.json(new VaultResetRequest(token, true, replacement)));
    assertThat(complete.getStatus()).isEqualTo(200);
    VaultResetResponse result = complete.readEntity(VaultResetResponse.class);
    assertThat(result.entriesDestroyed()).isEqualTo(1);
    assertThat(result.entriesRemaining()).isZero();
    assertThat(result.complete()).isTrue();

    assertThat(as("carol", "/vault/status").get().readEntity(VaultStatusResponse.class).unlocked()).isFalse();
    assertThat(unlock("carol", lost).getStatus()).isEqualTo(403);
    assertThat(unlock("carol", replacement).getStatus()).isEqualTo(200);
    assertThat(as("carol", "/vault/entries").get().readEntity(EntryListResponse.class).entries()).isEmpty();

    Response reused = APP.client().target(url("/vault-reset/complete")).request()
        .post(Entity.json(new VaultResetRequest(token, true, null)));
    assertThat(reused.getStatus()).isEqualTo(400);
    assertThat(reused.readEntity(ErrorResponse.class).code()).isEqualTo("INVALID_TOKEN");
  }

  @Test
  void resetRequest_unknownEmail_looksTheSame() {
    Response response = APP.client().target(url("/vault-reset/request")).request()
        .post(Entity.json(new ResetTokenRequest("nobody@example.com", true)));

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.readEntity(ResetTokenResponse.class).message()).contains("If an account with this email exists");
  }

  @Test
  void resetRequest_unconfirmed_isRejected() {
    Response response = APP.client().target(url("/vault-reset/request")).request()
        .post(Entity.json(new ResetTokenRequest(LockrTestApplication.emailOf("dave"), false)));

    assertThat(response.getStatus()).isEqualTo(400);
    assertThat(response.readEntity(ErrorResponse.class).code()).isEqualTo("VALIDATION_ERROR");
  }

  // ── Helpers ──────────────────────────────────────────────────────────────

  private static LockrTestApplication application() {
    return APP.getApplication();
  }

  private static String url(String path) {
    return String.format("http://localhost:%d%s", APP.getLocalPort(), path);
  }

  private static Invocation.Builder as(String userId, String path) {
    String token = application().bundle().getAccessTokenManager().issueToken(userId);
    return APP.client().target(url(path)).request()
        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token);
  }

  private static Response unlock(String userId, String key) {
    return as(userId, "/vault/unlock").post(Entity.json(new UnlockRequest(key)));
  }

  private static Response createEntry(String userId, String title) {
    VaultEntryPayload payload = new VaultEntryPayload(title, userId, null, "pw-" + title, null, null);
    return as(userId, "/vault/entries").post(Entity.json(new EntryRequest("login", null, payload)));
  }

  private static String newKey() {
    byte[] bytes = new byte[32];
    RANDOM.nextBytes(bytes);
    return Base64.getEncoder().encodeToString(bytes);
  }
}
