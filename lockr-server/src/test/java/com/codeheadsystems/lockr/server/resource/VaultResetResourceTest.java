package com.codeheadsystems.lockr.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.codeheadsystems.lockr.model.reset.ResetTokenRequest;
import com.codeheadsystems.lockr.model.reset.VaultResetRequest;
import com.codeheadsystems.lockr.model.reset.VaultResetResponse;
import com.codeheadsystems.lockr.server.manager.VaultResetManager;
import com.codeheadsystems.lockr.server.manager.VaultResetResult;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VaultResetResourceTest {

  @Mock private VaultResetManager resetManager;
  @Mock private HttpServletRequest httpRequest;

  private VaultResetResource resource;

  @BeforeEach
  void setUp() {
    resource = new VaultResetResource(resetManager);
    when(httpRequest.getRemoteAddr()).thenReturn("192.0.2.9");
  }

  @Test
  void request_returnsManagerMessage() {
    when(resetManager.requestReset("a@example.com", true, "192.0.2.9"))
        .thenReturn(VaultResetManager.REQUEST_ACKNOWLEDGEMENT);

    assertThat(resource.request(httpRequest, new ResetTokenRequest("a@example.com", true)).message())
        .isEqualTo(VaultResetManager.REQUEST_ACKNOWLEDGEMENT);
  }

  @Test
  void complete_reportsBlastRadius() {
    Instant at = Instant.parse("2026-03-01T12:00:00Z");
    when(resetManager.completeReset("tok", true, null, "192.0.2.9"))
        .thenReturn(new VaultResetResult("user-1", 7, 0, true, at));

    VaultResetResponse response = resource.complete(httpRequest, new VaultResetRequest("tok", true, null));

    assertThat(response.entriesDestroyed()).isEqualTo(7);
    assertThat(response.entriesRemaining()).isZero();
    assertThat(response.complete()).isTrue();
    assertThat(response.completedAt()).isEqualTo("2026-03-01T12:00:00Z");
  }
}
