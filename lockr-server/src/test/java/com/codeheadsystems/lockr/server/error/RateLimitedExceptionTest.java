package com.codeheadsystems.lockr.server.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RateLimitedExceptionTest {

  @Test
  void retryAfterSeconds_wholeSeconds_areKept() {
    assertThat(new RateLimitedException("x", Duration.ofSeconds(90)).retryAfterSeconds()).isEqualTo(90);
  }

  @Test
  void retryAfterSeconds_fractions_roundUp() {
    assertThat(new RateLimitedException("x", Duration.ofMillis(90_001)).retryAfterSeconds()).isEqualTo(91);
  }

  @Test
  void retryAfterSeconds_neverBelowOne() {
    assertThat(new RateLimitedException("x", Duration.ZERO).retryAfterSeconds()).isEqualTo(1);
    assertThat(new RateLimitedException("x", Duration.ofMillis(10)).retryAfterSeconds()).isEqualTo(1);
  }

  @Test
  void code_isRateLimited() {
    assertThat(new RateLimitedException("x", Duration.ofSeconds(1)).code()).isEqualTo(VaultErrorCode.RATE_LIMITED);
  }
}
