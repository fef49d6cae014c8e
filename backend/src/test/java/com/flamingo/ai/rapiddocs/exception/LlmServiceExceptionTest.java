package com.flamingo.ai.rapiddocs.exception;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LlmServiceExceptionTest {

  @Test
  void shouldDetectRateLimit_whenCauseMentions429() {
    LlmServiceException ex =
        new LlmServiceException("failed", new RuntimeException("status code 429"));

    assertThat(ex.isRateLimited()).isTrue();
    assertThat(ex.getUserMessage()).contains("temporarily busy");
  }

  @Test
  void shouldDetectRateLimit_whenNestedCauseMentionsRateLimit() {
    LlmServiceException ex =
        new LlmServiceException(
            "failed",
            new IllegalStateException("wrapped", new RuntimeException("Rate limit reached")));

    assertThat(ex.isRateLimited()).isTrue();
  }

  @Test
  void shouldNotFlagOtherFailures() {
    assertThat(new LlmServiceException("provider down").isRateLimited()).isFalse();
    assertThat(
            new LlmServiceException("failed", new RuntimeException("connection reset"))
                .isRateLimited())
        .isFalse();
  }
}
